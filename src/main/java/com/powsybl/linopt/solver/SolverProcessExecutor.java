/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Runs a solver executable and blocks until it exits.
 *
 * @author powsybl-linopt contributors
 */
public interface SolverProcessExecutor {

    /**
     * @param command executable followed by its arguments
     * @param outputFile if present, merged standard and error outputs are written to this file
     * @return the process exit code
     * @throws java.io.UncheckedIOException if the process cannot be started
     */
    int execute(List<String> command, Optional<Path> outputFile);
}
