/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import com.powsybl.commons.PowsyblException;

/**
 * A solution file is missing or does not follow the layout expected for the solver that wrote it.
 *
 * @author powsybl-linopt contributors
 */
public class SolutionParsingException extends PowsyblException {

    public SolutionParsingException(String message) {
        super(message);
    }

    public SolutionParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
