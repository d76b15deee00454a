/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

/**
 * Solves an LP problem file with one solver dialect and normalizes its outcome.
 *
 * @author powsybl-linopt contributors
 */
public interface SolverBackend {

    String getName();

    /**
     * A non optimal termination is returned as a result, not thrown.
     *
     * @throws SolutionParsingException if the solver output cannot be read
     */
    SolverResult solve(SolverFiles files, LpSolverParameters parameters);
}
