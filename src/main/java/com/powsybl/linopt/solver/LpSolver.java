/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static com.powsybl.linopt.util.Markers.PERFORMANCE_MARKER;

/**
 * Entry point solving an LP problem file with the backend named by {@link LpSolverParameters#getSolverName()}.
 *
 * @author powsybl-linopt contributors
 */
public final class LpSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(LpSolver.class);

    private LpSolver() {
    }

    public static SolverResult solve(SolverFiles files, LpSolverParameters parameters) {
        Objects.requireNonNull(parameters);
        SolverBackend backend = SolverBackendFactory.find(parameters.getSolverName()).create(parameters);
        return solve(backend, files, parameters);
    }

    public static SolverResult solve(SolverBackend backend, SolverFiles files, LpSolverParameters parameters) {
        Objects.requireNonNull(backend);
        Objects.requireNonNull(files);
        Objects.requireNonNull(parameters);
        LOGGER.debug("Solving '{}' with {} and {}", files.getProblemFile(), backend.getName(), parameters);
        Stopwatch stopwatch = Stopwatch.createStarted();
        SolverResult result = backend.solve(files, parameters);
        stopwatch.stop();
        LOGGER.info(PERFORMANCE_MARKER, "LP problem '{}' solved by {} in {} ms: {}", files.getProblemFile(), backend.getName(),
                stopwatch.elapsed(TimeUnit.MILLISECONDS), result);
        return result;
    }
}
