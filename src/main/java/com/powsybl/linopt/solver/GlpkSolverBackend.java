/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the GLPK {@code glpsol} executable, which writes its own log file.
 *
 * @author powsybl-linopt contributors
 */
public class GlpkSolverBackend extends AbstractExternalSolverBackend {

    public static final String NAME = "glpk";

    public GlpkSolverBackend(SolverProcessExecutor executor) {
        super(executor);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected List<String> buildCommand(SolverFiles files, LpSolverParameters parameters) {
        List<String> command = new ArrayList<>();
        command.add(parameters.getGlpkExecutable());
        command.add("--lp");
        command.add(files.getProblemFile().toString());
        command.add("--output");
        command.add(files.getSolutionFile().toString());
        files.getLogFile().ifPresent(logFile -> {
            command.add("--log");
            command.add(logFile.toString());
        });
        files.getWarmStartFile().ifPresent(warmStart -> {
            command.add("--ini");
            command.add(warmStart.toString());
        });
        if (parameters.isStoreBasis()) {
            command.add("-w");
            command.add(files.getBasisFile().toString());
        }
        command.addAll(splitOptions(parameters.getSolverOptions()));
        return command;
    }

    @Override
    protected Optional<Path> getOutputFile(SolverFiles files) {
        return Optional.empty();
    }

    @Override
    protected SolverResult parseSolution(BufferedReader reader) throws IOException {
        return GlpkSolutionParser.parse(reader);
    }
}
