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
 * Runs the COIN-OR CBC executable. The solver console output goes to the log file when one is given.
 *
 * @author powsybl-linopt contributors
 */
public class CbcSolverBackend extends AbstractExternalSolverBackend {

    public static final String NAME = "cbc";

    public CbcSolverBackend(SolverProcessExecutor executor) {
        super(executor);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected List<String> buildCommand(SolverFiles files, LpSolverParameters parameters) {
        List<String> command = new ArrayList<>();
        command.add(parameters.getCbcExecutable());
        command.add("-printingOptions");
        command.add("all");
        command.add("-import");
        command.add(files.getProblemFile().toString());
        files.getWarmStartFile().ifPresent(warmStart -> {
            command.add("-basisI");
            command.add(warmStart.toString());
        });
        command.addAll(splitOptions(parameters.getSolverOptions()));
        command.add("-solve");
        command.add("-solu");
        command.add(files.getSolutionFile().toString());
        if (parameters.isStoreBasis()) {
            command.add("-basisO");
            command.add(files.getBasisFile().toString());
        }
        return command;
    }

    @Override
    protected Optional<Path> getOutputFile(SolverFiles files) {
        return files.getLogFile();
    }

    @Override
    protected SolverResult parseSolution(BufferedReader reader) throws IOException {
        return CbcSolutionParser.parse(reader);
    }
}
