/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Plays a solver run: copies a solution resource to the solution file and optionally writes a basis file.
 *
 * @author powsybl-linopt contributors
 */
class FakeSolverProcessExecutor implements SolverProcessExecutor {

    private final String solutionResource;

    private final Path solutionFile;

    private final Path basisFile;

    private final int exitCode;

    private final List<List<String>> commands = new ArrayList<>();

    private final List<Optional<Path>> outputFiles = new ArrayList<>();

    FakeSolverProcessExecutor(String solutionResource, Path solutionFile, Path basisFile, int exitCode) {
        this.solutionResource = solutionResource;
        this.solutionFile = solutionFile;
        this.basisFile = basisFile;
        this.exitCode = exitCode;
    }

    @Override
    public int execute(List<String> command, Optional<Path> outputFile) {
        commands.add(command);
        outputFiles.add(outputFile);
        try {
            if (solutionResource != null) {
                try (InputStream is = Objects.requireNonNull(getClass().getResourceAsStream(solutionResource))) {
                    Files.copy(is, solutionFile);
                }
            }
            if (basisFile != null) {
                Files.writeString(basisFile, "NAME\nENDATA\n");
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return exitCode;
    }

    List<String> getLastCommand() {
        return commands.get(commands.size() - 1);
    }

    Optional<Path> getLastOutputFile() {
        return outputFiles.get(outputFiles.size() - 1);
    }
}
