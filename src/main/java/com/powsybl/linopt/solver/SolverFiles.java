/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Paths involved in one solve: the LP problem to read, the solution file to write, and optionally a solver log
 * file and a basis to warm start from.
 *
 * @author powsybl-linopt contributors
 */
public class SolverFiles {

    private static final String SOLUTION_EXTENSION = ".sol";

    private static final String BASIS_EXTENSION = ".bas";

    private final Path problemFile;

    private final Path solutionFile;

    private Path logFile;

    private Path warmStartFile;

    public SolverFiles(Path problemFile, Path solutionFile) {
        this.problemFile = Objects.requireNonNull(problemFile);
        this.solutionFile = Objects.requireNonNull(solutionFile);
    }

    public Path getProblemFile() {
        return problemFile;
    }

    public Path getSolutionFile() {
        return solutionFile;
    }

    public Optional<Path> getLogFile() {
        return Optional.ofNullable(logFile);
    }

    public SolverFiles setLogFile(Path logFile) {
        this.logFile = logFile;
        return this;
    }

    public Optional<Path> getWarmStartFile() {
        return Optional.ofNullable(warmStartFile);
    }

    public SolverFiles setWarmStartFile(Path warmStartFile) {
        this.warmStartFile = warmStartFile;
        return this;
    }

    /**
     * Sibling of the solution file where the basis is stored: {@code .sol} is replaced by {@code .bas}.
     */
    public Path getBasisFile() {
        String fileName = solutionFile.getFileName().toString();
        String basisFileName = fileName.endsWith(SOLUTION_EXTENSION)
                ? fileName.substring(0, fileName.length() - SOLUTION_EXTENSION.length()) + BASIS_EXTENSION
                : fileName + BASIS_EXTENSION;
        return solutionFile.resolveSibling(basisFileName);
    }
}
