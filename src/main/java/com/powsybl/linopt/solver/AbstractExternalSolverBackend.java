/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Backend running a solver executable that reads the LP problem file and writes a solution file.
 *
 * @author powsybl-linopt contributors
 */
public abstract class AbstractExternalSolverBackend implements SolverBackend {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractExternalSolverBackend.class);

    private static final Splitter OPTIONS_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private final SolverProcessExecutor executor;

    protected AbstractExternalSolverBackend(SolverProcessExecutor executor) {
        this.executor = Objects.requireNonNull(executor);
    }

    protected static List<String> splitOptions(String options) {
        return OPTIONS_SPLITTER.splitToList(options);
    }

    protected abstract List<String> buildCommand(SolverFiles files, LpSolverParameters parameters);

    /**
     * File receiving the solver console output, if the solver does not write its log by itself.
     */
    protected abstract Optional<Path> getOutputFile(SolverFiles files);

    protected abstract SolverResult parseSolution(BufferedReader reader) throws IOException;

    @Override
    public SolverResult solve(SolverFiles files, LpSolverParameters parameters) {
        Objects.requireNonNull(files);
        Objects.requireNonNull(parameters);

        List<String> command = buildCommand(files, parameters);
        LOGGER.debug("Running {}", command);
        int exitCode = executor.execute(command, getOutputFile(files));
        if (exitCode != 0) {
            LOGGER.warn("Solver {} exited with code {}", getName(), exitCode);
        }

        Path solutionFile = files.getSolutionFile();
        if (!Files.exists(solutionFile)) {
            throw new SolutionParsingException("Solution file '" + solutionFile + "' not found, " + getName() + " exited with code " + exitCode);
        }
        SolverResult result;
        try (BufferedReader reader = Files.newBufferedReader(solutionFile, StandardCharsets.UTF_8)) {
            result = parseSolution(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        LOGGER.info("Solver {} terminated with status '{}' ({})", getName(), result.getStatus(), result.getTerminationCondition());

        if (parameters.isStoreBasis()) {
            Path basisFile = files.getBasisFile();
            if (Files.exists(basisFile)) {
                result = result.withBasisFile(basisFile);
            } else {
                LOGGER.info("No model basis stored");
            }
        }

        // files of a non optimal problem are kept for inspection
        if (!parameters.isKeepFiles() && result.isOptimal()) {
            deleteFiles(files.getProblemFile(), solutionFile);
        }
        return result;
    }

    static void deleteFiles(Path... files) {
        try {
            for (Path file : files) {
                Files.deleteIfExists(file);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
