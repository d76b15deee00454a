/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import com.powsybl.commons.PowsyblException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.powsybl.linopt.util.Markers.SOLVER_OUTPUT_MARKER;

/**
 * Starts the solver as a child process. When no output file is given, the solver output is forwarded to the
 * debug log.
 *
 * @author powsybl-linopt contributors
 */
public class DefaultSolverProcessExecutor implements SolverProcessExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultSolverProcessExecutor.class);

    @Override
    public int execute(List<String> command, Optional<Path> outputFile) {
        Objects.requireNonNull(command);
        Objects.requireNonNull(outputFile);
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Empty solver command");
        }
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        outputFile.ifPresent(file -> pb.redirectOutput(ProcessBuilder.Redirect.to(file.toFile())));
        try {
            Process process = pb.start();
            if (outputFile.isEmpty()) {
                try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        LOGGER.debug(SOLVER_OUTPUT_MARKER, "{}", line);
                    }
                }
            }
            return process.waitFor();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PowsyblException("Interrupted while waiting for " + command.get(0), e);
        }
    }
}
