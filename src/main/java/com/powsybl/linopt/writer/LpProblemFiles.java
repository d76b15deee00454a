/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.writer;

import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static com.powsybl.linopt.util.Markers.PERFORMANCE_MARKER;

/**
 * Backs an {@link LpProblemWriter} with three temporary section files (objective, constraints, bounds) and
 * assembles them into the final LP file:
 *
 * <pre>
 * \* name *\
 *
 * min
 * obj:
 * ...objective terms...
 *
 * s.t.
 *
 * ...constraints...
 * bounds
 * ...bounds...
 * end
 * </pre>
 *
 * @author powsybl-linopt contributors
 */
public class LpProblemFiles implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(LpProblemFiles.class);

    private final Path objectiveFile;

    private final Path constraintsFile;

    private final Path boundsFile;

    private final BufferedWriter objectiveWriter;

    private final BufferedWriter constraintsWriter;

    private final BufferedWriter boundsWriter;

    private final LpProblemWriter problemWriter;

    private boolean closed = false;

    private LpProblemFiles(Path workingDir, String problemName) throws IOException {
        objectiveFile = Files.createTempFile(workingDir, problemName + "-objective-", ".txt");
        constraintsFile = Files.createTempFile(workingDir, problemName + "-constraints-", ".txt");
        boundsFile = Files.createTempFile(workingDir, problemName + "-bounds-", ".txt");
        objectiveWriter = Files.newBufferedWriter(objectiveFile, StandardCharsets.UTF_8);
        constraintsWriter = Files.newBufferedWriter(constraintsFile, StandardCharsets.UTF_8);
        boundsWriter = Files.newBufferedWriter(boundsFile, StandardCharsets.UTF_8);
        objectiveWriter.write("\\* " + problemName + " *\\\n\nmin\nobj:\n");
        constraintsWriter.write("\n\ns.t.\n\n");
        boundsWriter.write("\nbounds\n");
        problemWriter = new LpProblemWriter(objectiveWriter, constraintsWriter, boundsWriter);
    }

    public static LpProblemFiles create(Path workingDir, String problemName) {
        Objects.requireNonNull(workingDir);
        Objects.requireNonNull(problemName);
        try {
            return new LpProblemFiles(workingDir, problemName);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public LpProblemWriter getWriter() {
        return problemWriter;
    }

    /**
     * Terminates the sections, concatenates them into the problem file and deletes the section files.
     *
     * @return the problem file
     */
    public Path assemble(Path problemFile) {
        Objects.requireNonNull(problemFile);
        if (closed) {
            throw new IllegalStateException("LP problem files already closed");
        }
        Stopwatch stopwatch = Stopwatch.createStarted();
        try {
            boundsWriter.write("end\n");
            closeWriters();
            try (OutputStream os = Files.newOutputStream(problemFile)) {
                for (Path sectionFile : List.of(objectiveFile, constraintsFile, boundsFile)) {
                    Files.copy(sectionFile, os);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } finally {
            try {
                deleteSectionFiles();
            } catch (IOException e) {
                LOGGER.warn("Cannot delete LP section files: {}", e.getMessage());
            }
        }
        TokenAllocator tokenAllocator = problemWriter.getTokenAllocator();
        LOGGER.info(PERFORMANCE_MARKER, "LP problem '{}' with {} variables and {} constraints written in {} ms", problemFile,
                tokenAllocator.getCount(TokenType.VARIABLE), tokenAllocator.getCount(TokenType.CONSTRAINT),
                stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return problemFile;
    }

    private void closeWriters() throws IOException {
        closed = true;
        objectiveWriter.close();
        constraintsWriter.close();
        boundsWriter.close();
    }

    private void deleteSectionFiles() throws IOException {
        Files.deleteIfExists(objectiveFile);
        Files.deleteIfExists(constraintsFile);
        Files.deleteIfExists(boundsFile);
    }

    @Override
    public void close() {
        if (!closed) {
            try {
                closeWriters();
                deleteSectionFiles();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
