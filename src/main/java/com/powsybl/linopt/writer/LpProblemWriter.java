/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.writer;

import com.powsybl.linopt.array.Axis;
import com.powsybl.linopt.array.Broadcast;
import com.powsybl.linopt.array.LpArray;
import com.powsybl.linopt.array.Scalar;
import com.powsybl.linopt.expr.LinearExpressions;
import com.powsybl.linopt.expr.LpFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Objects;

/**
 * Streams bound, constraint and objective declarations of an LP problem to three sinks.
 * <p>
 * Records are written as soon as they are rendered, so memory use does not depend on the problem size. Tokens
 * come from the writer's own {@link TokenAllocator}, one writer being one LP writing session.
 * <p>
 * A sink failure is rethrown as an {@link UncheckedIOException} and ends the session: every record is written
 * with a single call but records already written are not rolled back.
 *
 * @author powsybl-linopt contributors
 */
public class LpProblemWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(LpProblemWriter.class);

    private final Writer objectiveWriter;

    private final Writer constraintsWriter;

    private final Writer boundsWriter;

    private final TokenAllocator tokenAllocator;

    public LpProblemWriter(Writer objectiveWriter, Writer constraintsWriter, Writer boundsWriter) {
        this(objectiveWriter, constraintsWriter, boundsWriter, new TokenAllocator());
    }

    public LpProblemWriter(Writer objectiveWriter, Writer constraintsWriter, Writer boundsWriter, TokenAllocator tokenAllocator) {
        this.objectiveWriter = Objects.requireNonNull(objectiveWriter);
        this.constraintsWriter = Objects.requireNonNull(constraintsWriter);
        this.boundsWriter = Objects.requireNonNull(boundsWriter);
        this.tokenAllocator = Objects.requireNonNull(tokenAllocator);
    }

    public TokenAllocator getTokenAllocator() {
        return tokenAllocator;
    }

    public LpArray<String> writeBounds(LpArray<Double> lower, LpArray<Double> upper) {
        return writeBounds(lower, upper, Broadcast.of(lower, upper));
    }

    /**
     * Writes bounds over explicitly given axes, needed when both bounds are scalars or unlabeled.
     */
    public LpArray<String> writeBounds(LpArray<Double> lower, LpArray<Double> upper, List<Axis> axes) {
        return writeBounds(lower, upper, Broadcast.ofAxes(axes));
    }

    /**
     * Writes one {@code "lower <= x<n> <= upper"} record per element of the broadcast shape.
     *
     * @return the new variable tokens, labeled by the broadcast axes
     */
    private LpArray<String> writeBounds(LpArray<Double> lower, LpArray<Double> upper, Broadcast broadcast) {
        List<Double> lowerValues = broadcast.expand(lower);
        List<Double> upperValues = broadcast.expand(upper);
        List<String> variables = tokenAllocator.allocate(TokenType.VARIABLE, broadcast.getShape());
        for (int i = 0; i < variables.size(); i++) {
            write(boundsWriter, LpFormat.format(lowerValues.get(i)) + " <= " + variables.get(i) + " <= "
                    + LpFormat.format(upperValues.get(i)) + "\n");
        }
        LOGGER.debug("{} bounds written", variables.size());
        return broadcast.toArray(variables);
    }

    public LpArray<String> writeConstraints(LpArray<String> lhs, Sense sense, LpArray<?> rhs) {
        return writeConstraints(lhs, Scalar.of(sense.getSymbol()), rhs);
    }

    public LpArray<String> writeConstraints(LpArray<String> lhs, Sense sense, LpArray<?> rhs, List<Axis> axes) {
        return writeConstraints(lhs, Scalar.of(sense.getSymbol()), rhs, axes);
    }

    public LpArray<String> writeConstraints(LpArray<String> lhs, LpArray<String> sense, LpArray<?> rhs) {
        return writeConstraints(lhs, sense, rhs, Broadcast.of(lhs, sense, rhs));
    }

    public LpArray<String> writeConstraints(LpArray<String> lhs, LpArray<String> sense, LpArray<?> rhs, List<Axis> axes) {
        return writeConstraints(lhs, sense, rhs, Broadcast.ofAxes(axes));
    }

    /**
     * Writes one {@code "c<n>:\n lhs sense\n rhs\n\n"} record per element of the broadcast shape. Senses are
     * normalized, {@code ==} being written {@code =}.
     *
     * @return the new constraint tokens, labeled by the broadcast axes
     */
    private LpArray<String> writeConstraints(LpArray<String> lhs, LpArray<String> sense, LpArray<?> rhs, Broadcast broadcast) {
        List<String> lhsValues = broadcast.expand(lhs);
        List<String> senseValues = broadcast.expand(sense.map(s -> Sense.parse(s).getSymbol()));
        List<?> rhsValues = broadcast.expand(rhs);
        List<String> constraints = tokenAllocator.allocate(TokenType.CONSTRAINT, broadcast.getShape());
        for (int i = 0; i < constraints.size(); i++) {
            write(constraintsWriter, constraints.get(i) + ":\n" + LpFormat.format(lhsValues.get(i)) + senseValues.get(i) + "\n"
                    + LpFormat.format(rhsValues.get(i)) + "\n\n");
        }
        LOGGER.debug("{} constraints written", constraints.size());
        return broadcast.toArray(constraints);
    }

    /**
     * Appends expression terms to the objective, all elements being joined.
     */
    public void writeObjective(LpArray<String> expression) {
        write(objectiveWriter, LinearExpressions.join(expression));
    }

    private static void write(Writer writer, String text) {
        try {
            writer.write(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
