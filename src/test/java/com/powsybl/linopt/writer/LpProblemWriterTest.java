/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.writer;

import com.powsybl.linopt.array.*;
import com.powsybl.linopt.expr.LinearExpressions;
import com.powsybl.linopt.expr.Term;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

/**
 * @author powsybl-linopt contributors
 */
class LpProblemWriterTest {

    private static final Axis GENERATORS = Axis.of("g1", "g2");

    private static final Axis SNAPSHOTS = Axis.of("t1", "t2");

    private StringWriter objective;

    private StringWriter constraints;

    private StringWriter bounds;

    private LpProblemWriter writer;

    @BeforeEach
    void setUp() {
        objective = new StringWriter();
        constraints = new StringWriter();
        bounds = new StringWriter();
        writer = new LpProblemWriter(objective, constraints, bounds);
    }

    @Test
    void testSingleBound() {
        LpArray<String> x = writer.writeBounds(Scalar.of(0.0), Scalar.of(1.0), List.of(Axis.of("a")));
        assertEquals("+0.0  <= x0 <= +1.0 \n", bounds.toString());
        assertEquals(Vector.of(Axis.of("a"), List.of("x0")), x);
    }

    @Test
    void testBoundsOverMatrix() {
        Vector<Double> pMax = Vector.of(GENERATORS, List.of(100.0, 50.0));
        LpArray<String> p = writer.writeBounds(Scalar.of(0.0), pMax, List.of(SNAPSHOTS, GENERATORS));
        assertEquals(Matrix.of(SNAPSHOTS, GENERATORS, List.of("x0", "x1", "x2", "x3")), p);
        assertEquals("+0.0  <= x0 <= +100.0 \n"
                + "+0.0  <= x1 <= +50.0 \n"
                + "+0.0  <= x2 <= +100.0 \n"
                + "+0.0  <= x3 <= +50.0 \n", bounds.toString());
    }

    @Test
    void testUnlabeledBoundsWithExplicitAxis() {
        Vector<Double> lower = Vector.unlabeled(0.0, 0.0);
        Vector<Double> upper = Vector.unlabeled(1.0, 2.0);
        LpArray<String> x = writer.writeBounds(lower, upper, List.of(Axis.of("a", "b")));
        assertEquals(Vector.of(Axis.of("a", "b"), List.of("x0", "x1")), x);
        assertEquals("+0.0  <= x0 <= +1.0 \n"
                + "+0.0  <= x1 <= +2.0 \n", bounds.toString());
        assertEquals(2, bounds.toString().lines().count());
    }

    @Test
    void testBoundsAxesFromOperands() {
        Vector<Double> lower = Vector.of(GENERATORS, List.of(-1.0, -2.0));
        Vector<Double> upper = Vector.of(GENERATORS, List.of(1.0, 2.0));
        LpArray<String> x = writer.writeBounds(lower, upper);
        assertEquals(List.of(GENERATORS), x.getAxes());
        assertEquals("-1.0  <= x0 <= +1.0 \n-2.0  <= x1 <= +2.0 \n", bounds.toString());
    }

    @Test
    void testScalarBoundsWithoutAxesWriteNothing() {
        LpArray<String> x = writer.writeBounds(Scalar.of(0.0), Scalar.of(1.0));
        assertTrue(x.isEmpty());
        assertEquals("", bounds.toString());
        assertEquals(0, writer.getTokenAllocator().getCount(TokenType.VARIABLE));
    }

    @Test
    void testConstraint() {
        Vector<String> p = Vector.of(GENERATORS, List.of("x0", "x1"));
        LpArray<String> lhs = LinearExpressions.linexpr(Term.of(1.0, p));
        LpArray<String> c = writer.writeConstraints(lhs, Sense.LESS_OR_EQUAL, Vector.of(GENERATORS, List.of(5.0, 6.0)));
        assertEquals(Vector.of(GENERATORS, List.of("c0", "c1")), c);
        assertEquals("c0:\n+1.0 x0\n<=\n+5.0 \n\n"
                + "c1:\n+1.0 x1\n<=\n+6.0 \n\n", constraints.toString());
    }

    @Test
    void testConstraintSenseNormalized() {
        Vector<String> lhs = Vector.of(GENERATORS, List.of("+1.0 x0\n", "+1.0 x1\n"));
        writer.writeConstraints(lhs, Scalar.of("=="), Scalar.of(0.0));
        assertEquals("c0:\n+1.0 x0\n=\n+0.0 \n\nc1:\n+1.0 x1\n=\n+0.0 \n\n", constraints.toString());
    }

    @Test
    void testConstraintWithExplicitAxes() {
        writer.writeConstraints(Scalar.of("+1.0 x0\n"), Sense.GREATER_OR_EQUAL, Scalar.of(-3.0), List.of(Axis.of("k")));
        assertEquals("c0:\n+1.0 x0\n>=\n-3.0 \n\n", constraints.toString());
    }

    @Test
    void testInvalidSense() {
        Vector<String> lhs = Vector.of(GENERATORS, List.of("+1.0 x0\n", "+1.0 x1\n"));
        Scalar<String> sense = Scalar.of("<");
        Scalar<Double> rhs = Scalar.of(0.0);
        assertThrows(IllegalArgumentException.class, () -> writer.writeConstraints(lhs, sense, rhs));
    }

    @Test
    void testMisalignedOperands() {
        Vector<Double> lower = Vector.of(GENERATORS, List.of(0.0, 0.0));
        Vector<Double> upper = Vector.of(Axis.of("g2", "g1"), List.of(1.0, 1.0));
        assertThrows(ShapeMismatchException.class, () -> writer.writeBounds(lower, upper));
        assertEquals("", bounds.toString());
    }

    @Test
    void testObjective() {
        Vector<String> p = Vector.of(GENERATORS, List.of("x0", "x1"));
        writer.writeObjective(LinearExpressions.linexpr(Term.of(Vector.of(GENERATORS, List.of(10.0, 20.0)), p)));
        assertEquals("+10.0 x0\n+20.0 x1\n", objective.toString());
    }

    @Test
    void testTokensContinueAcrossCalls() {
        writer.writeBounds(Scalar.of(0.0), Scalar.of(1.0), List.of(GENERATORS));
        LpArray<String> x = writer.writeBounds(Scalar.of(0.0), Scalar.of(1.0), List.of(GENERATORS));
        assertEquals(List.of("x2", "x3"), x.getValues());
    }

    @Test
    void testSinkFailure() throws IOException {
        Writer failing = mock(Writer.class);
        doThrow(new IOException("disk full")).when(failing).write(anyString());
        LpProblemWriter failingWriter = new LpProblemWriter(objective, constraints, failing);
        Scalar<Double> zero = Scalar.of(0.0);
        List<Axis> axes = List.of(GENERATORS);
        UncheckedIOException e = assertThrows(UncheckedIOException.class, () -> failingWriter.writeBounds(zero, zero, axes));
        assertEquals("disk full", e.getCause().getMessage());
    }
}
