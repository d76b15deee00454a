/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.array;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author powsybl-linopt contributors
 */
class BroadcastTest {

    private static final Axis SNAPSHOTS = Axis.of("t1", "t2");

    private static final Axis GENERATORS = Axis.of("g1", "g2", "g3");

    @Test
    void testScalarsOnly() {
        Broadcast broadcast = Broadcast.of(Scalar.of(1.0), Scalar.of(2.0));
        assertSame(Shape.EMPTY, broadcast.getShape());
        assertTrue(broadcast.isEmpty());
        assertEquals(List.of(), broadcast.expand(Scalar.of(1.0)));
        assertEquals(0, broadcast.toArray(List.of()).getValues().size());
    }

    @Test
    void testNoOperand() {
        assertTrue(Broadcast.of().isEmpty());
    }

    @Test
    void testHighestRankGivesAxes() {
        Vector<Double> costs = Vector.of(GENERATORS, List.of(1.0, 2.0, 3.0));
        Matrix<String> p = Matrix.of(SNAPSHOTS, GENERATORS, List.of("x0", "x1", "x2", "x3", "x4", "x5"));
        Broadcast broadcast = Broadcast.of(costs, p, Scalar.of(0.0));
        assertEquals(List.of(SNAPSHOTS, GENERATORS), broadcast.getAxes());
        assertEquals(Shape.of(2, 3), broadcast.getShape());
        assertEquals(List.of(1.0, 2.0, 3.0, 1.0, 2.0, 3.0), broadcast.expand(costs));
        assertEquals(p.getValues(), broadcast.expand(p));
        assertEquals(List.of(0.0, 0.0, 0.0, 0.0, 0.0, 0.0), broadcast.expand(Scalar.of(0.0)));
    }

    @Test
    void testFirstSeenWinsOnTie() {
        Vector<Double> v1 = Vector.of(Axis.of("a", "b"), List.of(1.0, 2.0));
        Vector<Double> v2 = Vector.of(Axis.of("a", "b"), List.of(3.0, 4.0));
        assertEquals(List.of(Axis.of("a", "b")), Broadcast.of(v1, v2).getAxes());
    }

    @Test
    void testMisalignedLabels() {
        Vector<Double> v1 = Vector.of(Axis.of("a", "b"), List.of(1.0, 2.0));
        Vector<Double> v2 = Vector.of(Axis.of("b", "a"), List.of(3.0, 4.0));
        ShapeMismatchException e = assertThrows(ShapeMismatchException.class, () -> Broadcast.of(v1, v2));
        assertEquals("Operands are not aligned: Axis[a, b] != Axis[b, a]", e.getMessage());
    }

    @Test
    void testUnlabeledOperand() {
        Broadcast broadcast = Broadcast.ofAxes(List.of(GENERATORS));
        assertEquals(List.of("x0", "x1", "x2"), broadcast.expand(Vector.unlabeled("x0", "x1", "x2")));
        Vector<String> tooShort = Vector.unlabeled("x0", "x1");
        assertThrows(ShapeMismatchException.class, () -> broadcast.expand(tooShort));
    }

    @Test
    void testOperandOfHigherRank() {
        Broadcast broadcast = Broadcast.ofAxes(List.of(GENERATORS));
        Matrix<String> p = Matrix.of(SNAPSHOTS, GENERATORS, List.of("x0", "x1", "x2", "x3", "x4", "x5"));
        assertThrows(ShapeMismatchException.class, () -> broadcast.expand(p));
    }

    @Test
    void testToArray() {
        LpArray<String> vector = Broadcast.ofAxes(List.of(GENERATORS)).toArray(List.of("x0", "x1", "x2"));
        assertEquals(Vector.of(GENERATORS, List.of("x0", "x1", "x2")), vector);

        LpArray<Integer> matrix = Broadcast.ofAxes(List.of(SNAPSHOTS, GENERATORS)).toArray(List.of(1, 2, 3, 4, 5, 6));
        assertInstanceOf(Matrix.class, matrix);
        assertEquals(List.of(SNAPSHOTS, GENERATORS), matrix.getAxes());

        Broadcast broadcast = Broadcast.ofAxes(List.of(GENERATORS));
        List<String> values = List.of("x0");
        assertThrows(ShapeMismatchException.class, () -> broadcast.toArray(values));
    }

    @Test
    void testTooManyAxes() {
        List<Axis> axes = List.of(SNAPSHOTS, GENERATORS, Axis.of("z"));
        assertThrows(IllegalArgumentException.class, () -> Broadcast.ofAxes(axes));
    }
}
