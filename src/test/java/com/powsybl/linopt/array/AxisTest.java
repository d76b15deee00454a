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
class AxisTest {

    @Test
    void testLabels() {
        Axis axis = Axis.of("g1", "g2", "g3");
        assertEquals(3, axis.size());
        assertFalse(axis.isEmpty());
        assertEquals("g2", axis.get(1));
        assertEquals(2, axis.indexOf("g3"));
        assertEquals(-1, axis.indexOf("g4"));
        assertTrue(axis.contains("g1"));
        assertEquals(List.of("g1", "g2", "g3"), axis.getLabels());
    }

    @Test
    void testEqualityIsPositional() {
        assertEquals(Axis.of("a", "b"), Axis.of(List.of("a", "b")));
        assertNotEquals(Axis.of("a", "b"), Axis.of("b", "a"));
        assertSame(Axis.EMPTY, Axis.of(List.of()));
    }

    @Test
    void testDuplicateLabel() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Axis.of("a", "b", "a"));
        assertEquals("Duplicate axis label: a", e.getMessage());
    }
}
