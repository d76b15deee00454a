/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.expr;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author powsybl-linopt contributors
 */
class LpFormatTest {

    @Test
    void testNumbers() {
        assertEquals("+1.0 ", LpFormat.format(1));
        assertEquals("-0.5 ", LpFormat.format(-0.5));
        assertEquals("+0.0 ", LpFormat.format(0.0));
        assertEquals("+0.0 ", LpFormat.format(-0.0));
        assertEquals("+1.0E-7 ", LpFormat.format(1e-7));
        assertEquals("-1250.75 ", LpFormat.format(-1250.75));
        assertEquals("+2.0 ", LpFormat.format((Object) 2));
    }

    @Test
    void testStrings() {
        assertEquals("x12", LpFormat.format((Object) "x12"));
        assertEquals("<=", LpFormat.format((Object) "<="));
    }

    @Test
    void testInvalid() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> LpFormat.format(Double.NaN));
        assertEquals("NaN cannot be written to an LP file", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> LpFormat.format((Object) null));
        Object bool = Boolean.TRUE;
        assertThrows(IllegalArgumentException.class, () -> LpFormat.format(bool));
    }
}
