/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.writer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author powsybl-linopt contributors
 */
class SenseTest {

    @Test
    void testParse() {
        assertSame(Sense.LESS_OR_EQUAL, Sense.parse("<="));
        assertSame(Sense.GREATER_OR_EQUAL, Sense.parse(">="));
        assertSame(Sense.EQUAL, Sense.parse("="));
        assertSame(Sense.EQUAL, Sense.parse("=="));
        assertEquals("=", Sense.parse("==").getSymbol());
    }

    @Test
    void testInvalid() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Sense.parse("<"));
        assertEquals("Invalid constraint sense: '<'", e.getMessage());
    }
}
