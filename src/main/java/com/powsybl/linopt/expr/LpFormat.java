/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.expr;

/**
 * Text rendering of LP elements.
 * <p>
 * Numbers always carry an explicit sign and are followed by a space: {@code 1} gives {@code "+1.0 "} and
 * {@code -0.5} gives {@code "-0.5 "}. Strings (tokens, expressions, senses) are kept unchanged.
 *
 * @author powsybl-linopt contributors
 */
public final class LpFormat {

    private LpFormat() {
    }

    public static String format(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("NaN cannot be written to an LP file");
        }
        // abs also turns -0.0 into 0.0
        return (value >= 0 ? "+" : "-") + Math.abs(value) + " ";
    }

    public static String format(Object element) {
        if (element instanceof Number number) {
            return format(number.doubleValue());
        }
        if (element instanceof String str) {
            return str;
        }
        if (element == null) {
            throw new IllegalArgumentException("Missing element cannot be written to an LP file");
        }
        throw new IllegalArgumentException("Unsupported LP element type: " + element.getClass().getName());
    }
}
