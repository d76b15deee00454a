/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.writer;

import java.util.Objects;

/**
 * Constraint sense.
 *
 * @author powsybl-linopt contributors
 */
public enum Sense {
    LESS_OR_EQUAL("<="),
    EQUAL("="),
    GREATER_OR_EQUAL(">=");

    private final String symbol;

    Sense(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Parses an LP sense symbol, {@code ==} being accepted as {@code =}.
     */
    public static Sense parse(String symbol) {
        Objects.requireNonNull(symbol);
        return switch (symbol.trim()) {
            case "<=" -> LESS_OR_EQUAL;
            case "=", "==" -> EQUAL;
            case ">=" -> GREATER_OR_EQUAL;
            default -> throw new IllegalArgumentException("Invalid constraint sense: '" + symbol + "'");
        };
    }
}
