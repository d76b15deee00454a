/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.writer;

/**
 * Kind of LP file token.
 *
 * @author powsybl-linopt contributors
 */
public enum TokenType {
    VARIABLE("x"),
    CONSTRAINT("c");

    private final String prefix;

    TokenType(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean matches(String token) {
        return token != null && token.startsWith(prefix);
    }
}
