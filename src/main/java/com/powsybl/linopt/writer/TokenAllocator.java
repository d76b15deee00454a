/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.writer;

import com.powsybl.linopt.array.Shape;
import org.apache.commons.lang3.mutable.MutableInt;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mints variable tokens ({@code x0, x1, ...}) and constraint tokens ({@code c0, c1, ...}) for one LP writing
 * session. Each session owns its own allocator so that independent problems can be written concurrently.
 *
 * @author powsybl-linopt contributors
 */
public class TokenAllocator {

    private final Map<TokenType, MutableInt> counters = new EnumMap<>(TokenType.class);

    public TokenAllocator() {
        for (TokenType type : TokenType.values()) {
            counters.put(type, new MutableInt());
        }
    }

    public List<String> allocate(TokenType type, Shape shape) {
        return allocate(type, shape.size());
    }

    public List<String> allocate(TokenType type, int count) {
        Objects.requireNonNull(type);
        if (count < 0) {
            throw new IllegalArgumentException("Invalid token count: " + count);
        }
        MutableInt counter = counters.get(type);
        List<String> tokens = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            tokens.add(type.getPrefix() + counter.getAndIncrement());
        }
        return tokens;
    }

    /**
     * Number of tokens of this type allocated since creation or last reset.
     */
    public int getCount(TokenType type) {
        return counters.get(Objects.requireNonNull(type)).intValue();
    }

    /**
     * Restarts numbering at 0. Must only be called between two independent problems.
     */
    public void reset() {
        counters.values().forEach(counter -> counter.setValue(0));
    }
}
