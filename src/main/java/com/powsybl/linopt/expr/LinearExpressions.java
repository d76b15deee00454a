/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.expr;

import com.powsybl.linopt.array.Broadcast;
import com.powsybl.linopt.array.LpArray;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Builds LP linear expressions from (coefficient, variable) terms.
 *
 * <pre>
 * Vector&lt;String&gt; p = ...; // tokens of generators active power, labeled by generator ids
 * LpArray&lt;String&gt; expr = LinearExpressions.linexpr(Term.of(1, p), Term.of(marginalCosts, p));
 * </pre>
 *
 * Each element of the result is the concatenation, in term order, of {@code "<signed coefficient> <variable>\n"}.
 *
 * @author powsybl-linopt contributors
 */
public final class LinearExpressions {

    private LinearExpressions() {
    }

    public static LpArray<String> linexpr(Term... terms) {
        return linexpr(Arrays.asList(terms));
    }

    /**
     * Elementwise concatenation of the terms over their common broadcast shape.
     *
     * @return an array of expressions carrying the broadcast axes, empty if the shape is empty
     */
    public static LpArray<String> linexpr(List<Term> terms) {
        Objects.requireNonNull(terms);
        List<LpArray<?>> operands = new ArrayList<>(terms.size() * 2);
        for (Term term : terms) {
            operands.add(term.coefficient());
            operands.add(term.variable());
        }
        Broadcast broadcast = Broadcast.of(operands);
        int size = broadcast.size();
        List<StringBuilder> builders = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            builders.add(new StringBuilder());
        }
        if (size > 0) {
            for (Term term : terms) {
                List<Double> coefficients = broadcast.expand(term.coefficient());
                List<String> variables = broadcast.expand(term.variable());
                for (int i = 0; i < size; i++) {
                    builders.get(i)
                            .append(LpFormat.format(coefficients.get(i)))
                            .append(LpFormat.format(variables.get(i)))
                            .append('\n');
                }
            }
        }
        return broadcast.toArray(builders.stream().map(StringBuilder::toString).toList());
    }

    /**
     * Elementwise concatenation of expressions sharing a common broadcast shape.
     */
    @SafeVarargs
    public static LpArray<String> sum(LpArray<String>... expressions) {
        Broadcast broadcast = Broadcast.of(expressions);
        int size = broadcast.size();
        List<StringBuilder> builders = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            builders.add(new StringBuilder());
        }
        for (LpArray<String> expression : expressions) {
            List<String> values = broadcast.expand(expression);
            for (int i = 0; i < size; i++) {
                builders.get(i).append(values.get(i));
            }
        }
        return broadcast.toArray(builders.stream().map(StringBuilder::toString).toList());
    }

    /**
     * Joins all the elements of an array, in row-major order, into a single text block.
     */
    public static String join(LpArray<String> expression) {
        StringBuilder builder = new StringBuilder();
        for (String element : expression.getValues()) {
            builder.append(LpFormat.format(element));
        }
        return builder.toString();
    }
}
