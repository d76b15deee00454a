/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.expr;

import com.powsybl.linopt.array.LpArray;
import com.powsybl.linopt.array.Scalar;

import java.util.Objects;

/**
 * A (coefficient, variable) pair of a linear expression, both sides being broadcast elementwise.
 *
 * @author powsybl-linopt contributors
 */
public record Term(LpArray<Double> coefficient, LpArray<String> variable) {

    public Term {
        Objects.requireNonNull(coefficient);
        Objects.requireNonNull(variable);
    }

    public static Term of(double coefficient, LpArray<String> variable) {
        return new Term(Scalar.of(coefficient), variable);
    }

    public static Term of(LpArray<Double> coefficient, LpArray<String> variable) {
        return new Term(coefficient, variable);
    }

    public static Term of(LpArray<Double> coefficient, String variable) {
        return new Term(coefficient, Scalar.of(variable));
    }
}
