/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.array;

import java.util.List;
import java.util.function.Function;

/**
 * Operand of the LP writing functions: a {@link Scalar}, a {@link Vector} or a {@link Matrix}.
 * Elements are numbers (coefficients, bounds) or strings (tokens, rendered expressions, senses).
 * <p>
 * Vectors and matrices may be labeled, in which case broadcasting aligns them by labels, or unlabeled, in which
 * case they are aligned by position.
 *
 * @author powsybl-linopt contributors
 */
public interface LpArray<T> {

    Shape getShape();

    default int rank() {
        return getShape().rank();
    }

    /**
     * Labeled axes of this array, empty for scalars and unlabeled arrays.
     */
    List<Axis> getAxes();

    default boolean isLabeled() {
        return !getAxes().isEmpty();
    }

    /**
     * Elements in row-major order.
     */
    List<T> getValues();

    default boolean isEmpty() {
        return getValues().isEmpty();
    }

    <R> LpArray<R> map(Function<? super T, ? extends R> mapper);
}
