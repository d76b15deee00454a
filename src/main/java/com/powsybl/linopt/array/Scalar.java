/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.array;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Single value repeated over the whole broadcast shape.
 *
 * @author powsybl-linopt contributors
 */
public final class Scalar<T> implements LpArray<T> {

    private final T value;

    private Scalar(T value) {
        this.value = Objects.requireNonNull(value);
    }

    public static <T> Scalar<T> of(T value) {
        return new Scalar<>(value);
    }

    public T getValue() {
        return value;
    }

    @Override
    public Shape getShape() {
        return Shape.EMPTY;
    }

    @Override
    public List<Axis> getAxes() {
        return Collections.emptyList();
    }

    @Override
    public List<T> getValues() {
        return Collections.singletonList(value);
    }

    @Override
    public <R> Scalar<R> map(Function<? super T, ? extends R> mapper) {
        return new Scalar<>(mapper.apply(value));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Scalar<?> other) {
            return value.equals(other.value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Scalar(" + value + ")";
    }
}
