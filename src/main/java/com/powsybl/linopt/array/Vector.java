/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.array;

import java.util.*;
import java.util.function.Function;

/**
 * One dimensional array, optionally labeled. Elements may be null (for instance a static reference column where
 * some entities have no token).
 *
 * @author powsybl-linopt contributors
 */
public final class Vector<T> implements LpArray<T> {

    private final Axis axis;

    private final List<T> values;

    private Vector(Axis axis, List<T> values) {
        if (axis != null && axis.size() != values.size()) {
            throw new ShapeMismatchException("Axis has " + axis.size() + " labels but vector has " + values.size() + " values");
        }
        this.axis = axis;
        this.values = Collections.unmodifiableList(values);
    }

    public static <T> Vector<T> of(Axis axis, List<T> values) {
        return new Vector<>(Objects.requireNonNull(axis), new ArrayList<>(values));
    }

    /**
     * Creates a labeled vector from label/value pairs, keeping the iteration order of the map.
     */
    public static <T> Vector<T> of(Map<String, T> valuesByLabel) {
        return new Vector<>(Axis.of(valuesByLabel.keySet()), new ArrayList<>(valuesByLabel.values()));
    }

    public static <T> Vector<T> unlabeled(List<T> values) {
        return new Vector<>(null, new ArrayList<>(values));
    }

    @SafeVarargs
    public static <T> Vector<T> unlabeled(T... values) {
        return unlabeled(Arrays.asList(values));
    }

    public int size() {
        return values.size();
    }

    public Optional<Axis> getAxis() {
        return Optional.ofNullable(axis);
    }

    public T get(int index) {
        return values.get(index);
    }

    public T get(String label) {
        if (axis == null) {
            throw new IllegalStateException("Vector is not labeled");
        }
        int index = axis.indexOf(label);
        if (index == -1) {
            throw new NoSuchElementException("Label not found: " + label);
        }
        return values.get(index);
    }

    @Override
    public Shape getShape() {
        return Shape.of(values.size());
    }

    @Override
    public List<Axis> getAxes() {
        return axis != null ? List.of(axis) : Collections.emptyList();
    }

    @Override
    public List<T> getValues() {
        return values;
    }

    @Override
    public <R> Vector<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = new ArrayList<>(values.size());
        for (T value : values) {
            mapped.add(mapper.apply(value));
        }
        return new Vector<>(axis, mapped);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Vector<?> other) {
            return Objects.equals(axis, other.axis) && values.equals(other.values);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(axis, values);
    }

    @Override
    public String toString() {
        return "Vector(axis=" + axis + ", values=" + values + ")";
    }
}
