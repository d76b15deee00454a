/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.array;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Axis lengths of a 0, 1 or 2 dimensional array.
 * <p>
 * The rank 0 shape is the empty shape: nothing is written for it, so its size is 0.
 *
 * @author powsybl-linopt contributors
 */
public final class Shape {

    public static final Shape EMPTY = new Shape(new int[0]);

    private final int[] lengths;

    private Shape(int[] lengths) {
        this.lengths = lengths;
    }

    public static Shape of(int... lengths) {
        if (lengths.length > 2) {
            throw new IllegalArgumentException("Only 0, 1 or 2 dimensions are supported: " + lengths.length);
        }
        for (int length : lengths) {
            if (length < 0) {
                throw new IllegalArgumentException("Invalid axis length: " + length);
            }
        }
        return lengths.length == 0 ? EMPTY : new Shape(lengths.clone());
    }

    public static Shape of(List<Axis> axes) {
        return of(axes.stream().mapToInt(Axis::size).toArray());
    }

    public int rank() {
        return lengths.length;
    }

    public int length(int dimension) {
        return lengths[dimension];
    }

    public int size() {
        if (lengths.length == 0) {
            return 0;
        }
        int size = 1;
        for (int length : lengths) {
            size *= length;
        }
        return size;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Shape other) {
            return Arrays.equals(lengths, other.lengths);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(lengths);
    }

    @Override
    public String toString() {
        return Arrays.stream(lengths).mapToObj(Integer::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
