/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.array;

import java.util.*;

/**
 * Common shape and axes resulting from an elementwise operation between scalars, vectors and matrices.
 * <p>
 * Labeled operands must agree on their trailing axis. The operand with the highest rank gives the result axes,
 * the first one seen winning on ties. Scalars and unlabeled arrays do not contribute any axis, so an operation
 * between scalars only has the empty shape unless axes are given explicitly with {@link #ofAxes(List)}.
 * <p>
 * Once the broadcast is computed, {@link #expand(LpArray)} reads any operand in the row-major order of the
 * result shape: scalars are repeated, vectors are aligned on the trailing axis (the columns of a matrix) and
 * matrices are read elementwise.
 *
 * @author powsybl-linopt contributors
 */
public final class Broadcast {

    private static final Broadcast EMPTY = new Broadcast(Collections.emptyList());

    private final List<Axis> axes;

    private final Shape shape;

    private Broadcast(List<Axis> axes) {
        this.axes = List.copyOf(axes);
        this.shape = Shape.of(axes);
    }

    public static Broadcast of(LpArray<?>... operands) {
        return of(Arrays.asList(operands));
    }

    public static Broadcast of(Collection<? extends LpArray<?>> operands) {
        Objects.requireNonNull(operands);
        List<Axis> axes = Collections.emptyList();
        for (LpArray<?> operand : operands) {
            Objects.requireNonNull(operand);
            if (operand.isLabeled()) {
                List<Axis> operandAxes = operand.getAxes();
                if (!axes.isEmpty() && !last(axes).equals(last(operandAxes))) {
                    throw new ShapeMismatchException("Operands are not aligned: " + last(axes) + " != " + last(operandAxes));
                }
                if (operandAxes.size() > axes.size()) {
                    axes = operandAxes;
                }
            }
        }
        return axes.isEmpty() ? EMPTY : new Broadcast(axes);
    }

    /**
     * Broadcast over explicitly given axes, one for a vector result, two (rows, columns) for a matrix result.
     */
    public static Broadcast ofAxes(List<Axis> axes) {
        Objects.requireNonNull(axes);
        if (axes.size() > 2) {
            throw new IllegalArgumentException("Only 1 or 2 axes are supported: " + axes.size());
        }
        return axes.isEmpty() ? EMPTY : new Broadcast(axes);
    }

    private static Axis last(List<Axis> axes) {
        return axes.get(axes.size() - 1);
    }

    public List<Axis> getAxes() {
        return axes;
    }

    public Shape getShape() {
        return shape;
    }

    public int size() {
        return shape.size();
    }

    public boolean isEmpty() {
        return shape.isEmpty();
    }

    /**
     * Reads the operand over the broadcast shape.
     *
     * @return the operand elements in row-major order, {@link #size()} of them
     * @throws ShapeMismatchException if the operand cannot be broadcast to this shape
     */
    public <T> List<T> expand(LpArray<T> operand) {
        Objects.requireNonNull(operand);
        int size = size();
        if (size == 0) {
            return Collections.emptyList();
        }
        if (operand instanceof Scalar<T> scalar) {
            return Collections.nCopies(size, scalar.getValue());
        }
        checkAligned(operand);
        List<T> values = operand.getValues();
        if (operand.rank() == shape.rank()) {
            return values;
        }
        // vector over a matrix shape: repeat it for every row
        int columnCount = shape.length(1);
        List<T> expanded = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            expanded.add(values.get(i % columnCount));
        }
        return expanded;
    }

    private void checkAligned(LpArray<?> operand) {
        Shape operandShape = operand.getShape();
        if (operandShape.rank() > shape.rank()) {
            throw new ShapeMismatchException("Cannot broadcast an array of shape " + operandShape + " to shape " + shape);
        }
        if (operand.isLabeled()) {
            List<Axis> operandAxes = operand.getAxes();
            List<Axis> trailingAxes = axes.subList(axes.size() - operandAxes.size(), axes.size());
            if (!trailingAxes.equals(operandAxes)) {
                throw new ShapeMismatchException("Operand axes " + operandAxes + " are not aligned with " + trailingAxes);
            }
        } else {
            for (int i = 1; i <= operandShape.rank(); i++) {
                if (operandShape.length(operandShape.rank() - i) != shape.length(shape.rank() - i)) {
                    throw new ShapeMismatchException("Cannot broadcast an array of shape " + operandShape + " to shape " + shape);
                }
            }
        }
    }

    /**
     * Wraps row-major values into an array carrying the broadcast axes.
     */
    public <T> LpArray<T> toArray(List<T> values) {
        if (values.size() != size()) {
            throw new ShapeMismatchException("Expected " + size() + " values but got " + values.size());
        }
        return switch (shape.rank()) {
            case 0 -> Vector.unlabeled(Collections.<T>emptyList());
            case 1 -> Vector.of(axes.get(0), values);
            default -> Matrix.of(axes.get(0), axes.get(1), values);
        };
    }

    @Override
    public String toString() {
        return "Broadcast(shape=" + shape + ", axes=" + axes + ")";
    }
}
