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
 * Two dimensional array stored in row-major order. Either both axes are labeled (rows are usually snapshots and
 * columns entities) or none is.
 *
 * @author powsybl-linopt contributors
 */
public final class Matrix<T> implements LpArray<T> {

    private final int rowCount;

    private final int columnCount;

    private final Axis rowAxis;

    private final Axis columnAxis;

    private final List<T> values;

    private Matrix(int rowCount, int columnCount, Axis rowAxis, Axis columnAxis, List<T> values) {
        if (rowCount < 0 || columnCount < 0) {
            throw new IllegalArgumentException("Invalid matrix dimensions: " + rowCount + "x" + columnCount);
        }
        if (values.size() != rowCount * columnCount) {
            throw new ShapeMismatchException("Expected " + rowCount * columnCount + " values for a " + rowCount + "x" + columnCount
                    + " matrix but got " + values.size());
        }
        this.rowCount = rowCount;
        this.columnCount = columnCount;
        this.rowAxis = rowAxis;
        this.columnAxis = columnAxis;
        this.values = Collections.unmodifiableList(values);
    }

    public static <T> Matrix<T> of(Axis rowAxis, Axis columnAxis, List<T> values) {
        Objects.requireNonNull(rowAxis);
        Objects.requireNonNull(columnAxis);
        return new Matrix<>(rowAxis.size(), columnAxis.size(), rowAxis, columnAxis, new ArrayList<>(values));
    }

    public static <T> Matrix<T> unlabeled(int rowCount, int columnCount, List<T> values) {
        return new Matrix<>(rowCount, columnCount, null, null, new ArrayList<>(values));
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public Optional<Axis> getRowAxis() {
        return Optional.ofNullable(rowAxis);
    }

    public Optional<Axis> getColumnAxis() {
        return Optional.ofNullable(columnAxis);
    }

    public T get(int row, int column) {
        Objects.checkIndex(row, rowCount);
        Objects.checkIndex(column, columnCount);
        return values.get(row * columnCount + column);
    }

    public T get(String rowLabel, String columnLabel) {
        if (rowAxis == null) {
            throw new IllegalStateException("Matrix is not labeled");
        }
        int row = rowAxis.indexOf(rowLabel);
        int column = columnAxis.indexOf(columnLabel);
        if (row == -1 || column == -1) {
            throw new NoSuchElementException("Labels not found: (" + rowLabel + ", " + columnLabel + ")");
        }
        return get(row, column);
    }

    /**
     * Column with the given label, labeled by the row axis.
     */
    public Vector<T> getColumn(String columnLabel) {
        if (columnAxis == null) {
            throw new IllegalStateException("Matrix is not labeled");
        }
        int column = columnAxis.indexOf(columnLabel);
        if (column == -1) {
            throw new NoSuchElementException("Column not found: " + columnLabel);
        }
        List<T> columnValues = new ArrayList<>(rowCount);
        for (int row = 0; row < rowCount; row++) {
            columnValues.add(values.get(row * columnCount + column));
        }
        return Vector.of(rowAxis, columnValues);
    }

    @Override
    public Shape getShape() {
        return Shape.of(rowCount, columnCount);
    }

    @Override
    public List<Axis> getAxes() {
        return rowAxis != null ? List.of(rowAxis, columnAxis) : Collections.emptyList();
    }

    @Override
    public List<T> getValues() {
        return values;
    }

    @Override
    public <R> Matrix<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = new ArrayList<>(values.size());
        for (T value : values) {
            mapped.add(mapper.apply(value));
        }
        return new Matrix<>(rowCount, columnCount, rowAxis, columnAxis, mapped);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Matrix<?> other) {
            return rowCount == other.rowCount
                    && columnCount == other.columnCount
                    && Objects.equals(rowAxis, other.rowAxis)
                    && Objects.equals(columnAxis, other.columnAxis)
                    && values.equals(other.values);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowCount, columnCount, rowAxis, columnAxis, values);
    }

    @Override
    public String toString() {
        return "Matrix(rows=" + rowAxis + ", columns=" + columnAxis + ", shape=" + getShape() + ")";
    }
}
