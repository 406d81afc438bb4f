/*
 * Copyright (C) 2024 Alberto Irurueta Carro (alberto@irurueta.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.irurueta.accelerometer.autocalibration;

import java.util.Arrays;

/**
 * Triaxial acceleration samples expressed in units of gravitational
 * acceleration (g).
 * Samples are stored as three parallel columns (x, y, z) sharing the same
 * number of rows. Column order is always x, y, z.
 */
public class AccelerationTable {

    /**
     * Number of axes of a triaxial accelerometer.
     */
    public static final int AXES = 3;

    /**
     * Index of x-axis column.
     */
    public static final int X = 0;

    /**
     * Index of y-axis column.
     */
    public static final int Y = 1;

    /**
     * Index of z-axis column.
     */
    public static final int Z = 2;

    /**
     * Column values, indexed by axis and then by row.
     */
    private final double[][] columns;

    /**
     * Constructor.
     * Provided arrays are kept by reference.
     *
     * @param x x-axis values expressed in g.
     * @param y y-axis values expressed in g.
     * @param z z-axis values expressed in g.
     * @throws IllegalArgumentException if any column is null or columns do not
     *                                  have the same length.
     */
    public AccelerationTable(final double[] x, final double[] y, final double[] z) {
        if (x == null || y == null || z == null) {
            throw new IllegalArgumentException("acceleration columns must not be null");
        }
        if (x.length != y.length || x.length != z.length) {
            throw new IllegalArgumentException(String.format(
                    "acceleration columns must have the same length (x: %d, y: %d, z: %d)",
                    x.length, y.length, z.length));
        }
        columns = new double[][]{x, y, z};
    }

    /**
     * Constructor creating a table filled with zeros.
     *
     * @param rows number of rows.
     * @throws IllegalArgumentException if number of rows is negative.
     */
    public AccelerationTable(final int rows) {
        this(new double[checkRows(rows)], new double[rows], new double[rows]);
    }

    /**
     * Gets number of samples contained in this table.
     *
     * @return number of samples.
     */
    public int getRows() {
        return columns[X].length;
    }

    /**
     * Indicates whether this table contains no samples.
     *
     * @return true if table is empty, false otherwise.
     */
    public boolean isEmpty() {
        return getRows() == 0;
    }

    /**
     * Gets value of provided axis at provided row.
     *
     * @param row  row index.
     * @param axis axis index ({@link #X}, {@link #Y} or {@link #Z}).
     * @return value expressed in g.
     */
    public double getValue(final int row, final int axis) {
        return columns[axis][row];
    }

    /**
     * Sets value of provided axis at provided row.
     *
     * @param row   row index.
     * @param axis  axis index ({@link #X}, {@link #Y} or {@link #Z}).
     * @param value value expressed in g.
     */
    public void setValue(final int row, final int axis, final double value) {
        columns[axis][row] = value;
    }

    /**
     * Sets all three values of a row.
     *
     * @param row row index.
     * @param x   x-axis value expressed in g.
     * @param y   y-axis value expressed in g.
     * @param z   z-axis value expressed in g.
     */
    public void setRow(final int row, final double x, final double y, final double z) {
        columns[X][row] = x;
        columns[Y][row] = y;
        columns[Z][row] = z;
    }

    /**
     * Gets the internal column for provided axis.
     * Changes on the returned array are reflected on this table.
     *
     * @param axis axis index ({@link #X}, {@link #Y} or {@link #Z}).
     * @return column values.
     */
    public double[] getColumn(final int axis) {
        return columns[axis];
    }

    /**
     * Gets x-axis values.
     *
     * @return x-axis values.
     */
    public double[] getX() {
        return columns[X];
    }

    /**
     * Gets y-axis values.
     *
     * @return y-axis values.
     */
    public double[] getY() {
        return columns[Y];
    }

    /**
     * Gets z-axis values.
     *
     * @return z-axis values.
     */
    public double[] getZ() {
        return columns[Z];
    }

    /**
     * Gets the euclidean norm of the acceleration vector at provided row.
     *
     * @param row row index.
     * @return norm expressed in g.
     */
    public double getNorm(final int row) {
        final var x = columns[X][row];
        final var y = columns[Y][row];
        final var z = columns[Z][row];
        return Math.sqrt(x * x + y * y + z * z);
    }

    /**
     * Gets the minimum value of provided axis.
     *
     * @param axis axis index.
     * @return minimum value or NaN if table is empty.
     */
    public double getMin(final int axis) {
        if (isEmpty()) {
            return Double.NaN;
        }
        var result = Double.POSITIVE_INFINITY;
        for (final var value : columns[axis]) {
            result = Math.min(result, value);
        }
        return result;
    }

    /**
     * Gets the maximum value of provided axis.
     *
     * @param axis axis index.
     * @return maximum value or NaN if table is empty.
     */
    public double getMax(final int axis) {
        if (isEmpty()) {
            return Double.NaN;
        }
        var result = Double.NEGATIVE_INFINITY;
        for (final var value : columns[axis]) {
            result = Math.max(result, value);
        }
        return result;
    }

    /**
     * Creates a new table containing a copy of the leading rows of this table.
     * If more rows are requested than available, all rows are copied.
     *
     * @param rows number of leading rows to copy.
     * @return a new table.
     * @throws IllegalArgumentException if number of rows is negative.
     */
    public AccelerationTable head(final int rows) {
        final var n = Math.min(checkRows(rows), getRows());
        return new AccelerationTable(Arrays.copyOf(columns[X], n), Arrays.copyOf(columns[Y], n),
                Arrays.copyOf(columns[Z], n));
    }

    /**
     * Creates a deep copy of this table.
     *
     * @return a new table.
     */
    public AccelerationTable copy() {
        return head(getRows());
    }

    /**
     * Indicates whether this table contains the same values as provided one.
     *
     * @param obj instance to compare.
     * @return true if both tables are equal, false otherwise.
     */
    @Override
    public boolean equals(final Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof AccelerationTable other)) {
            return false;
        }
        return Arrays.equals(columns[X], other.columns[X])
                && Arrays.equals(columns[Y], other.columns[Y])
                && Arrays.equals(columns[Z], other.columns[Z]);
    }

    /**
     * Indicates whether this table is equal to provided one up to provided
     * absolute threshold on every value.
     *
     * @param other     instance to compare.
     * @param threshold maximum allowed absolute difference.
     * @return true if both tables are equal up to provided threshold.
     */
    public boolean equals(final AccelerationTable other, final double threshold) {
        if (other == null || other.getRows() != getRows()) {
            return false;
        }
        for (var axis = 0; axis < AXES; axis++) {
            final var a = columns[axis];
            final var b = other.columns[axis];
            for (var i = 0; i < a.length; i++) {
                if (Math.abs(a[i] - b[i]) > threshold) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Computes hash code.
     *
     * @return hash code.
     */
    @Override
    public int hashCode() {
        var result = Arrays.hashCode(columns[X]);
        result = 31 * result + Arrays.hashCode(columns[Y]);
        result = 31 * result + Arrays.hashCode(columns[Z]);
        return result;
    }

    private static int checkRows(final int rows) {
        if (rows < 0) {
            throw new IllegalArgumentException("number of rows must be zero or positive");
        }
        return rows;
    }
}
