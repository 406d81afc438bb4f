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

/**
 * Applies per-axis affine calibrations to acceleration tables.
 * Applying the same calibration twice is not idempotent: each call maps its
 * input once, so raw data must be calibrated exactly once.
 */
public final class AffineCalibration {

    /**
     * Prevents instantiation.
     */
    private AffineCalibration() {
    }

    /**
     * Applies provided calibration so that
     * {@code out[axis] = table[axis] * scale[axis] + offset[axis]}.
     *
     * @param table  table to be calibrated. It is not modified.
     * @param scale  scale factors for x, y, z axes.
     * @param offset offsets for x, y, z axes expressed in g.
     * @return a new calibrated table with the same number of rows.
     * @throws IllegalArgumentException if scale or offset do not have length 3.
     */
    public static AccelerationTable apply(final AccelerationTable table, final double[] scale,
                                          final double[] offset) {
        checkTriads(scale, offset);

        final var rows = table.getRows();
        final var result = new AccelerationTable(rows);
        for (var axis = 0; axis < AccelerationTable.AXES; axis++) {
            final var src = table.getColumn(axis);
            final var dst = result.getColumn(axis);
            final var s = scale[axis];
            final var o = offset[axis];
            for (var i = 0; i < rows; i++) {
                dst[i] = src[i] * s + o;
            }
        }
        return result;
    }

    /**
     * Applies provided calibration parameters.
     *
     * @param table      table to be calibrated. It is not modified.
     * @param parameters calibration parameters.
     * @return a new calibrated table.
     */
    public static AccelerationTable apply(final AccelerationTable table, final CalibrationParameters parameters) {
        return apply(table, parameters.getScale(), parameters.getOffset());
    }

    /**
     * Reverts provided calibration so that
     * {@code out[axis] = (table[axis] - offset[axis]) / scale[axis]}.
     *
     * @param table  calibrated table. It is not modified.
     * @param scale  scale factors for x, y, z axes.
     * @param offset offsets for x, y, z axes expressed in g.
     * @return a new table with calibration reverted.
     * @throws IllegalArgumentException if scale or offset do not have length 3.
     */
    public static AccelerationTable applyInverse(final AccelerationTable table, final double[] scale,
                                                 final double[] offset) {
        checkTriads(scale, offset);

        final var rows = table.getRows();
        final var result = new AccelerationTable(rows);
        for (var axis = 0; axis < AccelerationTable.AXES; axis++) {
            final var src = table.getColumn(axis);
            final var dst = result.getColumn(axis);
            final var s = scale[axis];
            final var o = offset[axis];
            for (var i = 0; i < rows; i++) {
                dst[i] = (src[i] - o) / s;
            }
        }
        return result;
    }

    private static void checkTriads(final double[] scale, final double[] offset) {
        if (scale == null || scale.length != AccelerationTable.AXES) {
            throw new IllegalArgumentException("scale must have length 3");
        }
        if (offset == null || offset.length != AccelerationTable.AXES) {
            throw new IllegalArgumentException("offset must have length 3");
        }
    }
}
