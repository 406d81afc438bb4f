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

import com.irurueta.algebra.Matrix;
import com.irurueta.algebra.WrongSizeException;
import com.irurueta.units.Acceleration;
import com.irurueta.units.AccelerationUnit;

import java.util.Arrays;

/**
 * Per-axis affine calibration of an accelerometer.
 * Calibrated values are obtained as:
 * <pre>
 *     calibrated = raw * scale + offset
 * </pre>
 * for each axis independently.
 * Instances also keep the calibration error (mean absolute deviation of still
 * vector norms from 1g) before and after calibration.
 * Instances are immutable.
 */
public class CalibrationParameters {

    /**
     * Offsets expressed in g.
     */
    private final double[] offset;

    /**
     * Unit-less scale factors.
     */
    private final double[] scale;

    /**
     * Calibration error before calibration expressed in g.
     */
    private final double errorStart;

    /**
     * Calibration error after calibration expressed in g.
     */
    private final double errorEnd;

    /**
     * Constructor.
     *
     * @param offset     offsets for x, y, z axes expressed in g.
     * @param scale      scale factors for x, y, z axes.
     * @param errorStart calibration error before calibration expressed in g.
     * @param errorEnd   calibration error after calibration expressed in g.
     * @throws IllegalArgumentException if offset or scale do not have length 3.
     */
    public CalibrationParameters(final double[] offset, final double[] scale, final double errorStart,
                                 final double errorEnd) {
        if (offset == null || offset.length != AccelerationTable.AXES) {
            throw new IllegalArgumentException("offset must have length 3");
        }
        if (scale == null || scale.length != AccelerationTable.AXES) {
            throw new IllegalArgumentException("scale must have length 3");
        }
        this.offset = Arrays.copyOf(offset, AccelerationTable.AXES);
        this.scale = Arrays.copyOf(scale, AccelerationTable.AXES);
        this.errorStart = errorStart;
        this.errorEnd = errorEnd;
    }

    /**
     * Creates parameters reported when no calibration could be obtained.
     * Offset, scale and errors are all zero.
     *
     * @return parameters of a run that produced no calibration.
     */
    public static CalibrationParameters createUncalibrated() {
        return new CalibrationParameters(new double[AccelerationTable.AXES], new double[AccelerationTable.AXES],
                0.0, 0.0);
    }

    /**
     * Creates identity parameters (zero offset and unit scale) with zero errors.
     *
     * @return identity parameters.
     */
    public static CalibrationParameters createIdentity() {
        return new CalibrationParameters(new double[AccelerationTable.AXES], new double[]{1.0, 1.0, 1.0},
                0.0, 0.0);
    }

    /**
     * Gets offsets for x, y, z axes expressed in g.
     *
     * @return a copy of offsets.
     */
    public double[] getOffset() {
        return Arrays.copyOf(offset, AccelerationTable.AXES);
    }

    /**
     * Gets offset of provided axis expressed in g.
     *
     * @param axis axis index.
     * @return offset.
     */
    public double getOffset(final int axis) {
        return offset[axis];
    }

    /**
     * Gets x-axis offset expressed in g.
     *
     * @return x-axis offset.
     */
    public double getOffsetX() {
        return offset[AccelerationTable.X];
    }

    /**
     * Gets y-axis offset expressed in g.
     *
     * @return y-axis offset.
     */
    public double getOffsetY() {
        return offset[AccelerationTable.Y];
    }

    /**
     * Gets z-axis offset expressed in g.
     *
     * @return z-axis offset.
     */
    public double getOffsetZ() {
        return offset[AccelerationTable.Z];
    }

    /**
     * Gets x-axis offset.
     *
     * @return x-axis offset.
     */
    public Acceleration getOffsetXAsAcceleration() {
        return createMeasurement(getOffsetX());
    }

    /**
     * Gets y-axis offset.
     *
     * @return y-axis offset.
     */
    public Acceleration getOffsetYAsAcceleration() {
        return createMeasurement(getOffsetY());
    }

    /**
     * Gets z-axis offset.
     *
     * @return z-axis offset.
     */
    public Acceleration getOffsetZAsAcceleration() {
        return createMeasurement(getOffsetZ());
    }

    /**
     * Gets scale factors for x, y, z axes.
     *
     * @return a copy of scale factors.
     */
    public double[] getScale() {
        return Arrays.copyOf(scale, AccelerationTable.AXES);
    }

    /**
     * Gets scale factor of provided axis.
     *
     * @param axis axis index.
     * @return scale factor.
     */
    public double getScale(final int axis) {
        return scale[axis];
    }

    /**
     * Gets x-axis scale factor.
     *
     * @return x-axis scale factor.
     */
    public double getScaleX() {
        return scale[AccelerationTable.X];
    }

    /**
     * Gets y-axis scale factor.
     *
     * @return y-axis scale factor.
     */
    public double getScaleY() {
        return scale[AccelerationTable.Y];
    }

    /**
     * Gets z-axis scale factor.
     *
     * @return z-axis scale factor.
     */
    public double getScaleZ() {
        return scale[AccelerationTable.Z];
    }

    /**
     * Gets calibration error before calibration expressed in g.
     *
     * @return calibration error before calibration.
     */
    public double getErrorStart() {
        return errorStart;
    }

    /**
     * Gets calibration error before calibration.
     *
     * @return calibration error before calibration.
     */
    public Acceleration getErrorStartAsAcceleration() {
        return createMeasurement(errorStart);
    }

    /**
     * Gets calibration error after calibration expressed in g.
     *
     * @return calibration error after calibration.
     */
    public double getErrorEnd() {
        return errorEnd;
    }

    /**
     * Gets calibration error after calibration.
     *
     * @return calibration error after calibration.
     */
    public Acceleration getErrorEndAsAcceleration() {
        return createMeasurement(errorEnd);
    }

    /**
     * Gets scale factors as a 3x3 diagonal matrix.
     * Off-diagonal terms are zero since axes are calibrated independently.
     *
     * @return scale factors matrix.
     */
    public Matrix getScaleMatrix() {
        final var result = createMatrix(AccelerationTable.AXES, AccelerationTable.AXES);
        for (var i = 0; i < AccelerationTable.AXES; i++) {
            result.setElementAt(i, i, scale[i]);
        }
        return result;
    }

    /**
     * Gets offsets as a 3x1 column matrix expressed in g.
     *
     * @return offsets matrix.
     */
    public Matrix getOffsetMatrix() {
        final var result = createMatrix(AccelerationTable.AXES, 1);
        for (var i = 0; i < AccelerationTable.AXES; i++) {
            result.setElementAt(i, 0, offset[i]);
        }
        return result;
    }

    @Override
    public boolean equals(final Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CalibrationParameters other)) {
            return false;
        }
        return Arrays.equals(offset, other.offset) && Arrays.equals(scale, other.scale)
                && Double.compare(errorStart, other.errorStart) == 0
                && Double.compare(errorEnd, other.errorEnd) == 0;
    }

    @Override
    public int hashCode() {
        var result = Arrays.hashCode(offset);
        result = 31 * result + Arrays.hashCode(scale);
        result = 31 * result + Double.hashCode(errorStart);
        result = 31 * result + Double.hashCode(errorEnd);
        return result;
    }

    @Override
    public String toString() {
        return "CalibrationParameters{offset=" + Arrays.toString(offset) + ", scale=" + Arrays.toString(scale)
                + ", errorStart=" + errorStart + ", errorEnd=" + errorEnd + "}";
    }

    private static Acceleration createMeasurement(final double value) {
        return new Acceleration(value, AccelerationUnit.G);
    }

    private static Matrix createMatrix(final int rows, final int columns) {
        try {
            return new Matrix(rows, columns);
        } catch (final WrongSizeException e) {
            // never happens
            throw new IllegalStateException(e);
        }
    }
}
