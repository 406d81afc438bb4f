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
package com.irurueta.accelerometer.autocalibration.fitting;

/**
 * Fits a single-feature linear model {@code y = intercept + slope * x} by
 * weighted least squares.
 * Data is centred on weighted means before solving, so that the intercept and
 * slope match an ordinary weighted regression with intercept.
 * When x has no weighted variance the slope is zero and the intercept is the
 * weighted mean of y.
 * Instances can be reused for consecutive fits.
 */
public class WeightedLinearRegression {

    /**
     * Estimated intercept.
     */
    private double intercept;

    /**
     * Estimated slope.
     */
    private double slope = 1.0;

    /**
     * Fits the model.
     *
     * @param x       feature values.
     * @param y       target values.
     * @param weights sample weights. Must be non-negative with positive sum.
     * @throws IllegalArgumentException if arrays do not have the same length or are
     *                                  empty.
     */
    public void fit(final double[] x, final double[] y, final double[] weights) {
        final var n = x.length;
        if (n == 0 || y.length != n || weights.length != n) {
            throw new IllegalArgumentException("x, y and weights must be non-empty and have the same length");
        }

        var sumW = 0.0;
        var sumWx = 0.0;
        var sumWy = 0.0;
        for (var i = 0; i < n; i++) {
            final var w = weights[i];
            sumW += w;
            sumWx += w * x[i];
            sumWy += w * y[i];
        }
        final var meanX = sumWx / sumW;
        final var meanY = sumWy / sumW;

        var sxx = 0.0;
        var sxy = 0.0;
        for (var i = 0; i < n; i++) {
            final var w = weights[i];
            final var dx = x[i] - meanX;
            sxx += w * dx * dx;
            sxy += w * dx * (y[i] - meanY);
        }

        slope = sxx != 0.0 ? sxy / sxx : 0.0;
        intercept = meanY - slope * meanX;
    }

    /**
     * Gets estimated intercept.
     *
     * @return estimated intercept.
     */
    public double getIntercept() {
        return intercept;
    }

    /**
     * Gets estimated slope.
     *
     * @return estimated slope.
     */
    public double getSlope() {
        return slope;
    }
}
