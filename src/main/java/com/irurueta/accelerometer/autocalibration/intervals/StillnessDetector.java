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
package com.irurueta.accelerometer.autocalibration.intervals;

import com.irurueta.accelerometer.autocalibration.AccelerationTable;

/**
 * Classifies windows of acceleration as still (no motion) or moving.
 * A window is still when, for every axis, its standard deviation is below the
 * standard deviation criterion and the absolute value of its mean is below
 * {@link #MAX_STILL_MEAN_MAGNITUDE_G}.
 */
public class StillnessDetector {

    /**
     * Default standard deviation criterion expressed in g.
     * Suitable for GENEActiv devices. For other devices this should be about
     * 1.2 times the noise level measured on a bench-top test.
     */
    public static final double DEFAULT_SD_CRITERION = 0.013;

    /**
     * Maximum absolute mean on any axis for a window to be considered still,
     * expressed in g.
     */
    public static final double MAX_STILL_MEAN_MAGNITUDE_G = 2.0;

    /**
     * Standard deviation criterion expressed in g.
     */
    private final double sdCriterion;

    /**
     * Constructor using default standard deviation criterion.
     */
    public StillnessDetector() {
        this(DEFAULT_SD_CRITERION);
    }

    /**
     * Constructor.
     *
     * @param sdCriterion standard deviation criterion expressed in g.
     * @throws IllegalArgumentException if criterion is not positive.
     */
    public StillnessDetector(final double sdCriterion) {
        if (!(sdCriterion > 0.0)) {
            throw new IllegalArgumentException("standard deviation criterion must be positive");
        }
        this.sdCriterion = sdCriterion;
    }

    /**
     * Gets standard deviation criterion expressed in g.
     *
     * @return standard deviation criterion.
     */
    public double getSdCriterion() {
        return sdCriterion;
    }

    /**
     * Builds the stillness mask of provided statistics.
     *
     * @param statistics windowed statistics.
     * @return one value per row, true where the row is still.
     */
    public boolean[] detect(final WindowStatistics statistics) {
        final var mean = statistics.getMean();
        final var std = statistics.getStandardDeviation();
        final var rows = statistics.getRows();
        final var result = new boolean[rows];
        for (var i = 0; i < rows; i++) {
            var still = true;
            for (var axis = 0; axis < AccelerationTable.AXES && still; axis++) {
                // NaN deviations are never still
                still = std.getValue(i, axis) < sdCriterion
                        && Math.abs(mean.getValue(i, axis)) < MAX_STILL_MEAN_MAGNITUDE_G;
            }
            result[i] = still;
        }
        return result;
    }

    /**
     * Gets mean acceleration of still rows.
     *
     * @param statistics windowed statistics.
     * @return a new table containing mean values of still rows, in order.
     */
    public AccelerationTable extractStillMeans(final WindowStatistics statistics) {
        return select(statistics.getMean(), detect(statistics));
    }

    /**
     * Selects rows of a table where provided mask is true.
     *
     * @param table table to select rows from.
     * @param mask  mask indicating selected rows.
     * @return a new table containing selected rows, in order.
     * @throws IllegalArgumentException if mask length does not match table rows.
     */
    public static AccelerationTable select(final AccelerationTable table, final boolean[] mask) {
        if (mask.length != table.getRows()) {
            throw new IllegalArgumentException("mask length must match number of rows");
        }

        var count = 0;
        for (final var selected : mask) {
            if (selected) {
                count++;
            }
        }

        final var result = new AccelerationTable(count);
        var j = 0;
        for (var i = 0; i < mask.length; i++) {
            if (mask[i]) {
                result.setRow(j++, table.getValue(i, AccelerationTable.X), table.getValue(i, AccelerationTable.Y),
                        table.getValue(i, AccelerationTable.Z));
            }
        }
        return result;
    }
}
