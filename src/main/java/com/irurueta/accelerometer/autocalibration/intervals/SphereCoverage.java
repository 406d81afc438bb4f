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
 * Checks whether still samples populate the unit sphere well enough to obtain
 * a meaningful calibration.
 * An axis is covered when still samples reach below {@code -criterion} and
 * above {@code +criterion} on that axis.
 */
public final class SphereCoverage {

    /**
     * Default minimum acceleration on both sides of 0g for each axis,
     * expressed in g.
     */
    public static final double DEFAULT_SPHERE_CRITERION = 0.3;

    private SphereCoverage() {
    }

    /**
     * Counts the number of axes covered by provided still samples.
     *
     * @param stillSamples still samples expressed in g.
     * @param criterion    minimum acceleration on both sides of 0g expressed in g.
     * @return number of covered axes, between 0 and 3.
     */
    public static int countCoveredAxes(final AccelerationTable stillSamples, final double criterion) {
        if (stillSamples.isEmpty()) {
            return 0;
        }

        var result = 0;
        for (var axis = 0; axis < AccelerationTable.AXES; axis++) {
            if (stillSamples.getMin(axis) < -criterion && stillSamples.getMax(axis) > criterion) {
                result++;
            }
        }
        return result;
    }

    /**
     * Indicates whether all three axes are covered.
     *
     * @param stillSamples still samples expressed in g.
     * @param criterion    minimum acceleration on both sides of 0g expressed in g.
     * @return true if sphere is sufficiently populated, false otherwise.
     */
    public static boolean isCovered(final AccelerationTable stillSamples, final double criterion) {
        return countCoveredAxes(stillSamples, criterion) == AccelerationTable.AXES;
    }
}
