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
 * Per-axis mean and standard deviation of acceleration over windows of fixed
 * duration.
 * Each row corresponds to one window and is labelled with a timestamp chosen
 * by the {@link WindowStatisticsProvider} that produced it.
 */
public class WindowStatistics {

    /**
     * Timestamp of each row expressed in seconds.
     */
    private final double[] timestamps;

    /**
     * Mean of each axis on each window expressed in g.
     */
    private final AccelerationTable mean;

    /**
     * Standard deviation of each axis on each window expressed in g.
     */
    private final AccelerationTable standardDeviation;

    /**
     * Constructor.
     *
     * @param timestamps        timestamp of each row expressed in seconds.
     * @param mean              mean of each axis on each row.
     * @param standardDeviation standard deviation of each axis on each row.
     * @throws IllegalArgumentException if number of rows differ.
     */
    public WindowStatistics(final double[] timestamps, final AccelerationTable mean,
                            final AccelerationTable standardDeviation) {
        if (timestamps.length != mean.getRows() || timestamps.length != standardDeviation.getRows()) {
            throw new IllegalArgumentException("timestamps, mean and standard deviation must have the same rows");
        }
        this.timestamps = timestamps;
        this.mean = mean;
        this.standardDeviation = standardDeviation;
    }

    /**
     * Gets number of rows.
     *
     * @return number of rows.
     */
    public int getRows() {
        return timestamps.length;
    }

    /**
     * Gets timestamp of each row expressed in seconds.
     *
     * @return timestamps.
     */
    public double[] getTimestamps() {
        return timestamps;
    }

    /**
     * Gets mean of each axis expressed in g.
     *
     * @return mean values.
     */
    public AccelerationTable getMean() {
        return mean;
    }

    /**
     * Gets standard deviation of each axis expressed in g.
     *
     * @return standard deviation values.
     */
    public AccelerationTable getStandardDeviation() {
        return standardDeviation;
    }
}
