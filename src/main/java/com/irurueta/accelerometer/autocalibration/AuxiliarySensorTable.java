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
 * Single channel of auxiliary sensor values with their timestamps.
 */
public class AuxiliarySensorTable {

    /**
     * Timestamps expressed in seconds.
     */
    private final double[] timestamps;

    /**
     * Sensor values.
     */
    private final double[] values;

    /**
     * Constructor.
     *
     * @param timestamps timestamps expressed in seconds.
     * @param values     sensor values.
     * @throws IllegalArgumentException if any array is null or their lengths differ.
     */
    public AuxiliarySensorTable(final double[] timestamps, final double[] values) {
        if (timestamps == null || values == null) {
            throw new IllegalArgumentException("timestamps and values must not be null");
        }
        if (timestamps.length != values.length) {
            throw new IllegalArgumentException(String.format(
                    "timestamps (%d) and values (%d) must have the same length",
                    timestamps.length, values.length));
        }
        this.timestamps = timestamps;
        this.values = values;
    }

    /**
     * Gets timestamps expressed in seconds.
     *
     * @return timestamps.
     */
    public double[] getTimestamps() {
        return timestamps;
    }

    /**
     * Gets sensor values.
     *
     * @return sensor values.
     */
    public double[] getValues() {
        return values;
    }

    /**
     * Gets number of samples.
     *
     * @return number of samples.
     */
    public int getRows() {
        return values.length;
    }

    @Override
    public boolean equals(final Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof AuxiliarySensorTable other)) {
            return false;
        }
        return Arrays.equals(timestamps, other.timestamps) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(timestamps) + Arrays.hashCode(values);
    }
}
