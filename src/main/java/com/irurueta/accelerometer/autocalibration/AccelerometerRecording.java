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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Raw accelerometer recording to be calibrated.
 * Contains triaxial acceleration expressed in g, one timestamp per sample,
 * the sampling rate and any auxiliary sensor channel recorded by the same
 * device.
 */
public class AccelerometerRecording {

    /**
     * Raw acceleration samples.
     */
    private final AccelerationTable acceleration;

    /**
     * Timestamps expressed in seconds, one per acceleration sample.
     */
    private final double[] timestamps;

    /**
     * Sampling rate expressed in Hertz (Hz).
     */
    private final double samplingRate;

    /**
     * Auxiliary sensor channels.
     */
    private final Map<AuxiliarySensorType, AuxiliarySensorTable> auxiliaryTables;

    /**
     * Constructor.
     *
     * @param acceleration raw acceleration samples expressed in g.
     * @param timestamps   timestamps expressed in seconds.
     * @param samplingRate sampling rate expressed in Hertz (Hz).
     * @throws IllegalArgumentException if input data is malformed.
     */
    public AccelerometerRecording(final AccelerationTable acceleration, final double[] timestamps,
                                  final double samplingRate) {
        this(acceleration, timestamps, samplingRate, null);
    }

    /**
     * Constructor.
     *
     * @param acceleration    raw acceleration samples expressed in g.
     * @param timestamps      timestamps expressed in seconds.
     * @param samplingRate    sampling rate expressed in Hertz (Hz).
     * @param auxiliaryTables auxiliary sensor channels or null if none is available.
     * @throws IllegalArgumentException if acceleration or timestamps are null,
     *                                  their number of rows differ, sampling rate is
     *                                  not positive or timestamps decrease.
     */
    public AccelerometerRecording(final AccelerationTable acceleration, final double[] timestamps,
                                  final double samplingRate,
                                  final Map<AuxiliarySensorType, AuxiliarySensorTable> auxiliaryTables) {
        validate(acceleration, timestamps, samplingRate);

        this.acceleration = acceleration;
        this.timestamps = timestamps;
        this.samplingRate = samplingRate;

        final var tables = new EnumMap<AuxiliarySensorType, AuxiliarySensorTable>(AuxiliarySensorType.class);
        if (auxiliaryTables != null) {
            tables.putAll(auxiliaryTables);
        }
        this.auxiliaryTables = Collections.unmodifiableMap(tables);
    }

    /**
     * Gets raw acceleration samples expressed in g.
     *
     * @return raw acceleration samples.
     */
    public AccelerationTable getAcceleration() {
        return acceleration;
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
     * Gets sampling rate expressed in Hertz (Hz).
     *
     * @return sampling rate.
     */
    public double getSamplingRate() {
        return samplingRate;
    }

    /**
     * Gets number of acceleration samples.
     *
     * @return number of samples.
     */
    public int getRows() {
        return acceleration.getRows();
    }

    /**
     * Gets duration of this recording expressed in hours, computed from the
     * number of samples and the sampling rate.
     *
     * @return duration in hours.
     */
    public double getDurationHours() {
        return getRows() / (samplingRate * 3600.0);
    }

    /**
     * Gets auxiliary sensor channels.
     *
     * @return unmodifiable map of auxiliary channels.
     */
    public Map<AuxiliarySensorType, AuxiliarySensorTable> getAuxiliaryTables() {
        return auxiliaryTables;
    }

    /**
     * Gets an auxiliary sensor channel.
     *
     * @param type type of channel.
     * @return channel or null if not available.
     */
    public AuxiliarySensorTable getAuxiliaryTable(final AuxiliarySensorType type) {
        return auxiliaryTables.get(type);
    }

    /**
     * Validates raw input data.
     *
     * @param acceleration raw acceleration samples.
     * @param timestamps   timestamps expressed in seconds.
     * @param samplingRate sampling rate expressed in Hertz (Hz).
     * @throws IllegalArgumentException if input data is malformed.
     */
    static void validate(final AccelerationTable acceleration, final double[] timestamps,
                         final double samplingRate) {
        if (acceleration == null) {
            throw new IllegalArgumentException("acceleration must not be null");
        }
        if (timestamps == null) {
            throw new IllegalArgumentException("timestamps must not be null");
        }
        if (acceleration.getRows() != timestamps.length) {
            throw new IllegalArgumentException(String.format(
                    "acceleration rows (%d) and timestamps (%d) must have the same length",
                    acceleration.getRows(), timestamps.length));
        }
        if (!(samplingRate > 0.0) || Double.isInfinite(samplingRate)) {
            throw new IllegalArgumentException(String.format(
                    "sampling rate must be positive and finite but was %s", samplingRate));
        }
        for (var i = 1; i < timestamps.length; i++) {
            if (timestamps[i] < timestamps[i - 1]) {
                throw new IllegalArgumentException(String.format(
                        "timestamps must be non-decreasing (row %d: %s < %s)",
                        i, timestamps[i], timestamps[i - 1]));
            }
        }
    }
}
