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
 * Computes windowed mean and standard deviation of acceleration.
 * Implementations decide how windows are laid out and how edges are handled;
 * output rows may be fewer than input samples.
 */
public interface WindowStatisticsProvider {

    /**
     * Computes windowed statistics.
     *
     * @param acceleration  acceleration samples expressed in g.
     * @param timestamps    timestamps expressed in seconds, one per sample and
     *                      non-decreasing.
     * @param windowSeconds window duration expressed in seconds.
     * @return windowed statistics.
     * @throws IllegalArgumentException if window duration is not positive or
     *                                  number of timestamps does not match number of
     *                                  samples.
     */
    WindowStatistics compute(final AccelerationTable acceleration, final double[] timestamps,
                             final double windowSeconds);
}
