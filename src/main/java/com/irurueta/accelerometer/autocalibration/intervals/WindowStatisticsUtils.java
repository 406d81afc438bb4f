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
 * Input checks shared by window statistics providers.
 */
final class WindowStatisticsUtils {

    private WindowStatisticsUtils() {
    }

    static void checkInput(final AccelerationTable acceleration, final double[] timestamps,
                           final double windowSeconds) {
        if (!(windowSeconds > 0.0) || Double.isInfinite(windowSeconds)) {
            throw new IllegalArgumentException(String.format(
                    "window duration must be positive and finite but was %s", windowSeconds));
        }
        if (acceleration.getRows() != timestamps.length) {
            throw new IllegalArgumentException(String.format(
                    "acceleration rows (%d) and timestamps (%d) must have the same length",
                    acceleration.getRows(), timestamps.length));
        }
    }
}
