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

import java.util.Arrays;

/**
 * Computes statistics on consecutive non-overlapping windows (epochs).
 * Epoch boundaries are aligned to multiples of the window duration, so that a
 * sample with timestamp {@code t} belongs to epoch {@code floor(t / window)}.
 * One row is produced for every epoch containing at least one sample, labelled
 * with the epoch start time.
 * Standard deviation uses the sample (n - 1) denominator, hence epochs with a
 * single sample have NaN standard deviation.
 */
public class EpochWindowStatisticsProvider implements WindowStatisticsProvider {

    @Override
    public WindowStatistics compute(final AccelerationTable acceleration, final double[] timestamps,
                                    final double windowSeconds) {
        WindowStatisticsUtils.checkInput(acceleration, timestamps, windowSeconds);

        final var n = timestamps.length;
        final var epochTimestamps = new double[n];
        final var mean = new AccelerationTable(n);
        final var std = new AccelerationTable(n);

        var rows = 0;
        var start = 0;
        while (start < n) {
            final var epoch = Math.floor(timestamps[start] / windowSeconds);
            var end = start + 1;
            while (end < n && Math.floor(timestamps[end] / windowSeconds) == epoch) {
                end++;
            }

            epochTimestamps[rows] = epoch * windowSeconds;
            for (var axis = 0; axis < AccelerationTable.AXES; axis++) {
                final var column = acceleration.getColumn(axis);
                final var avg = mean(column, start, end);
                mean.setValue(rows, axis, avg);
                std.setValue(rows, axis, standardDeviation(column, start, end, avg));
            }
            rows++;
            start = end;
        }

        return new WindowStatistics(Arrays.copyOf(epochTimestamps, rows), mean.head(rows), std.head(rows));
    }

    private static double mean(final double[] values, final int start, final int end) {
        var sum = 0.0;
        for (var i = start; i < end; i++) {
            sum += values[i];
        }
        return sum / (end - start);
    }

    private static double standardDeviation(final double[] values, final int start, final int end,
                                            final double mean) {
        final var count = end - start;
        if (count < 2) {
            return Double.NaN;
        }
        var sum = 0.0;
        for (var i = start; i < end; i++) {
            final var diff = values[i] - mean;
            sum += diff * diff;
        }
        return Math.sqrt(sum / (count - 1));
    }
}
