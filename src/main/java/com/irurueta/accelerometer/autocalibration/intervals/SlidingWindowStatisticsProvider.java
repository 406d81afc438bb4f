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
 * Computes statistics on a trailing window that slides one sample at a time.
 * For the sample at time {@code t} the window contains every sample with
 * timestamp in {@code (t - window, t]}. Leading samples whose window would
 * start before the first timestamp are trimmed, so one row is produced for
 * every remaining sample, labelled with its own timestamp.
 * Running sums are used so that the cost is linear on the number of samples.
 */
public class SlidingWindowStatisticsProvider implements WindowStatisticsProvider {

    @Override
    public WindowStatistics compute(final AccelerationTable acceleration, final double[] timestamps,
                                    final double windowSeconds) {
        WindowStatisticsUtils.checkInput(acceleration, timestamps, windowSeconds);

        final var n = timestamps.length;
        if (n == 0) {
            return new WindowStatistics(new double[0], new AccelerationTable(0), new AccelerationTable(0));
        }

        final var first = timestamps[0];
        final var outTimestamps = new double[n];
        final var mean = new AccelerationTable(n);
        final var std = new AccelerationTable(n);
        final var sum = new double[AccelerationTable.AXES];
        final var sumSqr = new double[AccelerationTable.AXES];

        var rows = 0;
        var tail = 0;
        for (var head = 0; head < n; head++) {
            final var t = timestamps[head];
            for (var axis = 0; axis < AccelerationTable.AXES; axis++) {
                final var value = acceleration.getValue(head, axis);
                sum[axis] += value;
                sumSqr[axis] += value * value;
            }
            while (timestamps[tail] <= t - windowSeconds) {
                for (var axis = 0; axis < AccelerationTable.AXES; axis++) {
                    final var value = acceleration.getValue(tail, axis);
                    sum[axis] -= value;
                    sumSqr[axis] -= value * value;
                }
                tail++;
            }

            if (t - first < windowSeconds) {
                // window not fully covered yet
                continue;
            }

            final var count = head - tail + 1;
            outTimestamps[rows] = t;
            for (var axis = 0; axis < AccelerationTable.AXES; axis++) {
                final var avg = sum[axis] / count;
                mean.setValue(rows, axis, avg);
                if (count < 2) {
                    std.setValue(rows, axis, Double.NaN);
                } else {
                    final var variance = (sumSqr[axis] - count * avg * avg) / (count - 1);
                    std.setValue(rows, axis, Math.sqrt(Math.max(variance, 0.0)));
                }
            }
            rows++;
        }

        return new WindowStatistics(Arrays.copyOf(outTimestamps, rows), mean.head(rows), std.head(rows));
    }
}
