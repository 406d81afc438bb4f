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

import com.irurueta.accelerometer.autocalibration.fitting.ClosestPointFitResult;

/**
 * Listener to handle events raised by {@link AccelerometerAutocalibrator}.
 */
public interface AccelerometerAutocalibratorListener {

    /**
     * Called when calibration starts.
     *
     * @param calibrator calibrator raising this event.
     */
    void onStart(final AccelerometerAutocalibrator calibrator);

    /**
     * Called each time a leading window of the recording has been fitted.
     *
     * @param calibrator  calibrator raising this event.
     * @param windowIndex index of the window (0 for the minimum number of hours,
     *                    then one more for each 12 hour block).
     * @param windowHours nominal hours covered by the window.
     * @param result      result of the fit.
     */
    void onWindowFitted(final AccelerometerAutocalibrator calibrator, final int windowIndex,
                        final int windowHours, final ClosestPointFitResult result);

    /**
     * Called when the recording is too short to attempt calibration.
     *
     * @param calibrator     calibrator raising this event.
     * @param availableHours hours of data available.
     */
    void onInsufficientData(final AccelerometerAutocalibrator calibrator, final double availableHours);

    /**
     * Called when no window produced an accepted fit.
     *
     * @param calibrator calibrator raising this event.
     * @param message    advisory message naming the attempted hour range.
     */
    void onCalibrationInvalid(final AccelerometerAutocalibrator calibrator, final String message);

    /**
     * Called when calibration finishes, whatever its outcome.
     *
     * @param calibrator calibrator raising this event.
     * @param result     result of calibration.
     */
    void onFinish(final AccelerometerAutocalibrator calibrator, final AutocalibrationResult result);
}
