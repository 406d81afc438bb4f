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

import java.util.Map;

/**
 * Result of calibrating an {@link AccelerometerRecording}.
 * Calibrated acceleration and timestamps always have as many rows as the
 * original recording. When calibration does not succeed, calibrated
 * acceleration is the raw acceleration and all parameters are zero.
 */
public class AutocalibrationResult {

    private final AccelerationTable calibratedAcceleration;

    private final CalibrationParameters parameters;

    private final double samplingRate;

    private final double[] timestamps;

    private final Map<AuxiliarySensorType, AuxiliarySensorTable> auxiliaryTables;

    private final AutocalibrationStatus status;

    private final int windowsFitted;

    private final double hoursUsed;

    private final String message;

    private final ClosestPointFitResult lastFit;

    /**
     * Constructor.
     *
     * @param recording              recording that was calibrated.
     * @param calibratedAcceleration calibrated acceleration, or raw acceleration if
     *                               calibration did not succeed.
     * @param parameters             calibration parameters.
     * @param status                 outcome of the run.
     * @param windowsFitted          number of windows that have been fitted.
     * @param hoursUsed              hours of data used on the last fitted window.
     * @param message                advisory message or null if calibrated.
     * @param lastFit                result of the last fitted window or null.
     */
    AutocalibrationResult(final AccelerometerRecording recording, final AccelerationTable calibratedAcceleration,
                          final CalibrationParameters parameters, final AutocalibrationStatus status,
                          final int windowsFitted, final double hoursUsed, final String message,
                          final ClosestPointFitResult lastFit) {
        this.calibratedAcceleration = calibratedAcceleration;
        this.parameters = parameters;
        this.samplingRate = recording.getSamplingRate();
        this.timestamps = recording.getTimestamps();
        this.auxiliaryTables = recording.getAuxiliaryTables();
        this.status = status;
        this.windowsFitted = windowsFitted;
        this.hoursUsed = hoursUsed;
        this.message = message;
        this.lastFit = lastFit;
    }

    /**
     * Gets calibrated acceleration expressed in g.
     * This is the raw acceleration if calibration did not succeed.
     *
     * @return calibrated acceleration.
     */
    public AccelerationTable getCalibratedAcceleration() {
        return calibratedAcceleration;
    }

    /**
     * Gets calibration parameters.
     *
     * @return calibration parameters.
     */
    public CalibrationParameters getParameters() {
        return parameters;
    }

    /**
     * Gets scale factors.
     *
     * @return scale factors.
     */
    public double[] getScale() {
        return parameters.getScale();
    }

    /**
     * Gets offsets expressed in g.
     *
     * @return offsets.
     */
    public double[] getOffset() {
        return parameters.getOffset();
    }

    /**
     * Gets calibration error before calibration expressed in g.
     *
     * @return calibration error before calibration.
     */
    public double getCalibrationErrorStart() {
        return parameters.getErrorStart();
    }

    /**
     * Gets calibration error after calibration expressed in g.
     *
     * @return calibration error after calibration.
     */
    public double getCalibrationErrorEnd() {
        return parameters.getErrorEnd();
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
     * Gets timestamps of the whole recording expressed in seconds.
     *
     * @return timestamps.
     */
    public double[] getTimestamps() {
        return timestamps;
    }

    /**
     * Gets auxiliary sensor channels, forwarded unchanged from the recording.
     *
     * @return auxiliary channels.
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
     * Gets outcome of the run.
     *
     * @return outcome of the run.
     */
    public AutocalibrationStatus getStatus() {
        return status;
    }

    /**
     * Indicates whether recording has been calibrated.
     *
     * @return true if calibrated, false otherwise.
     */
    public boolean isCalibrated() {
        return status == AutocalibrationStatus.CALIBRATED;
    }

    /**
     * Gets number of windows that have been fitted.
     *
     * @return number of fitted windows.
     */
    public int getWindowsFitted() {
        return windowsFitted;
    }

    /**
     * Gets hours of data used on the last fitted window.
     *
     * @return hours of data used, or zero if no window was fitted.
     */
    public double getHoursUsed() {
        return hoursUsed;
    }

    /**
     * Gets advisory message explaining why calibration did not succeed.
     *
     * @return advisory message or null if calibrated.
     */
    public String getMessage() {
        return message;
    }

    /**
     * Gets result of the last fitted window.
     *
     * @return last fit result or null if no window was fitted.
     */
    public ClosestPointFitResult getLastFit() {
        return lastFit;
    }
}
