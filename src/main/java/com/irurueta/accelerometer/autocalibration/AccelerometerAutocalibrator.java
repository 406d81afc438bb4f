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
import com.irurueta.accelerometer.autocalibration.fitting.ClosestPointFitter;
import com.irurueta.accelerometer.autocalibration.intervals.WindowStatisticsProvider;
import com.irurueta.units.Acceleration;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Calibrates raw accelerometer recordings by fitting their still periods to the
 * unit sphere of gravity.
 * Fitting starts on the leading {@link #getMinHours()} hours of the recording.
 * While the fit is not accepted and more data is available, the window grows
 * by {@link #EXPANSION_BLOCK_HOURS} hours and fitting is repeated on the new
 * leading window. Once a fit is accepted, its scale and offset are applied to
 * the whole recording.
 * Sampling rates so low that an expansion block holds no samples are rejected.
 * Recordings shorter than the minimum number of hours, or where no window
 * produces an accepted fit, are returned uncalibrated with zero parameters and
 * an advisory message. Those outcomes are reported through the result status,
 * the listener and a warning log, never as exceptions.
 */
public class AccelerometerAutocalibrator {

    /**
     * Default minimum acceleration on both sides of 0g for each axis, expressed
     * in g.
     */
    public static final double DEFAULT_SPHERE_CRITERION = ClosestPointFitter.DEFAULT_SPHERE_CRITERION;

    /**
     * Default minimum number of hours of data to use for calibration.
     */
    public static final int DEFAULT_MIN_HOURS = 72;

    /**
     * Default standard deviation criterion to detect still periods, expressed
     * in g.
     */
    public static final double DEFAULT_SD_CRITERION = ClosestPointFitter.DEFAULT_SD_CRITERION;

    /**
     * Default maximum number of closest point iterations.
     */
    public static final int DEFAULT_MAX_ITERATIONS = ClosestPointFitter.DEFAULT_MAX_ITERATIONS;

    /**
     * Default tolerance on residual change to stop iterating.
     */
    public static final double DEFAULT_TOLERANCE = ClosestPointFitter.DEFAULT_TOLERANCE;

    /**
     * Number of hours the fitting window grows each time a fit is not accepted.
     */
    public static final int EXPANSION_BLOCK_HOURS = 12;

    private static final double SECONDS_PER_HOUR = 3600.0;

    private static final Logger LOGGER = Logger.getLogger(AccelerometerAutocalibrator.class.getName());

    /**
     * States of a calibration run.
     */
    private enum State {
        INSUFFICIENT,
        FITTING,
        ACCEPTED,
        INVALID
    }

    /**
     * Fits leading windows of recordings.
     */
    private final ClosestPointFitter fitter = new ClosestPointFitter();

    /**
     * Minimum number of hours of data to use for calibration.
     */
    private int minHours = DEFAULT_MIN_HOURS;

    /**
     * Listener to handle events raised by this calibrator.
     */
    private AccelerometerAutocalibratorListener listener;

    /**
     * Indicates whether this calibrator is running.
     */
    private boolean running;

    /**
     * Constructor.
     */
    public AccelerometerAutocalibrator() {
    }

    /**
     * Constructor.
     *
     * @param listener listener to handle events.
     */
    public AccelerometerAutocalibrator(final AccelerometerAutocalibratorListener listener) {
        this.listener = listener;
    }

    /**
     * Constructor.
     *
     * @param sphereCriterion minimum acceleration on both sides of 0g for each
     *                        axis, expressed in g.
     * @param minHours        minimum number of hours of data to use for calibration.
     * @param sdCriterion     standard deviation criterion to detect still periods,
     *                        expressed in g.
     * @param maxIterations   maximum number of closest point iterations.
     * @param tolerance       tolerance on residual change to stop iterating.
     * @throws IllegalArgumentException if any value is not valid.
     */
    public AccelerometerAutocalibrator(final double sphereCriterion, final int minHours, final double sdCriterion,
                                       final int maxIterations, final double tolerance) {
        try {
            setSphereCriterion(sphereCriterion);
            setMinHours(minHours);
            setSdCriterion(sdCriterion);
            setMaxIterations(maxIterations);
            setTolerance(tolerance);
        } catch (final LockedException ignore) {
            // never happens
        }
    }

    /**
     * Constructor.
     *
     * @param sphereCriterion minimum acceleration on both sides of 0g for each
     *                        axis, expressed in g.
     * @param minHours        minimum number of hours of data to use for calibration.
     * @param sdCriterion     standard deviation criterion to detect still periods,
     *                        expressed in g.
     * @param maxIterations   maximum number of closest point iterations.
     * @param tolerance       tolerance on residual change to stop iterating.
     * @param listener        listener to handle events.
     * @throws IllegalArgumentException if any value is not valid.
     */
    public AccelerometerAutocalibrator(final double sphereCriterion, final int minHours, final double sdCriterion,
                                       final int maxIterations, final double tolerance,
                                       final AccelerometerAutocalibratorListener listener) {
        this(sphereCriterion, minHours, sdCriterion, maxIterations, tolerance);
        this.listener = listener;
    }

    /**
     * Gets minimum acceleration on both sides of 0g for each axis, expressed in g.
     *
     * @return sphere criterion.
     */
    public double getSphereCriterion() {
        return fitter.getSphereCriterion();
    }

    /**
     * Sets minimum acceleration on both sides of 0g for each axis, expressed in g.
     *
     * @param sphereCriterion sphere criterion.
     * @throws LockedException          if calibrator is running.
     * @throws IllegalArgumentException if value is negative.
     */
    public void setSphereCriterion(final double sphereCriterion) throws LockedException {
        checkLocked();
        fitter.setSphereCriterion(sphereCriterion);
    }

    /**
     * Gets minimum acceleration on both sides of 0g for each axis.
     *
     * @return sphere criterion.
     */
    public Acceleration getSphereCriterionAsAcceleration() {
        return fitter.getSphereCriterionAsAcceleration();
    }

    /**
     * Sets minimum acceleration on both sides of 0g for each axis.
     *
     * @param sphereCriterion sphere criterion.
     * @throws LockedException          if calibrator is running.
     * @throws IllegalArgumentException if value is negative.
     */
    public void setSphereCriterion(final Acceleration sphereCriterion) throws LockedException {
        checkLocked();
        fitter.setSphereCriterion(sphereCriterion);
    }

    /**
     * Gets minimum number of hours of data to use for calibration.
     *
     * @return minimum number of hours.
     */
    public int getMinHours() {
        return minHours;
    }

    /**
     * Sets minimum number of hours of data to use for calibration.
     *
     * @param minHours minimum number of hours.
     * @throws LockedException          if calibrator is running.
     * @throws IllegalArgumentException if value is less than 1.
     */
    public void setMinHours(final int minHours) throws LockedException {
        checkLocked();
        if (minHours < 1) {
            throw new IllegalArgumentException("minimum number of hours must be at least 1");
        }
        this.minHours = minHours;
    }

    /**
     * Gets standard deviation criterion to detect still periods, expressed in g.
     *
     * @return standard deviation criterion.
     */
    public double getSdCriterion() {
        return fitter.getSdCriterion();
    }

    /**
     * Sets standard deviation criterion to detect still periods, expressed in g.
     *
     * @param sdCriterion standard deviation criterion.
     * @throws LockedException          if calibrator is running.
     * @throws IllegalArgumentException if value is not positive.
     */
    public void setSdCriterion(final double sdCriterion) throws LockedException {
        checkLocked();
        fitter.setSdCriterion(sdCriterion);
    }

    /**
     * Gets standard deviation criterion to detect still periods.
     *
     * @return standard deviation criterion.
     */
    public Acceleration getSdCriterionAsAcceleration() {
        return fitter.getSdCriterionAsAcceleration();
    }

    /**
     * Sets standard deviation criterion to detect still periods.
     *
     * @param sdCriterion standard deviation criterion.
     * @throws LockedException          if calibrator is running.
     * @throws IllegalArgumentException if value is not positive.
     */
    public void setSdCriterion(final Acceleration sdCriterion) throws LockedException {
        checkLocked();
        fitter.setSdCriterion(sdCriterion);
    }

    /**
     * Gets maximum number of closest point iterations.
     *
     * @return maximum number of iterations.
     */
    public int getMaxIterations() {
        return fitter.getMaxIterations();
    }

    /**
     * Sets maximum number of closest point iterations.
     *
     * @param maxIterations maximum number of iterations.
     * @throws LockedException          if calibrator is running.
     * @throws IllegalArgumentException if value is less than 1.
     */
    public void setMaxIterations(final int maxIterations) throws LockedException {
        checkLocked();
        fitter.setMaxIterations(maxIterations);
    }

    /**
     * Gets tolerance on residual change to stop iterating.
     *
     * @return tolerance.
     */
    public double getTolerance() {
        return fitter.getTolerance();
    }

    /**
     * Sets tolerance on residual change to stop iterating.
     *
     * @param tolerance tolerance.
     * @throws LockedException          if calibrator is running.
     * @throws IllegalArgumentException if value is negative.
     */
    public void setTolerance(final double tolerance) throws LockedException {
        checkLocked();
        fitter.setTolerance(tolerance);
    }

    /**
     * Gets duration of windows used to detect still periods, expressed in
     * seconds.
     *
     * @return window duration.
     */
    public double getStatisticsWindowSeconds() {
        return fitter.getStatisticsWindowSeconds();
    }

    /**
     * Sets duration of windows used to detect still periods, expressed in
     * seconds.
     *
     * @param statisticsWindowSeconds window duration.
     * @throws LockedException          if calibrator is running.
     * @throws IllegalArgumentException if value is not positive.
     */
    public void setStatisticsWindowSeconds(final double statisticsWindowSeconds) throws LockedException {
        checkLocked();
        fitter.setStatisticsWindowSeconds(statisticsWindowSeconds);
    }

    /**
     * Gets provider of windowed statistics used to detect still periods.
     *
     * @return window statistics provider.
     */
    public WindowStatisticsProvider getWindowStatisticsProvider() {
        return fitter.getWindowStatisticsProvider();
    }

    /**
     * Sets provider of windowed statistics used to detect still periods.
     *
     * @param windowStatisticsProvider window statistics provider.
     * @throws LockedException if calibrator is running.
     */
    public void setWindowStatisticsProvider(final WindowStatisticsProvider windowStatisticsProvider)
            throws LockedException {
        checkLocked();
        fitter.setWindowStatisticsProvider(windowStatisticsProvider);
    }

    /**
     * Gets listener to handle events raised by this calibrator.
     *
     * @return listener.
     */
    public AccelerometerAutocalibratorListener getListener() {
        return listener;
    }

    /**
     * Sets listener to handle events raised by this calibrator.
     *
     * @param listener listener.
     * @throws LockedException if calibrator is running.
     */
    public void setListener(final AccelerometerAutocalibratorListener listener) throws LockedException {
        checkLocked();
        this.listener = listener;
    }

    /**
     * Indicates whether this calibrator is ready to start calibration.
     *
     * @return true if ready, false otherwise.
     */
    public boolean isReady() {
        return fitter.isReady();
    }

    /**
     * Indicates whether this calibrator is running.
     *
     * @return true if running, false otherwise.
     */
    public boolean isRunning() {
        return running;
    }

    /**
     * Calibrates provided raw acceleration.
     *
     * @param acceleration raw acceleration expressed in g.
     * @param timestamps   timestamps expressed in seconds.
     * @param samplingRate sampling rate expressed in Hertz (Hz).
     * @return result of calibration.
     * @throws LockedException          if calibrator is already running.
     * @throws NotReadyException        if calibrator is not ready.
     * @throws IllegalArgumentException if input data is malformed.
     */
    public AutocalibrationResult calibrate(final AccelerationTable acceleration, final double[] timestamps,
                                           final double samplingRate) throws LockedException, NotReadyException {
        return calibrate(new AccelerometerRecording(acceleration, timestamps, samplingRate));
    }

    /**
     * Calibrates provided recording.
     *
     * @param recording recording to be calibrated.
     * @return result of calibration.
     * @throws LockedException          if calibrator is already running.
     * @throws NotReadyException        if calibrator is not ready.
     * @throws IllegalArgumentException if recording is null or its sampling rate is
     *                                  so low that an expansion block of
     *                                  {@link #EXPANSION_BLOCK_HOURS} hours holds no
     *                                  samples.
     */
    public AutocalibrationResult calibrate(final AccelerometerRecording recording) throws LockedException,
            NotReadyException {
        checkLocked();
        if (recording == null) {
            throw new IllegalArgumentException("recording must not be null");
        }
        if (!isReady()) {
            throw new NotReadyException("window statistics provider is required");
        }
        if (samplesForHours(EXPANSION_BLOCK_HOURS, recording.getSamplingRate()) == 0) {
            throw new IllegalArgumentException(String.format(
                    "sampling rate %s Hz is too low to hold a sample every %d hours", recording.getSamplingRate(),
                    EXPANSION_BLOCK_HOURS));
        }

        try {
            running = true;

            if (listener != null) {
                listener.onStart(this);
            }

            final var result = internalCalibrate(recording);

            if (listener != null) {
                listener.onFinish(this, result);
            }
            return result;
        } finally {
            running = false;
        }
    }

    /**
     * Gets number of samples covering provided number of hours, truncated to an
     * integer.
     *
     * @param hours        number of hours.
     * @param samplingRate sampling rate expressed in Hertz (Hz).
     * @return number of samples.
     */
    static long samplesForHours(final int hours, final double samplingRate) {
        return (long) (hours * SECONDS_PER_HOUR * samplingRate);
    }

    /**
     * Runs the window expansion state machine.
     *
     * @param recording recording to be calibrated.
     * @return result of calibration.
     * @throws LockedException   never, fitter is owned by this instance.
     * @throws NotReadyException if fitter is not ready.
     */
    private AutocalibrationResult internalCalibrate(final AccelerometerRecording recording)
            throws LockedException, NotReadyException {
        final var acceleration = recording.getAcceleration();
        final var timestamps = recording.getTimestamps();
        final var samplingRate = recording.getSamplingRate();
        final var n = recording.getRows();

        final var minSamples = samplesForHours(minHours, samplingRate);
        final var blockSamples = samplesForHours(EXPANSION_BLOCK_HOURS, samplingRate);

        var state = n < minSamples ? State.INSUFFICIENT : State.FITTING;
        var windowIndex = 0;
        var windowsFitted = 0;
        var hoursUsed = 0.0;
        ClosestPointFitResult fit = null;

        while (state == State.FITTING) {
            final var windowSamples = minSamples + windowIndex * blockSamples;
            final var rows = (int) Math.min(windowSamples, n);
            final var windowHours = minHours + windowIndex * EXPANSION_BLOCK_HOURS;

            LOGGER.log(Level.FINE, String.format("Fitting leading %d hours (%d samples)", windowHours, rows));

            // each window is fitted from scratch
            fit = fitter.fit(acceleration.head(rows), Arrays.copyOf(timestamps, rows));
            windowsFitted++;
            hoursUsed = rows / (samplingRate * SECONDS_PER_HOUR);

            if (listener != null) {
                listener.onWindowFitted(this, windowIndex, windowHours, fit);
            }

            if (fit.isAccepted()) {
                state = State.ACCEPTED;
            } else if (windowSamples >= n) {
                state = State.INVALID;
            } else {
                windowIndex++;
            }
        }

        switch (state) {
            case INSUFFICIENT:
                final var availableHours = recording.getDurationHours();
                final var insufficientMessage = String.format(
                        "Less than %d hours of data (%s hours). No Calibration performed", minHours, availableHours);
                LOGGER.log(Level.WARNING, insufficientMessage);
                if (listener != null) {
                    listener.onInsufficientData(this, availableHours);
                }
                return new AutocalibrationResult(recording, acceleration, CalibrationParameters.createUncalibrated(),
                        AutocalibrationStatus.INSUFFICIENT_DATA, 0, 0.0, insufficientMessage, null);
            case INVALID:
                final var invalidMessage = String.format(
                        "Calibration not done with %d - %d hours due to insufficient non-movement data available",
                        minHours + (windowIndex - 1) * EXPANSION_BLOCK_HOURS,
                        minHours + windowIndex * EXPANSION_BLOCK_HOURS);
                LOGGER.log(Level.WARNING, invalidMessage);
                if (listener != null) {
                    listener.onCalibrationInvalid(this, invalidMessage);
                }
                return new AutocalibrationResult(recording, acceleration, CalibrationParameters.createUncalibrated(),
                        AutocalibrationStatus.INVALID, windowsFitted, hoursUsed, invalidMessage, fit);
            case ACCEPTED:
            default:
                final var parameters = fit.getParameters();
                LOGGER.log(Level.FINE, String.format("Calibration accepted using %s hours: %s", hoursUsed,
                        parameters));
                // calibration is applied once, to the whole raw recording
                final var calibrated = AffineCalibration.apply(acceleration, parameters);
                return new AutocalibrationResult(recording, calibrated, parameters,
                        AutocalibrationStatus.CALIBRATED, windowsFitted, hoursUsed, null, fit);
        }
    }

    private void checkLocked() throws LockedException {
        if (running) {
            throw new LockedException();
        }
    }
}
