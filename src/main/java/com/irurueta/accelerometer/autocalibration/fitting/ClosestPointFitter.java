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
package com.irurueta.accelerometer.autocalibration.fitting;

import com.irurueta.accelerometer.autocalibration.AccelerationTable;
import com.irurueta.accelerometer.autocalibration.CalibrationParameters;
import com.irurueta.accelerometer.autocalibration.LockedException;
import com.irurueta.accelerometer.autocalibration.NotReadyException;
import com.irurueta.accelerometer.autocalibration.intervals.EpochWindowStatisticsProvider;
import com.irurueta.accelerometer.autocalibration.intervals.SphereCoverage;
import com.irurueta.accelerometer.autocalibration.intervals.StillnessDetector;
import com.irurueta.accelerometer.autocalibration.intervals.WindowStatisticsProvider;
import com.irurueta.units.Acceleration;
import com.irurueta.units.AccelerationConverter;
import com.irurueta.units.AccelerationUnit;
import com.irurueta.units.Time;
import com.irurueta.units.TimeConverter;
import com.irurueta.units.TimeUnit;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Estimates per-axis scale and offset of an accelerometer by fitting still
 * periods to the unit sphere of gravity with an iterative closest point
 * approach.
 * Still periods are found on windowed statistics of acceleration. When they
 * populate both sides of every axis, each iteration projects calibrated
 * still samples onto the unit sphere and fits, for each axis, a weighted
 * linear regression from calibrated values to their projections. Regression
 * intercepts and slopes are accumulated into the offset and scale, and sample
 * weights are updated so that samples far from the sphere are down-weighted.
 * A fit is accepted when the mean absolute deviation of still vector norms
 * from 1g decreases and ends below {@link #MAX_ACCEPTED_ERROR}.
 */
public class ClosestPointFitter {

    /**
     * Default standard deviation criterion to detect still periods, expressed
     * in g.
     */
    public static final double DEFAULT_SD_CRITERION = StillnessDetector.DEFAULT_SD_CRITERION;

    /**
     * Default minimum acceleration on both sides of 0g for each axis, expressed
     * in g.
     */
    public static final double DEFAULT_SPHERE_CRITERION = SphereCoverage.DEFAULT_SPHERE_CRITERION;

    /**
     * Default maximum number of iterations.
     */
    public static final int DEFAULT_MAX_ITERATIONS = 1000;

    /**
     * Default tolerance on residual change to stop iterating.
     */
    public static final double DEFAULT_TOLERANCE = 1e-10;

    /**
     * Default duration of windows used to compute statistics, expressed in
     * seconds.
     */
    public static final double DEFAULT_STATISTICS_WINDOW_SECONDS = 10.0;

    /**
     * Maximum calibration error of an accepted fit, expressed in g.
     */
    public static final double MAX_ACCEPTED_ERROR = 0.01;

    /**
     * Number of decimals calibration errors are rounded to.
     */
    public static final int ERROR_DECIMALS = 5;

    private static final double ERROR_ROUNDING_FACTOR = Math.pow(10.0, ERROR_DECIMALS);

    private static final Logger LOGGER = Logger.getLogger(ClosestPointFitter.class.getName());

    /**
     * Standard deviation criterion to detect still periods, expressed in g.
     */
    private double sdCriterion = DEFAULT_SD_CRITERION;

    /**
     * Minimum acceleration on both sides of 0g for each axis, expressed in g.
     */
    private double sphereCriterion = DEFAULT_SPHERE_CRITERION;

    /**
     * Maximum number of iterations.
     */
    private int maxIterations = DEFAULT_MAX_ITERATIONS;

    /**
     * Tolerance on residual change to stop iterating.
     */
    private double tolerance = DEFAULT_TOLERANCE;

    /**
     * Duration of windows used to compute statistics, expressed in seconds.
     */
    private double statisticsWindowSeconds = DEFAULT_STATISTICS_WINDOW_SECONDS;

    /**
     * Computes windowed statistics used to detect still periods.
     */
    private WindowStatisticsProvider windowStatisticsProvider = new EpochWindowStatisticsProvider();

    /**
     * Listener to handle events raised by this fitter.
     */
    private ClosestPointFitterListener listener;

    /**
     * Indicates whether this fitter is running.
     */
    private boolean running;

    /**
     * Regression reused for every axis and iteration.
     */
    private final WeightedLinearRegression regression = new WeightedLinearRegression();

    /**
     * Constructor.
     */
    public ClosestPointFitter() {
    }

    /**
     * Constructor.
     *
     * @param listener listener to handle events.
     */
    public ClosestPointFitter(final ClosestPointFitterListener listener) {
        this.listener = listener;
    }

    /**
     * Constructor.
     *
     * @param sdCriterion     standard deviation criterion to detect still periods,
     *                        expressed in g.
     * @param sphereCriterion minimum acceleration on both sides of 0g for each
     *                        axis, expressed in g.
     * @param maxIterations   maximum number of iterations.
     * @param tolerance       tolerance on residual change to stop iterating.
     * @throws IllegalArgumentException if any value is not valid.
     */
    public ClosestPointFitter(final double sdCriterion, final double sphereCriterion, final int maxIterations,
                              final double tolerance) {
        try {
            setSdCriterion(sdCriterion);
            setSphereCriterion(sphereCriterion);
            setMaxIterations(maxIterations);
            setTolerance(tolerance);
        } catch (final LockedException ignore) {
            // never happens
        }
    }

    /**
     * Gets standard deviation criterion to detect still periods, expressed in g.
     *
     * @return standard deviation criterion.
     */
    public double getSdCriterion() {
        return sdCriterion;
    }

    /**
     * Sets standard deviation criterion to detect still periods, expressed in g.
     *
     * @param sdCriterion standard deviation criterion.
     * @throws LockedException          if fitter is running.
     * @throws IllegalArgumentException if value is not positive.
     */
    public void setSdCriterion(final double sdCriterion) throws LockedException {
        if (running) {
            throw new LockedException();
        }
        if (!(sdCriterion > 0.0)) {
            throw new IllegalArgumentException("standard deviation criterion must be positive");
        }
        this.sdCriterion = sdCriterion;
    }

    /**
     * Gets standard deviation criterion to detect still periods.
     *
     * @return standard deviation criterion.
     */
    public Acceleration getSdCriterionAsAcceleration() {
        return new Acceleration(sdCriterion, AccelerationUnit.G);
    }

    /**
     * Sets standard deviation criterion to detect still periods.
     *
     * @param sdCriterion standard deviation criterion.
     * @throws LockedException          if fitter is running.
     * @throws IllegalArgumentException if value is not positive.
     */
    public void setSdCriterion(final Acceleration sdCriterion) throws LockedException {
        setSdCriterion(convertAcceleration(sdCriterion));
    }

    /**
     * Gets minimum acceleration on both sides of 0g for each axis, expressed in g.
     *
     * @return sphere criterion.
     */
    public double getSphereCriterion() {
        return sphereCriterion;
    }

    /**
     * Sets minimum acceleration on both sides of 0g for each axis, expressed in g.
     *
     * @param sphereCriterion sphere criterion.
     * @throws LockedException          if fitter is running.
     * @throws IllegalArgumentException if value is negative.
     */
    public void setSphereCriterion(final double sphereCriterion) throws LockedException {
        if (running) {
            throw new LockedException();
        }
        if (!(sphereCriterion >= 0.0)) {
            throw new IllegalArgumentException("sphere criterion must be zero or positive");
        }
        this.sphereCriterion = sphereCriterion;
    }

    /**
     * Gets minimum acceleration on both sides of 0g for each axis.
     *
     * @return sphere criterion.
     */
    public Acceleration getSphereCriterionAsAcceleration() {
        return new Acceleration(sphereCriterion, AccelerationUnit.G);
    }

    /**
     * Sets minimum acceleration on both sides of 0g for each axis.
     *
     * @param sphereCriterion sphere criterion.
     * @throws LockedException          if fitter is running.
     * @throws IllegalArgumentException if value is negative.
     */
    public void setSphereCriterion(final Acceleration sphereCriterion) throws LockedException {
        setSphereCriterion(convertAcceleration(sphereCriterion));
    }

    /**
     * Gets maximum number of iterations.
     *
     * @return maximum number of iterations.
     */
    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * Sets maximum number of iterations.
     *
     * @param maxIterations maximum number of iterations.
     * @throws LockedException          if fitter is running.
     * @throws IllegalArgumentException if value is less than 1.
     */
    public void setMaxIterations(final int maxIterations) throws LockedException {
        if (running) {
            throw new LockedException();
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maximum number of iterations must be at least 1");
        }
        this.maxIterations = maxIterations;
    }

    /**
     * Gets tolerance on residual change to stop iterating.
     *
     * @return tolerance.
     */
    public double getTolerance() {
        return tolerance;
    }

    /**
     * Sets tolerance on residual change to stop iterating.
     *
     * @param tolerance tolerance.
     * @throws LockedException          if fitter is running.
     * @throws IllegalArgumentException if value is negative.
     */
    public void setTolerance(final double tolerance) throws LockedException {
        if (running) {
            throw new LockedException();
        }
        if (!(tolerance >= 0.0)) {
            throw new IllegalArgumentException("tolerance must be zero or positive");
        }
        this.tolerance = tolerance;
    }

    /**
     * Gets duration of windows used to compute statistics, expressed in seconds.
     *
     * @return window duration.
     */
    public double getStatisticsWindowSeconds() {
        return statisticsWindowSeconds;
    }

    /**
     * Sets duration of windows used to compute statistics, expressed in seconds.
     *
     * @param statisticsWindowSeconds window duration.
     * @throws LockedException          if fitter is running.
     * @throws IllegalArgumentException if value is not positive.
     */
    public void setStatisticsWindowSeconds(final double statisticsWindowSeconds) throws LockedException {
        if (running) {
            throw new LockedException();
        }
        if (!(statisticsWindowSeconds > 0.0) || Double.isInfinite(statisticsWindowSeconds)) {
            throw new IllegalArgumentException("statistics window must be positive and finite");
        }
        this.statisticsWindowSeconds = statisticsWindowSeconds;
    }

    /**
     * Gets duration of windows used to compute statistics.
     *
     * @return window duration.
     */
    public Time getStatisticsWindow() {
        return new Time(statisticsWindowSeconds, TimeUnit.SECOND);
    }

    /**
     * Sets duration of windows used to compute statistics.
     *
     * @param statisticsWindow window duration.
     * @throws LockedException          if fitter is running.
     * @throws IllegalArgumentException if value is not positive.
     */
    public void setStatisticsWindow(final Time statisticsWindow) throws LockedException {
        setStatisticsWindowSeconds(TimeConverter.convert(statisticsWindow.getValue().doubleValue(),
                statisticsWindow.getUnit(), TimeUnit.SECOND));
    }

    /**
     * Gets provider of windowed statistics used to detect still periods.
     *
     * @return window statistics provider.
     */
    public WindowStatisticsProvider getWindowStatisticsProvider() {
        return windowStatisticsProvider;
    }

    /**
     * Sets provider of windowed statistics used to detect still periods.
     *
     * @param windowStatisticsProvider window statistics provider.
     * @throws LockedException if fitter is running.
     */
    public void setWindowStatisticsProvider(final WindowStatisticsProvider windowStatisticsProvider)
            throws LockedException {
        if (running) {
            throw new LockedException();
        }
        this.windowStatisticsProvider = windowStatisticsProvider;
    }

    /**
     * Gets listener to handle events raised by this fitter.
     *
     * @return listener.
     */
    public ClosestPointFitterListener getListener() {
        return listener;
    }

    /**
     * Sets listener to handle events raised by this fitter.
     *
     * @param listener listener.
     * @throws LockedException if fitter is running.
     */
    public void setListener(final ClosestPointFitterListener listener) throws LockedException {
        if (running) {
            throw new LockedException();
        }
        this.listener = listener;
    }

    /**
     * Indicates whether this fitter is ready to fit raw acceleration.
     *
     * @return true if ready, false otherwise.
     */
    public boolean isReady() {
        return windowStatisticsProvider != null;
    }

    /**
     * Indicates whether this fitter is running.
     *
     * @return true if running, false otherwise.
     */
    public boolean isRunning() {
        return running;
    }

    /**
     * Detects still periods on raw acceleration and fits them to the unit sphere.
     *
     * @param acceleration raw acceleration expressed in g.
     * @param timestamps   timestamps expressed in seconds.
     * @return result of the fit.
     * @throws LockedException          if fitter is already running.
     * @throws NotReadyException        if no window statistics provider is set.
     * @throws IllegalArgumentException if number of timestamps does not match
     *                                  number of samples.
     */
    public ClosestPointFitResult fit(final AccelerationTable acceleration, final double[] timestamps)
            throws LockedException, NotReadyException {
        if (running) {
            throw new LockedException();
        }
        if (!isReady()) {
            throw new NotReadyException("window statistics provider is required");
        }

        try {
            running = true;

            if (listener != null) {
                listener.onFitStart(this);
            }

            final var statistics = windowStatisticsProvider.compute(acceleration, timestamps,
                    statisticsWindowSeconds);
            final var stillSamples = new StillnessDetector(sdCriterion).extractStillMeans(statistics);

            final var result = internalFit(stillSamples);

            if (listener != null) {
                listener.onFitEnd(this, result);
            }
            return result;
        } finally {
            running = false;
        }
    }

    /**
     * Fits already detected still samples to the unit sphere.
     *
     * @param stillSamples mean acceleration of still periods expressed in g.
     * @return result of the fit.
     * @throws LockedException if fitter is already running.
     */
    public ClosestPointFitResult fitStillSamples(final AccelerationTable stillSamples) throws LockedException {
        if (running) {
            throw new LockedException();
        }

        try {
            running = true;

            if (listener != null) {
                listener.onFitStart(this);
            }

            final var result = internalFit(stillSamples);

            if (listener != null) {
                listener.onFitEnd(this, result);
            }
            return result;
        } finally {
            running = false;
        }
    }

    /**
     * Computes calibration error as the mean absolute deviation of vector norms
     * from 1g after applying provided calibration, rounded to
     * {@link #ERROR_DECIMALS} decimals.
     *
     * @param stillSamples still samples expressed in g.
     * @param scale        scale factors.
     * @param offset       offsets expressed in g.
     * @return calibration error expressed in g.
     */
    public static double computeCalibrationError(final AccelerationTable stillSamples, final double[] scale,
                                                 final double[] offset) {
        final var rows = stillSamples.getRows();
        var sum = 0.0;
        for (var i = 0; i < rows; i++) {
            var sqrNorm = 0.0;
            for (var axis = 0; axis < AccelerationTable.AXES; axis++) {
                final var value = stillSamples.getValue(i, axis) * scale[axis] + offset[axis];
                sqrNorm += value * value;
            }
            sum += Math.abs(Math.sqrt(sqrNorm) - 1.0);
        }
        return round(sum / rows);
    }

    /**
     * Rounds provided error to {@link #ERROR_DECIMALS} decimals, with ties
     * rounded to even.
     *
     * @param value value to be rounded.
     * @return rounded value.
     */
    static double round(final double value) {
        return Math.rint(value * ERROR_ROUNDING_FACTOR) / ERROR_ROUNDING_FACTOR;
    }

    /**
     * Checks sphere coverage and runs the closest point iteration.
     *
     * @param stillSamples still samples expressed in g.
     * @return result of the fit.
     */
    private ClosestPointFitResult internalFit(final AccelerationTable stillSamples) {
        final var n = stillSamples.getRows();

        final var coveredAxes = SphereCoverage.countCoveredAxes(stillSamples, sphereCriterion);
        if (coveredAxes != AccelerationTable.AXES) {
            LOGGER.log(Level.FINE, String.format(
                    "Only %d axes covered by %d still samples beyond +/-%sg. Fit not attempted",
                    coveredAxes, n, sphereCriterion));
            return new ClosestPointFitResult(ClosestPointFitStatus.SPHERE_UNDERPOPULATED,
                    CalibrationParameters.createIdentity(), 0, n);
        }

        final var errorStart = computeCalibrationError(stillSamples, new double[]{1.0, 1.0, 1.0},
                new double[AccelerationTable.AXES]);

        final var curr = new double[AccelerationTable.AXES][n];
        final var closest = new double[AccelerationTable.AXES][n];

        var state = ClosestPointFitState.initial(n);
        for (var i = 0; i < maxIterations; i++) {
            state = iterate(stillSamples, state, curr, closest);

            final var iteration = state.getIterations();
            final var residual = state.getLastResidual();
            if (LOGGER.isLoggable(Level.FINEST)) {
                LOGGER.log(Level.FINEST, String.format("Iteration %d residual: %s", iteration, residual));
            }
            if (listener != null) {
                listener.onIterationCompleted(this, iteration, residual);
            }

            if (state.hasConverged(tolerance)) {
                break;
            }
        }

        final var scale = state.getScale();
        final var offset = state.getOffset();
        final var errorEnd = computeCalibrationError(stillSamples, scale, offset);

        final var status = errorEnd < errorStart && errorEnd < MAX_ACCEPTED_ERROR
                ? ClosestPointFitStatus.ACCEPTED : ClosestPointFitStatus.ERROR_NOT_IMPROVED;

        LOGGER.log(Level.FINE, String.format(
                "Closest point fit on %d still samples finished after %d iterations: %s (error %s -> %s)",
                n, state.getIterations(), status, errorStart, errorEnd));

        return new ClosestPointFitResult(status, new CalibrationParameters(offset, scale, errorStart, errorEnd),
                state.getIterations(), n);
    }

    /**
     * Runs one round of the closest point fit.
     *
     * @param stillSamples still samples expressed in g.
     * @param state        state after previous round.
     * @param curr         buffer to store calibrated samples.
     * @param closest      buffer to store closest points on the unit sphere.
     * @return state after this round.
     */
    private ClosestPointFitState iterate(final AccelerationTable stillSamples, final ClosestPointFitState state,
                                         final double[][] curr, final double[][] closest) {
        final var n = stillSamples.getRows();
        final var scale = state.scaleRef();
        final var offset = state.offsetRef();
        final var weights = state.weightsRef();

        // apply current calibration
        for (var axis = 0; axis < AccelerationTable.AXES; axis++) {
            final var column = stillSamples.getColumn(axis);
            final var currAxis = curr[axis];
            for (var j = 0; j < n; j++) {
                currAxis[j] = column[j] * scale[axis] + offset[axis];
            }
        }

        // project onto unit sphere
        for (var j = 0; j < n; j++) {
            final var x = curr[AccelerationTable.X][j];
            final var y = curr[AccelerationTable.Y][j];
            final var z = curr[AccelerationTable.Z][j];
            final var norm = Math.sqrt(x * x + y * y + z * z);
            closest[AccelerationTable.X][j] = x / norm;
            closest[AccelerationTable.Y][j] = y / norm;
            closest[AccelerationTable.Z][j] = z / norm;
        }

        final var offsetChange = new double[AccelerationTable.AXES];
        final var scaleChange = new double[AccelerationTable.AXES];
        for (var axis = 0; axis < AccelerationTable.AXES; axis++) {
            final var currAxis = curr[axis];
            regression.fit(currAxis, closest[axis], weights);
            offsetChange[axis] = regression.getIntercept();
            scaleChange[axis] = regression.getSlope();

            // fitted values without intercept
            for (var j = 0; j < n; j++) {
                currAxis[j] *= scaleChange[axis];
            }
        }

        // scale is updated before offset, and offset uses the updated scale
        final var newScale = new double[AccelerationTable.AXES];
        final var newOffset = new double[AccelerationTable.AXES];
        for (var axis = 0; axis < AccelerationTable.AXES; axis++) {
            newScale[axis] = scaleChange[axis] * scale[axis];
            newOffset[axis] = offsetChange[axis] + offset[axis] / newScale[axis];
        }

        var sumWeights = 0.0;
        for (final var w : weights) {
            sumWeights += w;
        }

        var sum = 0.0;
        final var newWeights = new double[n];
        for (var j = 0; j < n; j++) {
            var sqrDistance = 0.0;
            for (var axis = 0; axis < AccelerationTable.AXES; axis++) {
                final var diff = curr[axis][j] - closest[axis][j];
                sqrDistance += diff * diff;
            }
            sum += weights[j] * sqrDistance / sumWeights;
            newWeights[j] = Math.min(1.0 / Math.sqrt(sqrDistance), ClosestPointFitState.MAX_WEIGHT);
        }
        final var residual = 3.0 * sum / (AccelerationTable.AXES * n);

        return state.next(newOffset, newScale, newWeights, residual);
    }

    /**
     * Converts provided acceleration to g.
     *
     * @param acceleration acceleration to be converted.
     * @return converted value.
     */
    private static double convertAcceleration(final Acceleration acceleration) {
        final var value = acceleration.getValue().doubleValue();
        if (acceleration.getUnit() == AccelerationUnit.G) {
            return value;
        }
        return AccelerationConverter.convert(value, acceleration.getUnit(), AccelerationUnit.G);
    }
}
