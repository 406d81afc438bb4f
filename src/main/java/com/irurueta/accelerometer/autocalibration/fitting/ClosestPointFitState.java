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

import java.util.Arrays;

/**
 * State of the closest point fit after a number of completed rounds.
 * Each round produces a new instance from the previous one; instances are
 * never modified.
 */
public final class ClosestPointFitState {

    /**
     * Initial weight of every sample. Also the maximum weight a sample can get.
     */
    public static final double MAX_WEIGHT = 100.0;

    /**
     * Accumulated offsets expressed in g.
     */
    private final double[] offset;

    /**
     * Accumulated scale factors.
     */
    private final double[] scale;

    /**
     * Weight of each still sample for next round.
     */
    private final double[] weights;

    /**
     * Residuals of completed rounds, preceded by positive infinity.
     */
    private final double[] residualHistory;

    private ClosestPointFitState(final double[] offset, final double[] scale, final double[] weights,
                                 final double[] residualHistory) {
        this.offset = offset;
        this.scale = scale;
        this.weights = weights;
        this.residualHistory = residualHistory;
    }

    /**
     * Creates the state before the first round: zero offset, unit scale and
     * maximum weight for every sample.
     *
     * @param samples number of still samples.
     * @return initial state.
     */
    public static ClosestPointFitState initial(final int samples) {
        final var weights = new double[samples];
        Arrays.fill(weights, MAX_WEIGHT);
        return new ClosestPointFitState(new double[AccelerationTable.AXES], new double[]{1.0, 1.0, 1.0}, weights,
                new double[]{Double.POSITIVE_INFINITY});
    }

    /**
     * Creates the state that follows this one after a completed round.
     *
     * @param offset   accumulated offsets.
     * @param scale    accumulated scale factors.
     * @param weights  weights for next round.
     * @param residual residual of completed round.
     * @return next state.
     */
    ClosestPointFitState next(final double[] offset, final double[] scale, final double[] weights,
                              final double residual) {
        final var history = Arrays.copyOf(residualHistory, residualHistory.length + 1);
        history[history.length - 1] = residual;
        return new ClosestPointFitState(offset, scale, weights, history);
    }

    /**
     * Gets number of completed rounds.
     *
     * @return number of completed rounds.
     */
    public int getIterations() {
        return residualHistory.length - 1;
    }

    /**
     * Indicates whether the fit has converged for provided tolerance.
     * After round {@code i} (0-based) the residual history holds {@code i + 2}
     * values and the fit converges when
     * {@code |history[i] - history[i - 1]| < tolerance}, where index -1 refers
     * to the last value. Because history starts with infinity, the two first
     * rounds never converge.
     *
     * @param tolerance tolerance on residual change.
     * @return true if converged, false otherwise.
     */
    public boolean hasConverged(final double tolerance) {
        final var i = getIterations() - 1;
        if (i < 0) {
            return false;
        }
        final var previous = i >= 1 ? residualHistory[i - 1] : residualHistory[residualHistory.length - 1];
        return Math.abs(residualHistory[i] - previous) < tolerance;
    }

    /**
     * Gets accumulated offsets expressed in g.
     *
     * @return a copy of offsets.
     */
    public double[] getOffset() {
        return Arrays.copyOf(offset, offset.length);
    }

    /**
     * Gets accumulated scale factors.
     *
     * @return a copy of scale factors.
     */
    public double[] getScale() {
        return Arrays.copyOf(scale, scale.length);
    }

    /**
     * Gets weights of still samples for next round.
     *
     * @return a copy of weights.
     */
    public double[] getWeights() {
        return Arrays.copyOf(weights, weights.length);
    }

    /**
     * Gets residual history, starting with positive infinity and followed by the
     * residual of each completed round.
     *
     * @return a copy of residual history.
     */
    public double[] getResidualHistory() {
        return Arrays.copyOf(residualHistory, residualHistory.length);
    }

    /**
     * Gets residual of last completed round.
     *
     * @return last residual, or positive infinity if no round has completed.
     */
    public double getLastResidual() {
        return residualHistory[residualHistory.length - 1];
    }

    double[] offsetRef() {
        return offset;
    }

    double[] scaleRef() {
        return scale;
    }

    double[] weightsRef() {
        return weights;
    }
}
