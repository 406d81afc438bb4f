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

import com.irurueta.accelerometer.autocalibration.CalibrationParameters;

/**
 * Result of a closest point fit.
 * Offset and scale are kept whatever the status, so that callers can inspect
 * rejected fits.
 */
public class ClosestPointFitResult {

    /**
     * Outcome of the fit.
     */
    private final ClosestPointFitStatus status;

    /**
     * Estimated parameters and calibration errors.
     */
    private final CalibrationParameters parameters;

    /**
     * Number of completed iterations.
     */
    private final int iterations;

    /**
     * Number of still samples used for fitting.
     */
    private final int stillSamples;

    /**
     * Constructor.
     *
     * @param status       outcome of the fit.
     * @param parameters   estimated parameters and calibration errors.
     * @param iterations   number of completed iterations.
     * @param stillSamples number of still samples used for fitting.
     */
    public ClosestPointFitResult(final ClosestPointFitStatus status, final CalibrationParameters parameters,
                                 final int iterations, final int stillSamples) {
        this.status = status;
        this.parameters = parameters;
        this.iterations = iterations;
        this.stillSamples = stillSamples;
    }

    /**
     * Indicates whether the fit was accepted.
     *
     * @return true if accepted, false otherwise.
     */
    public boolean isAccepted() {
        return status == ClosestPointFitStatus.ACCEPTED;
    }

    /**
     * Gets outcome of the fit.
     *
     * @return outcome of the fit.
     */
    public ClosestPointFitStatus getStatus() {
        return status;
    }

    /**
     * Gets estimated parameters and calibration errors.
     *
     * @return estimated parameters.
     */
    public CalibrationParameters getParameters() {
        return parameters;
    }

    /**
     * Gets estimated offsets expressed in g.
     *
     * @return estimated offsets.
     */
    public double[] getOffset() {
        return parameters.getOffset();
    }

    /**
     * Gets estimated scale factors.
     *
     * @return estimated scale factors.
     */
    public double[] getScale() {
        return parameters.getScale();
    }

    /**
     * Gets calibration error before calibration expressed in g.
     *
     * @return calibration error before calibration.
     */
    public double getErrorStart() {
        return parameters.getErrorStart();
    }

    /**
     * Gets calibration error after calibration expressed in g.
     *
     * @return calibration error after calibration.
     */
    public double getErrorEnd() {
        return parameters.getErrorEnd();
    }

    /**
     * Gets number of completed iterations.
     *
     * @return number of completed iterations.
     */
    public int getIterations() {
        return iterations;
    }

    /**
     * Gets number of still samples used for fitting.
     *
     * @return number of still samples.
     */
    public int getStillSamples() {
        return stillSamples;
    }

    @Override
    public String toString() {
        return "ClosestPointFitResult{status=" + status + ", parameters=" + parameters + ", iterations="
                + iterations + ", stillSamples=" + stillSamples + "}";
    }
}
