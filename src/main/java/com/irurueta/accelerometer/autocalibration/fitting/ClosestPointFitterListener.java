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

/**
 * Listener to handle events raised by {@link ClosestPointFitter}.
 */
public interface ClosestPointFitterListener {

    /**
     * Called when fitting starts.
     *
     * @param fitter fitter raising this event.
     */
    void onFitStart(final ClosestPointFitter fitter);

    /**
     * Called after each iteration of the closest point fit.
     *
     * @param fitter    fitter raising this event.
     * @param iteration number of completed iterations (starting at 1).
     * @param residual  residual of the iteration.
     */
    void onIterationCompleted(final ClosestPointFitter fitter, final int iteration, final double residual);

    /**
     * Called when fitting ends, whether it has been accepted or not.
     *
     * @param fitter fitter raising this event.
     * @param result result of the fit.
     */
    void onFitEnd(final ClosestPointFitter fitter, final ClosestPointFitResult result);
}
