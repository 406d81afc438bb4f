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
 * Outcome of a closest point fit.
 */
public enum ClosestPointFitStatus {
    /**
     * Calibration error was reduced below the acceptance threshold.
     */
    ACCEPTED,

    /**
     * Still samples do not reach both sides of every axis. No iteration was
     * attempted.
     */
    SPHERE_UNDERPOPULATED,

    /**
     * Iteration finished (converged or reached the maximum number of
     * iterations) but calibration error was not improved or is still too
     * large.
     */
    ERROR_NOT_IMPROVED
}
