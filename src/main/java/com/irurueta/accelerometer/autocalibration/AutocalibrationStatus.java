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

/**
 * Outcome of an autocalibration run.
 */
public enum AutocalibrationStatus {
    /**
     * A fit was accepted and the whole recording has been calibrated.
     */
    CALIBRATED,

    /**
     * Recording is shorter than the minimum number of hours. Calibration was not
     * attempted.
     */
    INSUFFICIENT_DATA,

    /**
     * No window, up to the whole recording, produced an accepted fit.
     */
    INVALID
}
