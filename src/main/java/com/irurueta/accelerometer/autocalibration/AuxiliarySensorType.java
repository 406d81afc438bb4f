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
 * Auxiliary sensor channels that wearable recordings carry alongside
 * acceleration. They are not used for calibration and are forwarded
 * unchanged.
 */
public enum AuxiliarySensorType {
    /**
     * Ambient light (illuminance) as recorded.
     */
    LUX,

    /**
     * Ambient light averaged on the acceleration epochs.
     */
    LUX_MEAN,

    /**
     * Battery voltage as recorded.
     */
    BATTERY,

    /**
     * Battery voltage upsampled to the acceleration time base.
     */
    BATTERY_UPSAMPLED,

    /**
     * Capacitive sensing (skin contact) as recorded.
     */
    CAPSENSE,

    /**
     * Capacitive sensing upsampled to the acceleration time base.
     */
    CAPSENSE_UPSAMPLED
}
