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

import com.irurueta.statistics.UniformRandomizer;
import com.irurueta.units.AccelerationUnit;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CalibrationParametersTest {

    private static final double MIN_OFFSET = -0.05;
    private static final double MAX_OFFSET = 0.05;
    private static final double MIN_SCALE = 0.95;
    private static final double MAX_SCALE = 1.05;

    @Test
    void testConstructor() {
        final var randomizer = new UniformRandomizer(new Random());
        final var offset = new double[]{randomizer.nextDouble(MIN_OFFSET, MAX_OFFSET),
                randomizer.nextDouble(MIN_OFFSET, MAX_OFFSET), randomizer.nextDouble(MIN_OFFSET, MAX_OFFSET)};
        final var scale = new double[]{randomizer.nextDouble(MIN_SCALE, MAX_SCALE),
                randomizer.nextDouble(MIN_SCALE, MAX_SCALE), randomizer.nextDouble(MIN_SCALE, MAX_SCALE)};

        final var parameters = new CalibrationParameters(offset, scale, 0.02, 0.001);

        assertArrayEquals(offset, parameters.getOffset(), 0.0);
        assertArrayEquals(scale, parameters.getScale(), 0.0);
        assertEquals(offset[0], parameters.getOffsetX(), 0.0);
        assertEquals(offset[1], parameters.getOffsetY(), 0.0);
        assertEquals(offset[2], parameters.getOffsetZ(), 0.0);
        assertEquals(offset[2], parameters.getOffset(AccelerationTable.Z), 0.0);
        assertEquals(scale[0], parameters.getScaleX(), 0.0);
        assertEquals(scale[1], parameters.getScaleY(), 0.0);
        assertEquals(scale[2], parameters.getScaleZ(), 0.0);
        assertEquals(scale[1], parameters.getScale(AccelerationTable.Y), 0.0);
        assertEquals(0.02, parameters.getErrorStart(), 0.0);
        assertEquals(0.001, parameters.getErrorEnd(), 0.0);

        // parameters are not affected by changes on provided or returned arrays
        offset[0] = 1.0;
        parameters.getScale()[0] = 2.0;
        assertNotEquals(1.0, parameters.getOffsetX());
        assertNotEquals(2.0, parameters.getScaleX());

        // Force IllegalArgumentException
        assertThrows(IllegalArgumentException.class, () -> new CalibrationParameters(new double[2], scale, 0.0,
                0.0));
        assertThrows(IllegalArgumentException.class, () -> new CalibrationParameters(offset, null, 0.0, 0.0));
    }

    @Test
    void testFactories() {
        final var uncalibrated = CalibrationParameters.createUncalibrated();
        assertArrayEquals(new double[3], uncalibrated.getOffset(), 0.0);
        assertArrayEquals(new double[3], uncalibrated.getScale(), 0.0);
        assertEquals(0.0, uncalibrated.getErrorStart(), 0.0);
        assertEquals(0.0, uncalibrated.getErrorEnd(), 0.0);

        final var identity = CalibrationParameters.createIdentity();
        assertArrayEquals(new double[3], identity.getOffset(), 0.0);
        assertArrayEquals(new double[]{1.0, 1.0, 1.0}, identity.getScale(), 0.0);
        assertNotEquals(uncalibrated, identity);
        assertEquals(identity, CalibrationParameters.createIdentity());
        assertEquals(identity.hashCode(), CalibrationParameters.createIdentity().hashCode());
    }

    @Test
    void testMeasurements() {
        final var parameters = new CalibrationParameters(new double[]{0.01, -0.02, 0.03},
                new double[]{1.02, 0.98, 1.01}, 0.015, 0.0007);

        final var offsetX = parameters.getOffsetXAsAcceleration();
        assertEquals(0.01, offsetX.getValue().doubleValue(), 0.0);
        assertEquals(AccelerationUnit.G, offsetX.getUnit());
        assertEquals(-0.02, parameters.getOffsetYAsAcceleration().getValue().doubleValue(), 0.0);
        assertEquals(0.03, parameters.getOffsetZAsAcceleration().getValue().doubleValue(), 0.0);
        assertEquals(0.015, parameters.getErrorStartAsAcceleration().getValue().doubleValue(), 0.0);
        assertEquals(0.0007, parameters.getErrorEndAsAcceleration().getValue().doubleValue(), 0.0);
        assertEquals(AccelerationUnit.G, parameters.getErrorEndAsAcceleration().getUnit());
    }

    @Test
    void testMatrices() {
        final var parameters = new CalibrationParameters(new double[]{0.01, -0.02, 0.03},
                new double[]{1.02, 0.98, 1.01}, 0.0, 0.0);

        final var scale = parameters.getScaleMatrix();
        assertEquals(3, scale.getRows());
        assertEquals(3, scale.getColumns());
        for (var i = 0; i < 3; i++) {
            for (var j = 0; j < 3; j++) {
                assertEquals(i == j ? parameters.getScale(i) : 0.0, scale.getElementAt(i, j), 0.0);
            }
        }

        final var offset = parameters.getOffsetMatrix();
        assertEquals(3, offset.getRows());
        assertEquals(1, offset.getColumns());
        assertEquals(0.01, offset.getElementAt(0, 0), 0.0);
        assertEquals(-0.02, offset.getElementAt(1, 0), 0.0);
        assertEquals(0.03, offset.getElementAt(2, 0), 0.0);
    }
}
