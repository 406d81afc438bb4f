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
import com.irurueta.accelerometer.autocalibration.fitting.ClosestPointFitStatus;
import com.irurueta.accelerometer.autocalibration.intervals.EpochWindowStatisticsProvider;
import com.irurueta.accelerometer.autocalibration.intervals.SlidingWindowStatisticsProvider;
import com.irurueta.units.Acceleration;
import com.irurueta.units.AccelerationUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class AccelerometerAutocalibratorTest implements AccelerometerAutocalibratorListener {

    private static final long SEED = 8721L;

    private static final double[] SCALE = {1.02, 0.98, 1.01};

    private static final double[] OFFSET = {0.01, -0.02, 0.0};

    private static final double[] UNIT_SCALE = {1.0, 1.0, 1.0};

    private static final double[] ZERO = new double[3];

    private static final double SCALE_RELATIVE_ERROR = 0.01;

    private static final double OFFSET_ERROR = 0.005;

    private static final double ABSOLUTE_ERROR = 1e-9;

    private int start;
    private int windowFitted;
    private int insufficientData;
    private int calibrationInvalid;
    private int finish;

    @BeforeEach
    void setUp() {
        reset();
    }

    @Test
    void testConstants() {
        assertEquals(0.3, AccelerometerAutocalibrator.DEFAULT_SPHERE_CRITERION, 0.0);
        assertEquals(72, AccelerometerAutocalibrator.DEFAULT_MIN_HOURS);
        assertEquals(0.013, AccelerometerAutocalibrator.DEFAULT_SD_CRITERION, 0.0);
        assertEquals(1000, AccelerometerAutocalibrator.DEFAULT_MAX_ITERATIONS);
        assertEquals(1e-10, AccelerometerAutocalibrator.DEFAULT_TOLERANCE, 0.0);
        assertEquals(12, AccelerometerAutocalibrator.EXPANSION_BLOCK_HOURS);
    }

    @Test
    void testConstructor1() {
        final var calibrator = new AccelerometerAutocalibrator();

        assertEquals(AccelerometerAutocalibrator.DEFAULT_SPHERE_CRITERION, calibrator.getSphereCriterion(), 0.0);
        assertEquals(AccelerometerAutocalibrator.DEFAULT_MIN_HOURS, calibrator.getMinHours());
        assertEquals(AccelerometerAutocalibrator.DEFAULT_SD_CRITERION, calibrator.getSdCriterion(), 0.0);
        assertEquals(AccelerometerAutocalibrator.DEFAULT_MAX_ITERATIONS, calibrator.getMaxIterations());
        assertEquals(AccelerometerAutocalibrator.DEFAULT_TOLERANCE, calibrator.getTolerance(), 0.0);
        assertEquals(10.0, calibrator.getStatisticsWindowSeconds(), 0.0);
        assertInstanceOf(EpochWindowStatisticsProvider.class, calibrator.getWindowStatisticsProvider());
        assertNull(calibrator.getListener());
        assertTrue(calibrator.isReady());
        assertFalse(calibrator.isRunning());
        assertEquals(AccelerationUnit.G, calibrator.getSphereCriterionAsAcceleration().getUnit());
        assertEquals(0.013, calibrator.getSdCriterionAsAcceleration().getValue().doubleValue(), 0.0);
    }

    @Test
    void testConstructor2() {
        final var calibrator = new AccelerometerAutocalibrator(this);

        assertSame(this, calibrator.getListener());
        assertEquals(AccelerometerAutocalibrator.DEFAULT_MIN_HOURS, calibrator.getMinHours());
    }

    @Test
    void testConstructor3() {
        final var calibrator = new AccelerometerAutocalibrator(0.25, 48, 0.02, 200, 1e-8);

        assertEquals(0.25, calibrator.getSphereCriterion(), 0.0);
        assertEquals(48, calibrator.getMinHours());
        assertEquals(0.02, calibrator.getSdCriterion(), 0.0);
        assertEquals(200, calibrator.getMaxIterations());
        assertEquals(1e-8, calibrator.getTolerance(), 0.0);
        assertNull(calibrator.getListener());

        // Force IllegalArgumentException
        assertThrows(IllegalArgumentException.class,
                () -> new AccelerometerAutocalibrator(-0.25, 48, 0.02, 200, 1e-8));
        assertThrows(IllegalArgumentException.class,
                () -> new AccelerometerAutocalibrator(0.25, 0, 0.02, 200, 1e-8));
        assertThrows(IllegalArgumentException.class,
                () -> new AccelerometerAutocalibrator(0.25, 48, 0.0, 200, 1e-8));
        assertThrows(IllegalArgumentException.class,
                () -> new AccelerometerAutocalibrator(0.25, 48, 0.02, 0, 1e-8));
        assertThrows(IllegalArgumentException.class,
                () -> new AccelerometerAutocalibrator(0.25, 48, 0.02, 200, -1e-8));
    }

    @Test
    void testConstructor4() {
        final var calibrator = new AccelerometerAutocalibrator(0.25, 48, 0.02, 200, 1e-8, this);

        assertEquals(48, calibrator.getMinHours());
        assertSame(this, calibrator.getListener());
    }

    @Test
    void testSetters() throws LockedException {
        final var calibrator = new AccelerometerAutocalibrator();

        calibrator.setSphereCriterion(0.4);
        assertEquals(0.4, calibrator.getSphereCriterion(), 0.0);
        calibrator.setSphereCriterion(new Acceleration(0.35, AccelerationUnit.G));
        assertEquals(0.35, calibrator.getSphereCriterion(), ABSOLUTE_ERROR);

        calibrator.setMinHours(24);
        assertEquals(24, calibrator.getMinHours());

        calibrator.setSdCriterion(0.02);
        assertEquals(0.02, calibrator.getSdCriterion(), 0.0);
        calibrator.setSdCriterion(new Acceleration(0.015, AccelerationUnit.G));
        assertEquals(0.015, calibrator.getSdCriterion(), ABSOLUTE_ERROR);
        calibrator.setSdCriterion(new Acceleration(0.02 * 9.80665, AccelerationUnit.METERS_PER_SQUARED_SECOND));
        assertEquals(0.02, calibrator.getSdCriterion(), ABSOLUTE_ERROR);

        calibrator.setMaxIterations(10);
        assertEquals(10, calibrator.getMaxIterations());

        calibrator.setTolerance(1e-6);
        assertEquals(1e-6, calibrator.getTolerance(), 0.0);

        calibrator.setStatisticsWindowSeconds(60.0);
        assertEquals(60.0, calibrator.getStatisticsWindowSeconds(), 0.0);

        final var provider = new SlidingWindowStatisticsProvider();
        calibrator.setWindowStatisticsProvider(provider);
        assertSame(provider, calibrator.getWindowStatisticsProvider());

        calibrator.setListener(this);
        assertSame(this, calibrator.getListener());

        // Force IllegalArgumentException
        assertThrows(IllegalArgumentException.class, () -> calibrator.setMinHours(0));
        assertThrows(IllegalArgumentException.class, () -> calibrator.setSdCriterion(-1.0));
        assertThrows(IllegalArgumentException.class, () -> calibrator.setSphereCriterion(-1.0));
        assertThrows(IllegalArgumentException.class, () -> calibrator.setMaxIterations(0));
        assertThrows(IllegalArgumentException.class, () -> calibrator.setTolerance(-1.0));
        assertThrows(IllegalArgumentException.class, () -> calibrator.setStatisticsWindowSeconds(0.0));
    }

    @Test
    void testSamplesForHours() {
        assertEquals(12960000L, AccelerometerAutocalibrator.samplesForHours(72, 50.0));
        assertEquals(21600L, AccelerometerAutocalibrator.samplesForHours(12, 0.5));
        // truncated
        assertEquals(0L, AccelerometerAutocalibrator.samplesForHours(1, 1e-4));
        assertEquals(3L, AccelerometerAutocalibrator.samplesForHours(1, 1e-3));
    }

    @Test
    void testCalibrateInsufficientData() throws LockedException, NotReadyException {
        final var lux = new AuxiliarySensorTable(new double[]{0.0, 60.0}, new double[]{100.0, 120.0});
        final var auxiliaryTables = new EnumMap<AuxiliarySensorType, AuxiliarySensorTable>(
                AuxiliarySensorType.class);
        auxiliaryTables.put(AuxiliarySensorType.LUX, lux);
        final var generated = new SyntheticRecordingGenerator(SEED).generate(10.0, 1.0, SCALE, OFFSET);
        final var recording = new AccelerometerRecording(generated.getAcceleration(), generated.getTimestamps(),
                generated.getSamplingRate(), auxiliaryTables);

        final var calibrator = new AccelerometerAutocalibrator(this);
        final var result = calibrator.calibrate(recording);

        assertEquals(AutocalibrationStatus.INSUFFICIENT_DATA, result.getStatus());
        assertFalse(result.isCalibrated());
        assertSame(recording.getAcceleration(), result.getCalibratedAcceleration());
        assertArrayEquals(ZERO, result.getScale(), 0.0);
        assertArrayEquals(ZERO, result.getOffset(), 0.0);
        assertEquals(0.0, result.getCalibrationErrorStart(), 0.0);
        assertEquals(0.0, result.getCalibrationErrorEnd(), 0.0);
        assertEquals(0, result.getWindowsFitted());
        assertEquals(0.0, result.getHoursUsed(), 0.0);
        assertNull(result.getLastFit());
        assertEquals("Less than 72 hours of data (10.0 hours). No Calibration performed", result.getMessage());
        assertEquals(1.0, result.getSamplingRate(), 0.0);
        assertSame(recording.getTimestamps(), result.getTimestamps());
        assertSame(lux, result.getAuxiliaryTable(AuxiliarySensorType.LUX));
        assertEquals(1, result.getAuxiliaryTables().size());

        assertEquals(1, start);
        assertEquals(0, windowFitted);
        assertEquals(1, insufficientData);
        assertEquals(0, calibrationInvalid);
        assertEquals(1, finish);
        assertFalse(calibrator.isRunning());
    }

    @Test
    void testCalibrateInvalidAtMinimumDuration() throws LockedException, NotReadyException {
        // exactly the minimum number of hours and no still periods at all
        final var recording = new SyntheticRecordingGenerator(SEED).stillFrom(1000.0).generate(72.0, 1.0,
                UNIT_SCALE, ZERO);
        final var listener = mock(AccelerometerAutocalibratorListener.class);

        final var calibrator = new AccelerometerAutocalibrator(listener);
        final var result = calibrator.calibrate(recording);

        assertEquals(AutocalibrationStatus.INVALID, result.getStatus());
        assertFalse(result.isCalibrated());
        assertSame(recording.getAcceleration(), result.getCalibratedAcceleration());
        assertEquals(CalibrationParameters.createUncalibrated(), result.getParameters());
        assertEquals(1, result.getWindowsFitted());
        assertEquals(72.0, result.getHoursUsed(), ABSOLUTE_ERROR);
        assertEquals("Calibration not done with 60 - 72 hours due to insufficient non-movement data available",
                result.getMessage());
        assertEquals(ClosestPointFitStatus.SPHERE_UNDERPOPULATED, result.getLastFit().getStatus());
        assertEquals(0, result.getLastFit().getStillSamples());

        verify(listener).onStart(calibrator);
        verify(listener).onWindowFitted(eq(calibrator), eq(0), eq(72), any(ClosestPointFitResult.class));
        verify(listener).onCalibrationInvalid(calibrator, result.getMessage());
        verify(listener, never()).onInsufficientData(any(), anyDouble());
        verify(listener).onFinish(calibrator, result);
    }

    @Test
    void testCalibrateInvalidAfterExpansion() throws LockedException, NotReadyException {
        final var recording = new SyntheticRecordingGenerator(SEED).stillFrom(1000.0).generate(20.0, 1.0,
                UNIT_SCALE, ZERO);
        final var listener = mock(AccelerometerAutocalibratorListener.class);

        final var calibrator = new AccelerometerAutocalibrator(listener);
        calibrator.setMinHours(2);
        final var result = calibrator.calibrate(recording);

        // windows of 2, 14 and 26 hours, the last one clamped to the 20 available hours
        assertEquals(AutocalibrationStatus.INVALID, result.getStatus());
        assertEquals(3, result.getWindowsFitted());
        assertEquals(20.0, result.getHoursUsed(), ABSOLUTE_ERROR);
        assertEquals("Calibration not done with 14 - 26 hours due to insufficient non-movement data available",
                result.getMessage());
        assertArrayEquals(ZERO, result.getScale(), 0.0);
        assertSame(recording.getAcceleration(), result.getCalibratedAcceleration());

        verify(listener, times(3)).onWindowFitted(eq(calibrator), anyInt(), anyInt(),
                any(ClosestPointFitResult.class));
        verify(listener).onWindowFitted(eq(calibrator), eq(0), eq(2), any(ClosestPointFitResult.class));
        verify(listener).onWindowFitted(eq(calibrator), eq(1), eq(14), any(ClosestPointFitResult.class));
        verify(listener).onWindowFitted(eq(calibrator), eq(2), eq(26), any(ClosestPointFitResult.class));
        verify(listener).onCalibrationInvalid(eq(calibrator), anyString());
    }

    @Test
    void testCalibrateExpandsWindow() throws LockedException, NotReadyException {
        // still periods only appear after the first 72 hours
        final var recording = new SyntheticRecordingGenerator(SEED).stillFrom(72.0).generate(96.0, 1.0,
                SCALE, OFFSET);
        final var listener = mock(AccelerometerAutocalibratorListener.class);

        final var calibrator = new AccelerometerAutocalibrator(listener);
        final var result = calibrator.calibrate(recording);

        assertEquals(AutocalibrationStatus.CALIBRATED, result.getStatus());
        assertTrue(result.isCalibrated());
        assertNull(result.getMessage());
        assertEquals(2, result.getWindowsFitted());
        assertEquals(84.0, result.getHoursUsed(), ABSOLUTE_ERROR);
        assertEquals(12 * 20 * 12, result.getLastFit().getStillSamples());
        assertRecovered(result);

        verify(listener).onWindowFitted(eq(calibrator), eq(0), eq(72),
                argThat(fit -> fit.getStatus() == ClosestPointFitStatus.SPHERE_UNDERPOPULATED));
        verify(listener).onWindowFitted(eq(calibrator), eq(1), eq(84),
                argThat(ClosestPointFitResult::isAccepted));
        verify(listener, never()).onCalibrationInvalid(any(), anyString());
        verify(listener).onFinish(calibrator, result);
    }

    /**
     * Calibrates 100 hours of distorted data with default settings.
     * Data is generated at 2 Hz instead of a typical 50 Hz device rate to keep
     * memory usage low. Still periods produce the same number of 10 second
     * epochs at any rate.
     */
    @Test
    void testCalibrateEndToEnd() throws LockedException, NotReadyException {
        final var battery = new AuxiliarySensorTable(new double[]{0.0, 3600.0}, new double[]{4.1, 4.0});
        final var auxiliaryTables = new EnumMap<AuxiliarySensorType, AuxiliarySensorTable>(
                AuxiliarySensorType.class);
        auxiliaryTables.put(AuxiliarySensorType.BATTERY, battery);
        final var generated = new SyntheticRecordingGenerator(SEED).generate(100.0, 2.0, SCALE, OFFSET);
        final var recording = new AccelerometerRecording(generated.getAcceleration(), generated.getTimestamps(),
                generated.getSamplingRate(), auxiliaryTables);
        final var raw = recording.getAcceleration().copy();

        final var calibrator = new AccelerometerAutocalibrator(this);
        final var result = calibrator.calibrate(recording);

        assertEquals(AutocalibrationStatus.CALIBRATED, result.getStatus());
        assertEquals(1, result.getWindowsFitted());
        assertEquals(72.0, result.getHoursUsed(), ABSOLUTE_ERROR);
        assertTrue(result.getCalibrationErrorEnd() < 0.01);
        assertTrue(result.getCalibrationErrorEnd() < result.getCalibrationErrorStart());
        assertRecovered(result);

        // whole recording is calibrated exactly once, and input is left untouched
        final var calibrated = result.getCalibratedAcceleration();
        assertEquals(recording.getRows(), calibrated.getRows());
        assertEquals(AffineCalibration.apply(raw, result.getParameters()), calibrated);
        assertEquals(raw, recording.getAcceleration());

        assertEquals(2.0, result.getSamplingRate(), 0.0);
        assertSame(recording.getTimestamps(), result.getTimestamps());
        assertSame(battery, result.getAuxiliaryTable(AuxiliarySensorType.BATTERY));
        assertNull(result.getAuxiliaryTable(AuxiliarySensorType.LUX));

        assertEquals(1, start);
        assertEquals(1, windowFitted);
        assertEquals(0, insufficientData);
        assertEquals(0, calibrationInvalid);
        assertEquals(1, finish);
    }

    @Test
    void testCalibrateWithSlidingWindows() throws LockedException, NotReadyException {
        final var recording = new SyntheticRecordingGenerator(SEED).generate(24.0, 1.0, SCALE, OFFSET);

        final var calibrator = new AccelerometerAutocalibrator();
        calibrator.setMinHours(24);
        calibrator.setWindowStatisticsProvider(new SlidingWindowStatisticsProvider());
        final var result = calibrator.calibrate(recording.getAcceleration(), recording.getTimestamps(),
                recording.getSamplingRate());

        assertEquals(AutocalibrationStatus.CALIBRATED, result.getStatus());
        assertTrue(result.getCalibrationErrorEnd() < 0.01);
        assertRecovered(result);
    }

    @Test
    void testCalibrateNotReady() throws LockedException {
        final var calibrator = new AccelerometerAutocalibrator(this);
        calibrator.setWindowStatisticsProvider(null);

        assertFalse(calibrator.isReady());
        assertThrows(NotReadyException.class, () -> calibrator.calibrate(new AccelerationTable(1), new double[1],
                1.0));
        assertEquals(0, start);
    }

    @Test
    void testCalibrateMalformedInput() {
        final var calibrator = new AccelerometerAutocalibrator();
        final var acceleration = new AccelerationTable(3);

        assertThrows(IllegalArgumentException.class, () -> calibrator.calibrate(null));
        assertThrows(IllegalArgumentException.class,
                () -> calibrator.calibrate(acceleration, new double[]{0.0, 1.0}, 1.0));
        assertThrows(IllegalArgumentException.class,
                () -> calibrator.calibrate(acceleration, new double[]{0.0, 1.0, 2.0}, 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> calibrator.calibrate(acceleration, new double[]{0.0, 1.0, 2.0}, -1.0));
        assertFalse(calibrator.isRunning());
    }

    @Test
    void testCalibrateSamplingRateTooLowForExpansion() {
        final var calibrator = new AccelerometerAutocalibrator(this);
        final var acceleration = new AccelerationTable(3);
        final var timestamps = new double[]{0.0, 100000.0, 200000.0};

        // 12 hours at these rates hold less than one sample
        assertThrows(IllegalArgumentException.class, () -> calibrator.calibrate(acceleration, timestamps, 1e-5));
        assertThrows(IllegalArgumentException.class, () -> calibrator.calibrate(acceleration, timestamps, 2e-5));
        assertEquals(0, start);
        assertFalse(calibrator.isRunning());

        // one sample per 12 hours is enough, data is just insufficient
        assertDoesNotThrow(() -> {
            final var result = calibrator.calibrate(acceleration, timestamps, 2.4e-5);
            assertEquals(AutocalibrationStatus.INSUFFICIENT_DATA, result.getStatus());
        });
    }

    @Override
    public void onStart(final AccelerometerAutocalibrator calibrator) {
        checkLocked(calibrator);
        start++;
    }

    @Override
    public void onWindowFitted(final AccelerometerAutocalibrator calibrator, final int windowIndex,
                               final int windowHours, final ClosestPointFitResult result) {
        checkLocked(calibrator);
        assertEquals(windowFitted, windowIndex);
        assertEquals(calibrator.getMinHours() + windowIndex * AccelerometerAutocalibrator.EXPANSION_BLOCK_HOURS,
                windowHours);
        windowFitted++;
    }

    @Override
    public void onInsufficientData(final AccelerometerAutocalibrator calibrator, final double availableHours) {
        checkLocked(calibrator);
        assertTrue(availableHours < calibrator.getMinHours());
        insufficientData++;
    }

    @Override
    public void onCalibrationInvalid(final AccelerometerAutocalibrator calibrator, final String message) {
        checkLocked(calibrator);
        assertNotNull(message);
        calibrationInvalid++;
    }

    @Override
    public void onFinish(final AccelerometerAutocalibrator calibrator, final AutocalibrationResult result) {
        checkLocked(calibrator);
        assertNotNull(result);
        finish++;
    }

    private void reset() {
        start = 0;
        windowFitted = 0;
        insufficientData = 0;
        calibrationInvalid = 0;
        finish = 0;
    }

    private static void checkLocked(final AccelerometerAutocalibrator calibrator) {
        assertTrue(calibrator.isRunning());
        assertThrows(LockedException.class, () -> calibrator.setSphereCriterion(0.3));
        assertThrows(LockedException.class, () -> calibrator.setSphereCriterion(
                new Acceleration(0.3, AccelerationUnit.G)));
        assertThrows(LockedException.class, () -> calibrator.setMinHours(72));
        assertThrows(LockedException.class, () -> calibrator.setSdCriterion(0.013));
        assertThrows(LockedException.class, () -> calibrator.setSdCriterion(
                new Acceleration(0.013, AccelerationUnit.G)));
        assertThrows(LockedException.class, () -> calibrator.setMaxIterations(10));
        assertThrows(LockedException.class, () -> calibrator.setTolerance(1e-6));
        assertThrows(LockedException.class, () -> calibrator.setStatisticsWindowSeconds(5.0));
        assertThrows(LockedException.class, () -> calibrator.setWindowStatisticsProvider(null));
        assertThrows(LockedException.class, () -> calibrator.setListener(null));
        assertThrows(LockedException.class, () -> calibrator.calibrate(new AccelerationTable(1), new double[1],
                1.0));
    }

    private static void assertRecovered(final AutocalibrationResult result) {
        final var scale = result.getScale();
        final var offset = result.getOffset();
        for (var axis = 0; axis < AccelerationTable.AXES; axis++) {
            assertEquals(SCALE[axis], scale[axis], SCALE[axis] * SCALE_RELATIVE_ERROR);
            assertEquals(OFFSET[axis], offset[axis], OFFSET_ERROR);
        }
    }
}
