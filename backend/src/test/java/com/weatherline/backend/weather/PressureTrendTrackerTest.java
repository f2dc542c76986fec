package com.weatherline.backend.weather;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.OptionalDouble;

import static com.weatherline.backend.TestData.T0;
import static com.weatherline.backend.TestData.observation;
import static org.junit.jupiter.api.Assertions.*;

class PressureTrendTrackerTest {

    private final PressureTrendTracker tracker = new PressureTrendTracker();

    @Test
    void shouldReportChangeAgainstPreviousReading() {
        assertTrue(tracker.record(observation("seguin", T0, 75, 50, 30.00)).isEmpty());

        OptionalDouble change = tracker.record(observation("seguin", T0.plus(Duration.ofMinutes(15)), 75, 50, 29.80));

        assertEquals(-0.2, change.getAsDouble(), 1e-9);
        assertEquals(-0.2, tracker.trend("seguin").getAsDouble(), 1e-9);
    }

    @Test
    void shouldIgnoreLateAndReplayedReadings() {
        tracker.record(observation("seguin", T0, 75, 50, 30.00));
        tracker.record(observation("seguin", T0.plus(Duration.ofMinutes(15)), 75, 50, 30.05));

        assertTrue(tracker.record(observation("seguin", T0.plus(Duration.ofMinutes(5)), 75, 50, 29.00)).isEmpty());
        assertTrue(tracker.record(observation("seguin", T0.plus(Duration.ofMinutes(15)), 75, 50, 29.00)).isEmpty());
        assertEquals(0.05, tracker.trend("seguin").getAsDouble(), 1e-9);
    }

    @Test
    void shouldTrackLocationsIndependently() {
        tracker.record(observation("seguin", T0, 75, 50, 30.00));
        tracker.record(observation("conroe", T0.plus(Duration.ofMinutes(1)), 75, 50, 29.50));

        assertTrue(tracker.trend("seguin").isEmpty());
        assertTrue(tracker.trend("conroe").isEmpty());
        assertTrue(tracker.trend("gunter").isEmpty());
    }
}
