package com.weatherline.backend.correlation;

import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.model.CorrelationSnapshot;
import com.weatherline.backend.model.ProductionMetric;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.weatherline.backend.TestData.T0;
import static com.weatherline.backend.correlation.CorrelationEngineTest.pair;
import static org.junit.jupiter.api.Assertions.*;

class LocationCorrelationStateTest {

    private final Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
    private final CorrelationEngine engine = new CorrelationEngine(new WeatherlineProperties());

    private LocationCorrelationState state;

    @BeforeEach
    void setUp() {
        state = new LocationCorrelationState("seguin", Duration.ofHours(1), 20, clock);
    }

    @Test
    void shouldEvictPairsOlderThanWindow() {
        state.append(pair(0, 75, 50, 30, Map.of(ProductionMetric.CYCLE_TIME, 40.0)));
        state.append(pair(30, 75, 50, 30, Map.of(ProductionMetric.CYCLE_TIME, 40.0)));

        // 61 minutes after the first pair pushes it out of the one hour window
        state.append(pair(61, 75, 50, 30, Map.of(ProductionMetric.CYCLE_TIME, 40.0)));

        assertEquals(2, state.size());
        assertEquals(T0.plus(Duration.ofMinutes(30)), state.pairs().get(0).eventTimestamp());
    }

    @Test
    void shouldEvictOldestPairsBeyondLimit() {
        for (int i = 0; i < 25; i++) {
            state.append(pair(i, 75, 50, 30, Map.of(ProductionMetric.CYCLE_TIME, 40.0)));
        }

        List<AlignedPair> pairs = state.pairs();
        assertEquals(20, pairs.size());
        assertEquals(T0.plus(Duration.ofMinutes(5)), pairs.get(0).eventTimestamp());
    }

    @Test
    void shouldPublishSnapshotOnRecompute() {
        assertTrue(state.snapshot().isEmpty());
        for (int i = 0; i < 12; i++) {
            state.append(pair(i, 70.0 + i, 50, 30, Map.of(ProductionMetric.CYCLE_TIME, 30.0 + i)));
        }

        CorrelationSnapshot snapshot = state.recompute(engine);

        assertSame(snapshot, state.snapshot().orElseThrow());
        assertEquals("seguin", snapshot.getLocationId());
        assertEquals(T0, snapshot.getComputedAt());
        assertEquals(12, snapshot.getWindowSize());
        assertEquals(1, snapshot.getFindings().size());
    }

    @Test
    void shouldDropStaleFindingsWhenLocationGoesQuiet() {
        // Given a window filled at T0 and a recompute five hours later
        LocationCorrelationState quiet = new LocationCorrelationState("seguin", Duration.ofHours(1), 20,
                Clock.fixed(T0.plus(Duration.ofHours(5)), ZoneOffset.UTC));
        for (int i = 0; i < 20; i++) {
            quiet.append(pair(i, 70.0 + i, 50, 30, Map.of(ProductionMetric.CYCLE_TIME, 30.0 + i)));
        }
        assertEquals(20, quiet.size());

        // When
        CorrelationSnapshot snapshot = quiet.recompute(engine);

        // Then
        assertEquals(0, quiet.size());
        assertEquals(0, snapshot.getWindowSize());
        assertTrue(snapshot.getFindings().isEmpty());
        assertEquals(T0.plus(Duration.ofHours(5)), snapshot.getComputedAt());
    }

    @Test
    void shouldKeepPairsInsideWallClockHourOnRecompute() {
        LocationCorrelationState recent = new LocationCorrelationState("seguin", Duration.ofHours(1), 20,
                Clock.fixed(T0.plus(Duration.ofMinutes(70)), ZoneOffset.UTC));
        for (int i = 0; i < 20; i++) {
            recent.append(pair(i, 70.0 + i, 50, 30, Map.of(ProductionMetric.CYCLE_TIME, 30.0 + i)));
        }

        CorrelationSnapshot snapshot = recent.recompute(engine);

        // Pairs at minutes 0..9 are older than one hour at minute 70
        assertEquals(10, snapshot.getWindowSize());
        assertEquals(T0.plus(Duration.ofMinutes(10)), recent.pairs().get(0).eventTimestamp());
        assertEquals(1, snapshot.getFindings().size());
    }

    @Test
    void shouldRestoreOnlyBeforeFirstComputation() {
        CorrelationSnapshot persisted = CorrelationSnapshot.builder().locationId("seguin").windowSize(99).build();
        state.restore(persisted);
        assertSame(persisted, state.snapshot().orElseThrow());

        CorrelationSnapshot computed = state.recompute(engine);
        state.restore(persisted);

        assertSame(computed, state.snapshot().orElseThrow());
    }
}
