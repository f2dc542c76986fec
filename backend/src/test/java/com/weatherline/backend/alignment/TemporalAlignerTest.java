package com.weatherline.backend.alignment;

import com.weatherline.backend.model.ProductionEvent;
import com.weatherline.backend.model.WeatherContext;
import com.weatherline.backend.model.WeatherObservation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.weatherline.backend.TestData.T0;
import static com.weatherline.backend.TestData.event;
import static com.weatherline.backend.TestData.observation;
import static org.junit.jupiter.api.Assertions.*;

class TemporalAlignerTest {

    private TemporalAligner aligner;
    private InMemoryLiveWeatherCache liveCache;
    private ListHistoricalStore historicalStore;

    @BeforeEach
    void setUp() {
        aligner = new TemporalAligner(30.0);
        liveCache = new InMemoryLiveWeatherCache();
        historicalStore = new ListHistoricalStore();
    }

    @Test
    void shouldUseLiveObservationWithinTolerance() {
        WeatherObservation live = observation("seguin", T0.minus(Duration.ofMinutes(10)));
        liveCache.update(live);

        Optional<WeatherContext> context = aligner.align(event("e1", "seguin", T0), liveCache, historicalStore);

        assertTrue(context.isPresent());
        assertSame(live, context.get().getObservation());
        assertEquals(10.0, context.get().getDataAgeMinutes(), 1e-9);
    }

    @Test
    void shouldAcceptObservationExactlyAtTolerance() {
        liveCache.update(observation("seguin", T0.minus(Duration.ofMinutes(30))));

        Optional<WeatherContext> context = aligner.align(event("e1", "seguin", T0), liveCache, historicalStore);

        assertTrue(context.isPresent());
        assertEquals(30.0, context.get().getDataAgeMinutes(), 1e-9);
    }

    @Test
    void shouldReturnEmptyForObservationOlderThanTolerance() {
        // 31 minutes old with a 30 minute tolerance
        WeatherObservation stale = observation("seguin", T0.minus(Duration.ofMinutes(31)));
        liveCache.update(stale);
        historicalStore.add(stale);

        Optional<WeatherContext> context = aligner.align(event("e1", "seguin", T0), liveCache, historicalStore);

        assertTrue(context.isEmpty());
    }

    @Test
    void shouldFallBackToClosestHistoricalObservation() {
        liveCache.update(observation("seguin", T0.minus(Duration.ofHours(2))));
        historicalStore.add(observation("seguin", T0.minus(Duration.ofMinutes(20))));
        historicalStore.add(observation("seguin", T0.plus(Duration.ofMinutes(5))));
        historicalStore.add(observation("seguin", T0.plus(Duration.ofMinutes(25))));

        Optional<WeatherContext> context = aligner.align(event("e1", "seguin", T0), liveCache, historicalStore);

        assertTrue(context.isPresent());
        assertEquals(T0.plus(Duration.ofMinutes(5)), context.get().getObservation().getTimestamp());
        assertEquals(5.0, context.get().getDataAgeMinutes(), 1e-9);
    }

    @Test
    void shouldPreferEarlierObservationOnTie() {
        historicalStore.add(observation("seguin", T0.plus(Duration.ofMinutes(10))));
        historicalStore.add(observation("seguin", T0.minus(Duration.ofMinutes(10))));

        Optional<WeatherContext> context = aligner.align(event("e1", "seguin", T0), liveCache, historicalStore);

        assertTrue(context.isPresent());
        assertEquals(T0.minus(Duration.ofMinutes(10)), context.get().getObservation().getTimestamp());
    }

    @Test
    void shouldIgnoreObservationsFromOtherLocations() {
        historicalStore.add(observation("conroe", T0));

        assertTrue(aligner.align(event("e1", "seguin", T0), liveCache, historicalStore).isEmpty());
    }

    @Test
    void shouldReturnIdenticalResultForIdenticalInputs() {
        historicalStore.add(observation("seguin", T0.minus(Duration.ofMinutes(3))));
        ProductionEvent event = event("e1", "seguin", T0);

        Optional<WeatherContext> first = aligner.align(event, liveCache, historicalStore);
        Optional<WeatherContext> second = aligner.align(event, liveCache, historicalStore);

        assertEquals(first, second);
    }

    @Test
    void shouldRejectNegativeTolerance() {
        assertThrows(IllegalArgumentException.class, () -> new TemporalAligner(-1.0));
    }

    private static class ListHistoricalStore implements HistoricalWeatherStore {

        private final List<WeatherObservation> observations = new ArrayList<>();

        void add(WeatherObservation observation) {
            observations.add(observation);
        }

        @Override
        public List<WeatherObservation> findInRange(String locationId, Instant from, Instant to) {
            return observations.stream()
                    .filter(o -> o.getLocationId().equals(locationId))
                    .filter(o -> !o.getTimestamp().isBefore(from) && !o.getTimestamp().isAfter(to))
                    .toList();
        }
    }
}
