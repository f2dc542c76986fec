package com.weatherline.backend.alignment;

import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.model.ProductionEvent;
import com.weatherline.backend.model.WeatherContext;
import com.weatherline.backend.model.WeatherObservation;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Matches a production event with the nearest weather observation for its location.
 * <p>
 * The live cache is consulted first. When it has nothing within tolerance the historical
 * store is searched for the reading closest in time; equidistant readings resolve to the
 * earlier one. No match within tolerance means no context, not an error.
 * Stateless and safe to call concurrently.
 */
@Component
public class TemporalAligner {

    private static final double SECONDS_PER_MINUTE = 60.0;

    private final double maxAgeMinutes;

    @Autowired
    public TemporalAligner(WeatherlineProperties properties) {
        this(properties.getAlignment().getMaxAgeMinutes());
    }

    public TemporalAligner(double maxAgeMinutes) {
        if (maxAgeMinutes < 0) {
            throw new IllegalArgumentException("maxAgeMinutes must be >= 0");
        }
        this.maxAgeMinutes = maxAgeMinutes;
    }

    public double getMaxAgeMinutes() {
        return maxAgeMinutes;
    }

    public Optional<WeatherContext> align(ProductionEvent event, LiveWeatherCache liveCache,
            HistoricalWeatherStore historicalStore) {
        if (event == null || event.getLocationId() == null || event.getTimestamp() == null) {
            return Optional.empty();
        }

        Instant eventTime = event.getTimestamp();

        Optional<WeatherContext> live = liveCache.latest(event.getLocationId())
                .filter(observation -> event.getLocationId().equals(observation.getLocationId()))
                .map(observation -> toContext(observation, eventTime))
                .filter(this::withinTolerance);
        if (live.isPresent()) {
            return live;
        }

        return closestHistorical(event.getLocationId(), eventTime, historicalStore);
    }

    /**
     * Historical-only lookup, used for batch alignment where no live cache applies.
     */
    public Optional<WeatherContext> closestHistorical(String locationId, Instant eventTime,
            HistoricalWeatherStore historicalStore) {
        Duration tolerance = Duration.ofMillis(Math.round(maxAgeMinutes * SECONDS_PER_MINUTE * 1000));
        List<WeatherObservation> candidates = historicalStore.findInRange(
                locationId, eventTime.minus(tolerance), eventTime.plus(tolerance));
        return closest(candidates, locationId, eventTime);
    }

    /**
     * Picks the closest observation from an in-memory candidate list.
     */
    public Optional<WeatherContext> closest(List<WeatherObservation> candidates, String locationId,
            Instant eventTime) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        return candidates.stream()
                .filter(observation -> observation.getTimestamp() != null)
                .filter(observation -> locationId.equals(observation.getLocationId()))
                .min(Comparator
                        .comparingLong((WeatherObservation observation) -> distanceMillis(observation, eventTime))
                        .thenComparing(WeatherObservation::getTimestamp))
                .map(observation -> toContext(observation, eventTime))
                .filter(this::withinTolerance);
    }

    private boolean withinTolerance(WeatherContext context) {
        return context.getDataAgeMinutes() <= maxAgeMinutes;
    }

    private static long distanceMillis(WeatherObservation observation, Instant eventTime) {
        return Math.abs(Duration.between(observation.getTimestamp(), eventTime).toMillis());
    }

    private static WeatherContext toContext(WeatherObservation observation, Instant eventTime) {
        double ageMinutes = distanceMillis(observation, eventTime) / 1000.0 / SECONDS_PER_MINUTE;
        return WeatherContext.builder()
                .observation(observation)
                .dataAgeMinutes(ageMinutes)
                .build();
    }
}
