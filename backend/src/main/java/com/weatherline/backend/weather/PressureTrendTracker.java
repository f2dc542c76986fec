package com.weatherline.backend.weather;

import com.weatherline.backend.model.WeatherObservation;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Latest two pressure readings per location.
 * <p>
 * Only readings newer than the tracked latest one move the trend; late or replayed
 * readings are ignored.
 */
@Component
public class PressureTrendTracker {

    private final ConcurrentMap<String, Readings> readings = new ConcurrentHashMap<>();

    /**
     * Records a reading and returns the change against the previous latest reading.
     *
     * @return empty when this is the first reading for the location or the reading is not newer
     */
    public OptionalDouble record(WeatherObservation observation) {
        boolean[] accepted = new boolean[1];
        Readings after = readings.compute(observation.getLocationId(), (id, current) -> {
            if (current != null && !observation.getTimestamp().isAfter(current.latestAt())) {
                return current;
            }
            accepted[0] = true;
            Double previous = current != null ? current.latest() : null;
            return new Readings(previous, observation.getTimestamp(), observation.getPressure());
        });
        if (!accepted[0] || after.previous() == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(after.latest() - after.previous());
    }

    /**
     * Latest minus previous pressure for a location.
     */
    public OptionalDouble trend(String locationId) {
        Readings current = readings.get(locationId);
        if (current == null || current.previous() == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(current.latest() - current.previous());
    }

    private record Readings(Double previous, Instant latestAt, double latest) {
    }
}
