package com.weatherline.backend.alignment;

import com.weatherline.backend.model.WeatherObservation;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryLiveWeatherCache implements LiveWeatherCache {

    private final Map<String, WeatherObservation> latestByLocation = new ConcurrentHashMap<>();

    @Override
    public Optional<WeatherObservation> latest(String locationId) {
        if (locationId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(latestByLocation.get(locationId));
    }

    @Override
    public boolean update(WeatherObservation observation) {
        WeatherObservation stored = latestByLocation.merge(observation.getLocationId(), observation,
                (current, incoming) -> incoming.getTimestamp().isAfter(current.getTimestamp()) ? incoming : current);
        return stored == observation;
    }
}
