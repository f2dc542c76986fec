package com.weatherline.backend.alignment;

import com.weatherline.backend.model.WeatherObservation;
import com.weatherline.backend.repository.WeatherObservationRepository;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

@Component
public class MongoHistoricalWeatherStore implements HistoricalWeatherStore {

    private final WeatherObservationRepository weatherObservationRepository;

    public MongoHistoricalWeatherStore(WeatherObservationRepository weatherObservationRepository) {
        this.weatherObservationRepository = weatherObservationRepository;
    }

    @Override
    public List<WeatherObservation> findInRange(String locationId, Instant from, Instant to) {
        return weatherObservationRepository.findInRange(locationId, from, to);
    }
}
