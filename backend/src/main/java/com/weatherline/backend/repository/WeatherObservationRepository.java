package com.weatherline.backend.repository;

import com.weatherline.backend.model.WeatherObservation;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface WeatherObservationRepository extends MongoRepository<WeatherObservation, String> {

    /**
     * Readings for a location with both range ends inclusive.
     */
    @Query(value = "{ 'locationId': ?0, 'timestamp': { '$gte': ?1, '$lte': ?2 } }", sort = "{ 'timestamp': 1 }")
    List<WeatherObservation> findInRange(String locationId, Instant from, Instant to);
}
