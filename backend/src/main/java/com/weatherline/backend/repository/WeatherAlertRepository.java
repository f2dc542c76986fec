package com.weatherline.backend.repository;

import com.weatherline.backend.model.WeatherAlert;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface WeatherAlertRepository extends MongoRepository<WeatherAlert, String> {

    List<WeatherAlert> findByLocationIdOrderByIssuedAtDesc(String locationId);

    List<WeatherAlert> findByLocationIdAndValidUntilAfterOrderByIssuedAtDesc(String locationId, Instant now);
}
