package com.weatherline.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Weather condition at a location that is expected to affect production.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "weather_alerts")
public class WeatherAlert {

    @Id
    private String id;

    @Indexed
    private String locationId;

    private WeatherAlertType alertType;
    private AlertLevel severity;
    private String message;

    @Builder.Default
    private List<String> recommendedActions = new ArrayList<>();

    private String productionImpact;

    private Instant issuedAt;
    private Instant validUntil;
}
