package com.weatherline.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Production event stored together with the weather context it was aligned to.
 * The context is null when no observation fell inside the tolerance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "enriched_production_events")
public class EnrichedProductionEvent {

    @Id
    private String id;

    @Indexed
    private String locationId;

    private ProductionEvent event;

    private WeatherContext weatherContext;

    @CreatedDate
    private Instant createdAt;
}
