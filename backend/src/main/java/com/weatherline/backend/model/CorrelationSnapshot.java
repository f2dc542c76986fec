package com.weatherline.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Last fully computed finding set for a location. One document per location, replaced wholesale.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "correlation_snapshots")
public class CorrelationSnapshot {

    // Location id
    @Id
    private String locationId;

    private Instant computedAt;

    private int windowSize;

    @Builder.Default
    private List<CorrelationFinding> findings = new ArrayList<>();
}
