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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameter optimization emitted for a machine after a weather-affected production event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "production_optimizations")
public class OptimizationRecord {

    @Id
    private String id;

    @Indexed
    private String locationId;

    private String machineId;
    private String eventId;
    private Instant timestamp;

    private String triggerSummary;

    @Builder.Default
    private Map<String, Double> currentParameters = new HashMap<>();

    @Builder.Default
    private Map<String, Double> optimizedParameters = new HashMap<>();

    /**
     * Metric name to expected fractional improvement.
     */
    @Builder.Default
    private Map<String, Double> expectedImprovement = new HashMap<>();

    private double confidenceScore;

    private OptimizationPriority priority;

    private AlertLevel alertLevel;
    private HoldReleaseFlag holdReleaseFlag;

    @Builder.Default
    private List<String> rationale = new ArrayList<>();
}
