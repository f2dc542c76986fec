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
 * Production cycle event as reported by the production system.
 * The event id doubles as the document id so redelivered events overwrite rather than duplicate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "production_events")
public class ProductionEvent {

    public static final String PARAM_EFFICIENCY = "efficiency";
    public static final String PARAM_RUN_RATE = "runRate";
    public static final String PARAM_TARGET_RATE = "targetRate";
    public static final String PARAM_QUALITY_SCORE = "qualityScore";
    public static final String PARAM_ENERGY_USAGE = "energyUsage";
    public static final String PARAM_MOISTURE = "moisture";
    public static final String PARAM_PRE_MIX_TIME = "time";

    @Id
    private String eventId;

    @Indexed
    private Instant timestamp;

    @Indexed
    private String locationId;

    private String machineId;
    private String machineClass;
    private long cycleIndex;
    private long globalCycle;
    private String partId;
    private String jobId;
    private String operatorId;

    @Builder.Default
    private ProductionStatus status = ProductionStatus.OTHER;

    // Seconds
    private double cycleTime;

    /**
     * Named numeric parameters, e.g. pre-mix time, run rate, target rate.
     */
    @Builder.Default
    private Map<String, Double> detailParameters = new HashMap<>();

    @Builder.Default
    private List<String> stopReasons = new ArrayList<>();

    // APMS, Manual, API
    private String eventSource;

    public Double detailParameter(String name) {
        return detailParameters != null ? detailParameters.get(name) : null;
    }

    /**
     * Efficiency ratio from the explicit parameter, or run rate over target rate.
     */
    public Double efficiency() {
        Double explicit = detailParameter(PARAM_EFFICIENCY);
        if (explicit != null) {
            return explicit;
        }
        Double runRate = detailParameter(PARAM_RUN_RATE);
        Double targetRate = detailParameter(PARAM_TARGET_RATE);
        if (runRate != null && targetRate != null && targetRate > 0) {
            return runRate / targetRate;
        }
        return null;
    }
}
