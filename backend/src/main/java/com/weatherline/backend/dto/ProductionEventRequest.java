package com.weatherline.backend.dto;

import com.weatherline.backend.model.ProductionEvent;
import com.weatherline.backend.model.ProductionStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Production cycle event pushed by a machine data collector.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Production cycle event")
public class ProductionEventRequest {

    @NotBlank
    @Schema(description = "Unique event id; redelivered events are ignored", example = "evt-000123")
    private String eventId;

    @NotNull
    @Schema(description = "Cycle completion time")
    private Instant timestamp;

    @NotBlank
    @Schema(description = "Production site", example = "seguin")
    private String locationId;

    @NotBlank
    @Schema(description = "Machine id", example = "M-07")
    private String machineId;

    private String machineClass;
    private long cycleIndex;
    private long globalCycle;
    private String partId;
    private String jobId;
    private String operatorId;

    @Schema(description = "Cycle outcome", example = "Gain")
    private ProductionStatus status;

    @PositiveOrZero
    @Schema(description = "Cycle time in seconds", example = "42.5")
    private double cycleTime;

    @Schema(description = "Named numeric parameters such as time, runRate, targetRate, qualityScore, moisture")
    @Builder.Default
    private Map<String, Double> detailParameters = new HashMap<>();

    @Builder.Default
    private List<String> stopReasons = new ArrayList<>();

    private String eventSource;

    public ProductionEvent toEvent() {
        return ProductionEvent.builder()
                .eventId(eventId)
                .timestamp(timestamp)
                .locationId(locationId)
                .machineId(machineId)
                .machineClass(machineClass)
                .cycleIndex(cycleIndex)
                .globalCycle(globalCycle)
                .partId(partId)
                .jobId(jobId)
                .operatorId(operatorId)
                .status(status != null ? status : ProductionStatus.OTHER)
                .cycleTime(cycleTime)
                .detailParameters(detailParameters != null ? new HashMap<>(detailParameters) : new HashMap<>())
                .stopReasons(stopReasons != null ? new ArrayList<>(stopReasons) : new ArrayList<>())
                .eventSource(eventSource)
                .build();
    }
}
