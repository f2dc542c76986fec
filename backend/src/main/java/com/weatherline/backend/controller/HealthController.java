package com.weatherline.backend.controller;

import com.weatherline.backend.correlation.CorrelationStateStore;
import com.weatherline.backend.service.ProcessingMetrics;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/health")
@Tag(name = "Health", description = "Service liveness and processing counters")
public class HealthController {

    private final ProcessingMetrics processingMetrics;
    private final CorrelationStateStore correlationStateStore;

    public HealthController(ProcessingMetrics processingMetrics, CorrelationStateStore correlationStateStore) {
        this.processingMetrics = processingMetrics;
        this.correlationStateStore = correlationStateStore;
    }

    @GetMapping
    @Operation(summary = "Health check")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("trackedLocations", correlationStateStore.locations().size());
        body.put("eventsProcessed", processingMetrics.getEventsProcessed());
        body.put("optimizationsGenerated", processingMetrics.getOptimizationsGenerated());
        body.put("alertsRaised", processingMetrics.getAlertsRaised());
        return ResponseEntity.ok(body);
    }
}
