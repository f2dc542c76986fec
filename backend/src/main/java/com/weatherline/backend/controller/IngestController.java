package com.weatherline.backend.controller;

import com.weatherline.backend.dto.IngestResponse;
import com.weatherline.backend.dto.ProductionEventRequest;
import com.weatherline.backend.dto.WeatherObservationRequest;
import com.weatherline.backend.model.ProductionEvent;
import com.weatherline.backend.model.WeatherAlert;
import com.weatherline.backend.model.WeatherObservation;
import com.weatherline.backend.service.StreamProcessingService;
import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/internal")
@Tag(name = "Ingest", description = "Production event and weather reading ingest")
@Hidden
public class IngestController {

    private static final Logger log = LoggerFactory.getLogger(IngestController.class);

    private final StreamProcessingService streamProcessingService;

    public IngestController(StreamProcessingService streamProcessingService) {
        this.streamProcessingService = streamProcessingService;
    }

    @PostMapping("/production-events")
    @Operation(summary = "Ingest production event", description = "Queue a production event for processing")
    public ResponseEntity<IngestResponse> ingestProductionEvent(@Valid @RequestBody ProductionEventRequest request) {
        ProductionEvent event = request.toEvent();
        log.debug("[INGEST] Production event: {} | Location: {}", event.getEventId(), event.getLocationId());

        streamProcessingService.submitProductionEvent(event);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(IngestResponse.builder()
                .id(event.getEventId())
                .accepted(true)
                .build());
    }

    @PostMapping("/weather-observations")
    @Operation(summary = "Ingest weather reading", description = "Update live weather, store the reading and raise alerts")
    public ResponseEntity<IngestResponse> ingestWeatherObservation(
            @Valid @RequestBody WeatherObservationRequest request) {
        WeatherObservation observation = request.toObservation();
        log.debug("[INGEST] Weather reading | Location: {} | Time: {}",
                observation.getLocationId(), observation.getTimestamp());

        List<WeatherAlert> alerts = streamProcessingService.processWeatherObservation(observation, true);
        return ResponseEntity.ok(IngestResponse.builder()
                .id(observation.getId())
                .accepted(true)
                .alertsRaised(alerts.size())
                .build());
    }
}
