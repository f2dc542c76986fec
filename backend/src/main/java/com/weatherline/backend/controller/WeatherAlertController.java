package com.weatherline.backend.controller;

import com.weatherline.backend.model.WeatherAlert;
import com.weatherline.backend.service.WeatherAlertService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/locations/{locationId}/weather-alerts")
@Tag(name = "Weather Alerts", description = "Weather conditions expected to affect production")
public class WeatherAlertController {

    private final WeatherAlertService weatherAlertService;

    public WeatherAlertController(WeatherAlertService weatherAlertService) {
        this.weatherAlertService = weatherAlertService;
    }

    @GetMapping
    @Operation(summary = "List weather alerts", description = "Alerts for a location, newest first")
    public ResponseEntity<List<WeatherAlert>> getAlerts(
            @Parameter(description = "Location ID") @PathVariable String locationId,
            @Parameter(description = "Only alerts still within their validity window")
            @RequestParam(defaultValue = "false") boolean activeOnly) {

        return ResponseEntity.ok(weatherAlertService.getAlerts(locationId, activeOnly));
    }
}
