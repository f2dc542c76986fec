package com.weatherline.backend.controller;

import com.weatherline.backend.correlation.CorrelationReport;
import com.weatherline.backend.model.CorrelationSnapshot;
import com.weatherline.backend.service.CorrelationAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/locations/{locationId}")
@Tag(name = "Correlations", description = "Weather-production correlation analysis")
public class CorrelationController {

    private final CorrelationAnalysisService correlationAnalysisService;

    public CorrelationController(CorrelationAnalysisService correlationAnalysisService) {
        this.correlationAnalysisService = correlationAnalysisService;
    }

    @GetMapping("/correlations")
    @Operation(summary = "Rolling correlations",
            description = "Findings last computed from the location's rolling window")
    public ResponseEntity<CorrelationSnapshot> getCorrelations(
            @Parameter(description = "Location ID") @PathVariable String locationId) {

        return ResponseEntity.ok(correlationAnalysisService.getSnapshot(locationId));
    }

    @GetMapping("/correlation-report")
    @Operation(summary = "Correlation report",
            description = "Correlation matrix, band statistics, optimal ranges, weather fronts and fitted "
                    + "predictors for stored data in a time range")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Report generated"),
            @ApiResponse(responseCode = "400", description = "Range end before range start")
    })
    public ResponseEntity<CorrelationReport> getReport(
            @Parameter(description = "Location ID") @PathVariable String locationId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        if (to.isBefore(from)) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(correlationAnalysisService.report(locationId, from, to));
    }
}
