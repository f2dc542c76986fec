package com.weatherline.backend.controller;

import com.weatherline.backend.model.OptimizationRecord;
import com.weatherline.backend.service.OptimizationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/locations/{locationId}/optimizations")
@Tag(name = "Optimizations", description = "Machine parameter optimizations emitted by the stream processor")
public class OptimizationController {

    private final OptimizationService optimizationService;

    public OptimizationController(OptimizationService optimizationService) {
        this.optimizationService = optimizationService;
    }

    @GetMapping
    @Operation(summary = "List optimizations", description = "Stored optimizations for a location, newest first")
    public ResponseEntity<List<OptimizationRecord>> getOptimizations(
            @Parameter(description = "Location ID") @PathVariable String locationId) {

        return ResponseEntity.ok(optimizationService.getOptimizations(locationId));
    }
}
