package com.weatherline.backend.service;

import com.weatherline.backend.model.OptimizationRecord;
import com.weatherline.backend.repository.OptimizationRecordRepository;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class OptimizationService {

    private final OptimizationRecordRepository optimizationRecordRepository;

    public OptimizationService(OptimizationRecordRepository optimizationRecordRepository) {
        this.optimizationRecordRepository = optimizationRecordRepository;
    }

    /**
     * Stored optimizations for a location, newest first.
     */
    public List<OptimizationRecord> getOptimizations(String locationId) {
        return optimizationRecordRepository.findByLocationIdOrderByTimestampDesc(locationId);
    }
}
