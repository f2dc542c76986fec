package com.weatherline.backend.recommendation;

/**
 * @param score 1.0 with no hazards, reduced per hazard, floored at 0
 */
public record SafetyAssessment(double score, boolean critical, boolean warning) {
}
