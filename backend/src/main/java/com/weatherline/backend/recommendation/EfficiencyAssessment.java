package com.weatherline.backend.recommendation;

public record EfficiencyAssessment(double efficiencyLoss, boolean critical, boolean adjustmentNeeded) {
}
