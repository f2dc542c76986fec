package com.weatherline.backend.correlation;

import com.weatherline.backend.model.CorrelationFinding;
import com.weatherline.backend.model.RiskLevel;
import com.weatherline.backend.model.WeatherFactor;

import java.util.List;
import java.util.Optional;

/**
 * Result of checking one production event against the weather it was aligned to.
 *
 * @param supportingFindings significant rolling findings for the impacted factors
 */
public record FactorImpactAssessment(
        RiskLevel risk,
        boolean requiresOptimization,
        List<FactorImpact> impacts,
        List<String> recommendedActions,
        List<CorrelationFinding> supportingFindings) {

    public FactorImpactAssessment {
        impacts = List.copyOf(impacts);
        recommendedActions = List.copyOf(recommendedActions);
        supportingFindings = List.copyOf(supportingFindings);
    }

    public static FactorImpactAssessment none() {
        return new FactorImpactAssessment(RiskLevel.LOW, false, List.of(), List.of(), List.of());
    }

    public Optional<FactorImpact> impactOn(WeatherFactor factor) {
        return impacts.stream().filter(i -> i.factor() == factor).findFirst();
    }

    /**
     * Strongest significant rolling correlation for {@code factor}, if any.
     */
    public Optional<CorrelationFinding> strongestFinding(WeatherFactor factor) {
        return supportingFindings.stream()
                .filter(f -> f.getWeatherFactor() == factor)
                .max((a, b) -> Double.compare(Math.abs(a.getCoefficient()), Math.abs(b.getCoefficient())));
    }
}
