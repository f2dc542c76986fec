package com.weatherline.backend.correlation;

import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.model.CorrelationFinding;
import com.weatherline.backend.model.ProductionEvent;
import com.weatherline.backend.model.ProductionMetric;
import com.weatherline.backend.model.ProductionStatus;
import com.weatherline.backend.model.RiskLevel;
import com.weatherline.backend.model.Significance;
import com.weatherline.backend.model.WeatherContext;
import com.weatherline.backend.model.WeatherFactor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static com.weatherline.backend.TestData.T0;
import static com.weatherline.backend.TestData.event;
import static com.weatherline.backend.TestData.observation;
import static org.junit.jupiter.api.Assertions.*;

class FactorImpactAssessorTest {

    private final FactorImpactAssessor assessor = new FactorImpactAssessor(new WeatherlineProperties());

    @Test
    void shouldFlagHumidityWhenProductionDegraded() {
        // Given a quality issue during 80% humidity
        ProductionEvent event = event("e1", "seguin", T0, ProductionStatus.QUALITY_ISSUE, 45.0, Map.of());

        // When
        FactorImpactAssessment assessment = assessor.assess(event, context(75.0, 80.0, 30.0),
                OptionalDouble.empty(), List.of());

        // Then
        assertEquals(RiskLevel.HIGH, assessment.risk());
        assertTrue(assessment.requiresOptimization());
        assertEquals(RiskLevel.HIGH, assessment.impactOn(WeatherFactor.HUMIDITY).orElseThrow().impact());
        assertEquals(List.of(FactorImpactAssessor.ACTION_INCREASE_PRE_MIX), assessment.recommendedActions());
    }

    @Test
    void shouldIgnoreHumidityWhenProductionHealthy() {
        FactorImpactAssessment assessment = assessor.assess(event("e1", "seguin", T0), context(75.0, 80.0, 30.0),
                OptionalDouble.empty(), List.of());

        assertTrue(assessment.impacts().isEmpty());
        assertFalse(assessment.requiresOptimization());
        assertEquals(RiskLevel.LOW, assessment.risk());
    }

    @Test
    void shouldGradeTemperatureImpactBySeverity() {
        // 90F loses 7.5% efficiency, below the reporting floor
        assertTrue(assessor.assess(event("e1", "seguin", T0), context(90.0, 50.0, 30.0),
                OptionalDouble.empty(), List.of()).impactOn(WeatherFactor.TEMPERATURE).isEmpty());

        FactorImpactAssessment warm = assessor.assess(event("e2", "seguin", T0), context(95.0, 50.0, 30.0),
                OptionalDouble.empty(), List.of());
        assertEquals(RiskLevel.MEDIUM, warm.impactOn(WeatherFactor.TEMPERATURE).orElseThrow().impact());
        assertTrue(warm.requiresOptimization());

        FactorImpactAssessment hot = assessor.assess(event("e3", "seguin", T0), context(100.0, 50.0, 30.0),
                OptionalDouble.empty(), List.of());
        assertEquals(RiskLevel.HIGH, hot.impactOn(WeatherFactor.TEMPERATURE).orElseThrow().impact());
    }

    @Test
    void shouldComputeTemperatureEfficiencyImpact() {
        assertEquals(0.0, assessor.temperatureEfficiencyImpact(80.0));
        assertEquals(0.15, assessor.temperatureEfficiencyImpact(95.0), 1e-9);
        assertEquals(0.30, assessor.temperatureEfficiencyImpact(100.0), 1e-9);
    }

    @Test
    void shouldReportPressureTrendWithoutRequiringOptimization() {
        FactorImpactAssessment assessment = assessor.assess(event("e1", "seguin", T0), context(75.0, 50.0, 29.7),
                OptionalDouble.of(-0.2), List.of());

        FactorImpact pressure = assessment.impactOn(WeatherFactor.PRESSURE).orElseThrow();
        assertEquals(-0.2, pressure.trend(), 1e-12);
        assertEquals(RiskLevel.MEDIUM, pressure.impact());
        assertFalse(assessment.requiresOptimization());
        assertEquals(RiskLevel.LOW, assessment.risk());
    }

    @Test
    void shouldKeepOnlySignificantFindingsForImpactedFactors() {
        CorrelationFinding strong = finding(WeatherFactor.HUMIDITY, 0.8, Significance.SIGNIFICANT);
        CorrelationFinding weak = finding(WeatherFactor.HUMIDITY, 0.5, Significance.SIGNIFICANT);
        CorrelationFinding insignificant = finding(WeatherFactor.HUMIDITY, 0.9, Significance.NOT_SIGNIFICANT);
        CorrelationFinding unrelated = finding(WeatherFactor.WIND_SPEED, 0.7, Significance.SIGNIFICANT);
        ProductionEvent event = event("e1", "seguin", T0, ProductionStatus.LOSS, 45.0, Map.of());

        FactorImpactAssessment assessment = assessor.assess(event, context(75.0, 80.0, 30.0),
                OptionalDouble.empty(), List.of(strong, weak, insignificant, unrelated));

        assertEquals(List.of(strong, weak), assessment.supportingFindings());
        assertSame(strong, assessment.strongestFinding(WeatherFactor.HUMIDITY).orElseThrow());
    }

    private static WeatherContext context(double temperature, double humidity, double pressure) {
        return WeatherContext.builder()
                .observation(observation("seguin", T0, temperature, humidity, pressure))
                .dataAgeMinutes(0)
                .build();
    }

    private static CorrelationFinding finding(WeatherFactor factor, double r, Significance significance) {
        return CorrelationFinding.builder()
                .weatherFactor(factor)
                .productionMetric(ProductionMetric.QUALITY_SCORE)
                .coefficient(r)
                .significance(significance)
                .sampleSize(20)
                .build();
    }
}
