package com.weatherline.backend.optimization;

import com.weatherline.backend.alignment.HistoricalWeatherStore;
import com.weatherline.backend.config.RedisMessageConfig;
import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.correlation.FactorImpact;
import com.weatherline.backend.correlation.FactorImpactAssessment;
import com.weatherline.backend.model.AlertLevel;
import com.weatherline.backend.model.CorrelationFinding;
import com.weatherline.backend.model.HoldReleaseFlag;
import com.weatherline.backend.model.OptimizationPriority;
import com.weatherline.backend.model.OptimizationRecord;
import com.weatherline.backend.model.ProductionEvent;
import com.weatherline.backend.model.ProductionMetric;
import com.weatherline.backend.model.RiskLevel;
import com.weatherline.backend.model.Significance;
import com.weatherline.backend.model.WeatherContext;
import com.weatherline.backend.model.WeatherFactor;
import com.weatherline.backend.model.WeatherObservation;
import com.weatherline.backend.pubsub.ChannelMessage;
import com.weatherline.backend.pubsub.ChannelPublisher;
import com.weatherline.backend.recommendation.ConfidenceScorer;
import com.weatherline.backend.recommendation.EfficiencyRule;
import com.weatherline.backend.recommendation.MoistureRule;
import com.weatherline.backend.recommendation.PrecipitationRule;
import com.weatherline.backend.recommendation.RecommendationValidator;
import com.weatherline.backend.recommendation.SafetyRule;
import com.weatherline.backend.recommendation.TemperatureRule;
import com.weatherline.backend.recommendation.WeatherProductionRecommender;
import com.weatherline.backend.repository.OptimizationRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.weatherline.backend.TestData.T0;
import static com.weatherline.backend.TestData.event;
import static com.weatherline.backend.TestData.observation;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OptimizationDispatcherTest {

    private final WeatherlineProperties properties = new WeatherlineProperties();
    private final Clock clock = Clock.fixed(T0.plus(Duration.ofSeconds(3)), ZoneOffset.UTC);

    private HistoricalWeatherStore historicalStore;
    private OptimizationRecordRepository repository;
    private ChannelPublisher publisher;
    private OptimizationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        historicalStore = mock(HistoricalWeatherStore.class);
        repository = mock(OptimizationRecordRepository.class);
        publisher = mock(ChannelPublisher.class);
        WeatherProductionRecommender recommender = new WeatherProductionRecommender(
                new MoistureRule(properties),
                new PrecipitationRule(properties),
                new TemperatureRule(properties),
                new EfficiencyRule(properties),
                new SafetyRule(properties),
                new RecommendationValidator(properties),
                new ConfidenceScorer(properties),
                properties,
                clock);
        dispatcher = new OptimizationDispatcher(recommender, historicalStore, repository, publisher, properties, clock);
    }

    @Test
    void shouldDispatchHoldAfterHeavyRainfall() {
        // Given 2.0in of rain stored over the last day
        WeatherObservation morning = rainy(T0.minus(Duration.ofHours(6)), 1.5);
        WeatherObservation noon = rainy(T0.minus(Duration.ofMinutes(5)), 0.5);
        when(historicalStore.findInRange(eq("seguin"), any(), any())).thenReturn(List.of(morning, noon));
        ProductionEvent event = event("evt-1", "seguin", T0);

        // When
        Optional<OptimizationRecord> dispatched = dispatcher.dispatch(event, context(noon),
                FactorImpactAssessment.none());

        // Then
        assertTrue(dispatched.isPresent());
        OptimizationRecord record = dispatched.get();
        assertEquals("opt_seguin_M-01_" + T0.getEpochSecond() + "_evt-1", record.getId());
        assertEquals(T0.plus(Duration.ofSeconds(3)), record.getTimestamp());
        assertEquals(HoldReleaseFlag.HOLD, record.getHoldReleaseFlag());
        assertEquals(AlertLevel.HIGH, record.getAlertLevel());
        assertEquals(OptimizationPriority.HIGH, record.getPriority());
        assertEquals(Map.of("dryerTemp", 150.0, "preMixTime", 60.0, "holdRelease", 0.0), record.getCurrentParameters());
        assertEquals(175.0, record.getOptimizedParameters().get("dryerTemp"), 1e-9);
        assertEquals(210.0, record.getOptimizedParameters().get("preMixTime"), 1e-9);
        assertEquals(1.0, record.getOptimizedParameters().get("holdRelease"), 1e-9);
        assertEquals(0.5, record.getExpectedImprovement().get("energy_savings"), 1e-9);
        assertEquals(0.375, record.getExpectedImprovement().get("efficiency_improvement"), 1e-9);
        assertEquals("T:75.0F H:50.0% P:30.00inHg", record.getTriggerSummary());

        verify(publisher).publish(eq(RedisMessageConfig.PRODUCTION_OPTIMIZATIONS_CHANNEL),
                eq(ChannelMessage.PRODUCTION_OPTIMIZATION), eq("seguin"), eq(record));
        verify(repository).save(record);
    }

    @Test
    void shouldNotDispatchWhenParametersUnchanged() {
        when(historicalStore.findInRange(anyString(), any(), any())).thenReturn(List.of());

        Optional<OptimizationRecord> dispatched = dispatcher.dispatch(event("evt-1", "seguin", T0),
                context(observation("seguin", T0)), FactorImpactAssessment.none());

        assertTrue(dispatched.isEmpty());
        verify(repository, never()).save(any());
        verify(publisher, never()).publish(anyString(), anyString(), anyString(), any());
    }

    @Test
    void shouldNotDispatchLowConfidenceRecommendation() {
        // Hot weather changes the parameters but poor sensor data drops confidence to 0.5
        WeatherObservation weather = observation("seguin", T0, 95.0, 50.0, 30.0);
        weather.setQualityScore(0.5);
        when(historicalStore.findInRange(anyString(), any(), any())).thenReturn(List.of(weather));

        Optional<OptimizationRecord> dispatched = dispatcher.dispatch(event("evt-1", "seguin", T0),
                context(weather), FactorImpactAssessment.none());

        assertTrue(dispatched.isEmpty());
        verify(repository, never()).save(any());
    }

    @Test
    void shouldReturnRecordEvenWhenStorageFails() {
        WeatherObservation weather = rainy(T0, 2.0);
        when(historicalStore.findInRange(anyString(), any(), any())).thenReturn(List.of(weather));
        when(repository.save(any())).thenThrow(new IllegalStateException("mongo unavailable"));

        Optional<OptimizationRecord> dispatched = dispatcher.dispatch(event("evt-1", "seguin", T0),
                context(weather), FactorImpactAssessment.none());

        assertTrue(dispatched.isPresent());
    }

    @Test
    void shouldFallBackToObservedPrecipitationWhenLookupFails() {
        when(historicalStore.findInRange(anyString(), any(), any())).thenThrow(new IllegalStateException("timeout"));
        WeatherObservation weather = rainy(T0, 0.4);

        assertEquals(0.4, dispatcher.rainfallLast24h(event("evt-1", "seguin", T0), weather), 1e-9);
    }

    @Test
    void shouldNotHoldForDrizzleReportedEveryFifteenMinutes() {
        // Given a day of 15 minute readings, each reporting 0.02in over its trailing hour
        List<WeatherObservation> readings = new ArrayList<>();
        for (int i = 95; i >= 0; i--) {
            readings.add(rainy(T0.minus(Duration.ofMinutes(15L * i)), 0.02));
        }
        when(historicalStore.findInRange(eq("seguin"), any(), any())).thenReturn(readings);
        ProductionEvent event = event("evt-1", "seguin", T0);

        // When
        double rainfall = dispatcher.rainfallLast24h(event, readings.get(readings.size() - 1));
        Optional<OptimizationRecord> dispatched = dispatcher.dispatch(event,
                context(readings.get(readings.size() - 1)), FactorImpactAssessment.none());

        // Then the day's rain is 0.48in, not four times that
        assertEquals(0.48, rainfall, 1e-9);
        assertTrue(dispatched.isEmpty());
        verify(repository, never()).save(any());
    }

    @Test
    void shouldCountEachHourOfRainOnce() {
        Instant from = T0.minus(Duration.ofHours(24));

        // Hourly readings add up directly
        assertEquals(1.2, OptimizationDispatcher.accumulatedRainfall(List.of(
                rainy(T0.minus(Duration.ofHours(2)), 0.4),
                rainy(T0, 0.4),
                rainy(T0.minus(Duration.ofHours(1)), 0.4)), from), 1e-9);

        // A reading half an hour into the window only counts for that half hour
        assertEquals(0.5, OptimizationDispatcher.accumulatedRainfall(List.of(
                rainy(from.plus(Duration.ofMinutes(30)), 1.0)), from), 1e-9);

        // Two readings with the same timestamp describe the same hour
        assertEquals(0.3, OptimizationDispatcher.accumulatedRainfall(List.of(
                rainy(T0, 0.3),
                rainy(T0, 0.3)), from), 1e-9);
    }

    @Test
    void shouldScaleExpectedImprovementByCorrelationStrength() {
        CorrelationFinding finding = CorrelationFinding.builder()
                .weatherFactor(WeatherFactor.HUMIDITY)
                .productionMetric(ProductionMetric.QUALITY_SCORE)
                .coefficient(-0.5)
                .significance(Significance.SIGNIFICANT)
                .build();
        FactorImpactAssessment assessment = new FactorImpactAssessment(RiskLevel.HIGH, true,
                List.of(new FactorImpact(WeatherFactor.HUMIDITY, 80.0, Double.NaN, RiskLevel.HIGH, 0.85),
                        new FactorImpact(WeatherFactor.PRESSURE, 29.7, -0.2, RiskLevel.MEDIUM, 0.72)),
                List.of(), List.of(finding));

        Map<String, Double> improvement = dispatcher.expectedImprovement(assessment, 0.0);

        assertEquals(0.10, improvement.get("quality_consistency"), 1e-9);
        assertEquals(0.075, improvement.get("defect_reduction"), 1e-9);
        assertEquals(0.12, improvement.get("material_handling"), 1e-9);
        assertFalse(improvement.containsKey("energy_savings"));
    }

    @Test
    void shouldRankPriorityByRiskAndConfidence() {
        assertEquals(OptimizationPriority.IMMEDIATE, OptimizationDispatcher.priority(RiskLevel.HIGH, 0.9));
        assertEquals(OptimizationPriority.HIGH, OptimizationDispatcher.priority(RiskLevel.HIGH, 0.75));
        assertEquals(OptimizationPriority.HIGH, OptimizationDispatcher.priority(RiskLevel.LOW, 0.9));
        assertEquals(OptimizationPriority.MEDIUM, OptimizationDispatcher.priority(RiskLevel.MEDIUM, 0.8));
        assertEquals(OptimizationPriority.LOW, OptimizationDispatcher.priority(RiskLevel.MEDIUM, 0.72));
        assertEquals(RiskLevel.HIGH, OptimizationDispatcher.combinedRisk(RiskLevel.LOW, AlertLevel.CRITICAL));
        assertEquals(RiskLevel.MEDIUM, OptimizationDispatcher.combinedRisk(RiskLevel.LOW, AlertLevel.MEDIUM));
        assertEquals(RiskLevel.HIGH, OptimizationDispatcher.combinedRisk(RiskLevel.HIGH, AlertLevel.LOW));
    }

    private static WeatherObservation rainy(Instant at, double precipitation) {
        WeatherObservation weather = observation("seguin", at);
        weather.setPrecipitation(precipitation);
        return weather;
    }

    private static WeatherContext context(WeatherObservation weather) {
        return WeatherContext.builder().observation(weather).dataAgeMinutes(5).build();
    }
}
