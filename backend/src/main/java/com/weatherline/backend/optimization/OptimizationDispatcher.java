package com.weatherline.backend.optimization;

import com.weatherline.backend.alignment.HistoricalWeatherStore;
import com.weatherline.backend.config.RedisMessageConfig;
import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.correlation.FactorImpactAssessment;
import com.weatherline.backend.model.AlertLevel;
import com.weatherline.backend.model.CorrelationFinding;
import com.weatherline.backend.model.OptimizationPriority;
import com.weatherline.backend.model.OptimizationRecord;
import com.weatherline.backend.model.ProductionEvent;
import com.weatherline.backend.model.RiskLevel;
import com.weatherline.backend.model.WeatherContext;
import com.weatherline.backend.model.WeatherFactor;
import com.weatherline.backend.model.WeatherObservation;
import com.weatherline.backend.pubsub.ChannelMessage;
import com.weatherline.backend.pubsub.ChannelPublisher;
import com.weatherline.backend.recommendation.Recommendation;
import com.weatherline.backend.recommendation.RecommendationRequest;
import com.weatherline.backend.recommendation.WeatherProductionRecommender;
import com.weatherline.backend.repository.OptimizationRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a weather-affected production event into a parameter optimization for its machine.
 * <p>
 * The recommender decides the parameters; an optimization is only emitted when they differ
 * from the baseline and the recommendation is confident enough. Publishing and persisting the
 * record are both best-effort.
 */
@Component
public class OptimizationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OptimizationDispatcher.class);

    public static final String PARAM_DRYER_TEMP = "dryerTemp";
    public static final String PARAM_PRE_MIX_TIME = "preMixTime";
    public static final String PARAM_HOLD_RELEASE = "holdRelease";

    private final WeatherProductionRecommender recommender;
    private final HistoricalWeatherStore historicalWeatherStore;
    private final OptimizationRecordRepository optimizationRecordRepository;
    private final ChannelPublisher channelPublisher;
    private final WeatherlineProperties.Optimization settings;
    private final Clock clock;

    public OptimizationDispatcher(WeatherProductionRecommender recommender,
            HistoricalWeatherStore historicalWeatherStore,
            OptimizationRecordRepository optimizationRecordRepository,
            ChannelPublisher channelPublisher,
            WeatherlineProperties properties,
            Clock clock) {
        this.recommender = recommender;
        this.historicalWeatherStore = historicalWeatherStore;
        this.optimizationRecordRepository = optimizationRecordRepository;
        this.channelPublisher = channelPublisher;
        this.settings = properties.getOptimization();
        this.clock = clock;
    }

    public Optional<OptimizationRecord> dispatch(ProductionEvent event, WeatherContext context,
            FactorImpactAssessment assessment) {
        WeatherObservation weather = context.getObservation();
        Recommendation recommendation = recommender.recommend(toRequest(event, weather));

        Map<String, Double> current = currentParameters(event);
        Map<String, Double> optimized = new LinkedHashMap<>();
        optimized.put(PARAM_DRYER_TEMP, recommendation.getRecommendedDryerTemp());
        optimized.put(PARAM_PRE_MIX_TIME, current.get(PARAM_PRE_MIX_TIME) + recommendation.getPreMixTimeDelta());
        optimized.put(PARAM_HOLD_RELEASE, recommendation.isHold() ? 1.0 : 0.0);

        if (optimized.equals(current)) {
            log.debug("[OPTIMIZATION] Event: {} | No parameter change", event.getEventId());
            return Optional.empty();
        }
        if (recommendation.getConfidenceScore() < settings.getConfidenceThreshold()) {
            log.debug("[OPTIMIZATION] Event: {} | Confidence {} below threshold {}", event.getEventId(),
                    recommendation.getConfidenceScore(), settings.getConfidenceThreshold());
            return Optional.empty();
        }

        RiskLevel risk = combinedRisk(assessment.risk(), recommendation.getAlertLevel());
        double dryerChange = Math.abs(optimized.get(PARAM_DRYER_TEMP) - current.get(PARAM_DRYER_TEMP));

        List<String> rationale = new ArrayList<>(recommendation.getRationale());
        rationale.addAll(assessment.recommendedActions());

        OptimizationRecord record = OptimizationRecord.builder()
                .id(optimizationId(event))
                .locationId(event.getLocationId())
                .machineId(event.getMachineId())
                .eventId(event.getEventId())
                .timestamp(clock.instant())
                .triggerSummary(triggerSummary(weather))
                .currentParameters(current)
                .optimizedParameters(optimized)
                .expectedImprovement(expectedImprovement(assessment, dryerChange))
                .confidenceScore(recommendation.getConfidenceScore())
                .priority(priority(risk, recommendation.getConfidenceScore()))
                .alertLevel(recommendation.getAlertLevel())
                .holdReleaseFlag(recommendation.getHoldReleaseFlag())
                .rationale(rationale)
                .build();

        log.info("[OPTIMIZATION] Location: {} | Machine: {} | Priority: {} | Confidence: {}",
                record.getLocationId(), record.getMachineId(), record.getPriority(),
                String.format(Locale.ROOT, "%.2f", record.getConfidenceScore()));

        channelPublisher.publish(RedisMessageConfig.PRODUCTION_OPTIMIZATIONS_CHANNEL,
                ChannelMessage.PRODUCTION_OPTIMIZATION, record.getLocationId(), record);
        try {
            optimizationRecordRepository.save(record);
        } catch (RuntimeException e) {
            log.error("[OPTIMIZATION] Failed to store optimization: {}", record.getId(), e);
        }
        return Optional.of(record);
    }

    RecommendationRequest toRequest(ProductionEvent event, WeatherObservation weather) {
        Double efficiency = event.efficiency();
        return RecommendationRequest.builder()
                .siteId(event.getLocationId())
                .rainfallLast24h(rainfallLast24h(event, weather))
                .rainProbabilityNext6h(weather.getPrecipitationProbability() != null
                        ? weather.getPrecipitationProbability() : 0.0)
                .moistureLevel(event.detailParameter(ProductionEvent.PARAM_MOISTURE))
                .temperatureAmbient(weather.getTemperature())
                .humidityRelative(weather.getHumidity())
                .lineSpeed(event.detailParameter(ProductionEvent.PARAM_RUN_RATE))
                .productType(event.getPartId())
                .machineClass(event.getMachineClass())
                .currentEfficiency(efficiency != null ? efficiency : 1.0)
                .sensorDataQuality(weather.getQualityScore())
                .build();
    }

    /**
     * Rain that fell at the location over the lookback window ending at the event, or the
     * aligned reading's own precipitation when the store has nothing.
     * <p>
     * Each reading reports the rain of the hour before it, so readings closer together than an
     * hour overlap. A reading only counts for the share of its hour not already covered by the
     * previous reading (or by the start of the window).
     */
    double rainfallLast24h(ProductionEvent event, WeatherObservation weather) {
        Instant to = event.getTimestamp();
        Instant from = to.minus(settings.getRainfallLookback());
        try {
            List<WeatherObservation> readings = historicalWeatherStore.findInRange(event.getLocationId(), from, to);
            if (!readings.isEmpty()) {
                return accumulatedRainfall(readings, from);
            }
        } catch (RuntimeException e) {
            log.error("[OPTIMIZATION] Rainfall lookup failed for location: {}", event.getLocationId(), e);
        }
        return weather.getPrecipitation();
    }

    static double accumulatedRainfall(List<WeatherObservation> readings, Instant from) {
        List<WeatherObservation> ordered = new ArrayList<>(readings);
        ordered.sort(Comparator.comparing(WeatherObservation::getTimestamp));

        double total = 0.0;
        Instant coveredUntil = from;
        for (WeatherObservation reading : ordered) {
            Instant end = reading.getTimestamp();
            if (!end.isAfter(coveredUntil)) {
                continue;
            }
            Duration uncovered = Duration.between(coveredUntil, end);
            if (uncovered.compareTo(WeatherObservation.PRECIPITATION_PERIOD) > 0) {
                uncovered = WeatherObservation.PRECIPITATION_PERIOD;
            }
            total += reading.getPrecipitation() * uncovered.toMillis()
                    / WeatherObservation.PRECIPITATION_PERIOD.toMillis();
            coveredUntil = end;
        }
        return total;
    }

    private Map<String, Double> currentParameters(ProductionEvent event) {
        Double preMix = event.detailParameter(ProductionEvent.PARAM_PRE_MIX_TIME);
        Map<String, Double> current = new LinkedHashMap<>();
        current.put(PARAM_DRYER_TEMP, settings.getBaselineDryerTemp());
        current.put(PARAM_PRE_MIX_TIME, preMix != null ? preMix : settings.getBaselinePreMixTime());
        current.put(PARAM_HOLD_RELEASE, 0.0);
        return current;
    }

    Map<String, Double> expectedImprovement(FactorImpactAssessment assessment, double dryerChange) {
        Map<String, Double> improvement = new LinkedHashMap<>();
        if (assessment.impactOn(WeatherFactor.HUMIDITY).isPresent()) {
            double scale = findingScale(assessment, WeatherFactor.HUMIDITY);
            improvement.put("quality_consistency", 0.20 * scale);
            improvement.put("defect_reduction", 0.15 * scale);
        }
        if (dryerChange > 0) {
            double scale = findingScale(assessment, WeatherFactor.TEMPERATURE);
            improvement.put("energy_savings", dryerChange * 0.02 * scale);
            improvement.put("efficiency_improvement", dryerChange * 0.015 * scale);
        }
        if (assessment.impactOn(WeatherFactor.PRESSURE).isPresent()) {
            improvement.put("material_handling", 0.12 * findingScale(assessment, WeatherFactor.PRESSURE));
        }
        return improvement;
    }

    private static double findingScale(FactorImpactAssessment assessment, WeatherFactor factor) {
        return assessment.strongestFinding(factor)
                .map(CorrelationFinding::getCoefficient)
                .map(Math::abs)
                .orElse(1.0);
    }

    static RiskLevel combinedRisk(RiskLevel impactRisk, AlertLevel alertLevel) {
        RiskLevel fromAlert = alertLevel.isAtLeast(AlertLevel.HIGH) ? RiskLevel.HIGH
                : alertLevel == AlertLevel.MEDIUM ? RiskLevel.MEDIUM
                : RiskLevel.LOW;
        return impactRisk.max(fromAlert);
    }

    static OptimizationPriority priority(RiskLevel risk, double confidence) {
        if (risk == RiskLevel.HIGH && confidence > 0.8) {
            return OptimizationPriority.IMMEDIATE;
        }
        if (risk == RiskLevel.HIGH || confidence > 0.85) {
            return OptimizationPriority.HIGH;
        }
        if (confidence > 0.75) {
            return OptimizationPriority.MEDIUM;
        }
        return OptimizationPriority.LOW;
    }

    static String optimizationId(ProductionEvent event) {
        return "opt_" + event.getLocationId() + "_" + event.getMachineId() + "_"
                + event.getTimestamp().getEpochSecond() + "_" + event.getEventId();
    }

    static String triggerSummary(WeatherObservation weather) {
        return String.format(Locale.ROOT, "T:%.1fF H:%.1f%% P:%.2finHg",
                weather.getTemperature(), weather.getHumidity(), weather.getPressure());
    }
}
