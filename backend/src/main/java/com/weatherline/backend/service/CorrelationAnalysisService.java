package com.weatherline.backend.service;

import com.weatherline.backend.alignment.TemporalAligner;
import com.weatherline.backend.correlation.AlignedPair;
import com.weatherline.backend.correlation.BandStatistics;
import com.weatherline.backend.correlation.CorrelationEngine;
import com.weatherline.backend.correlation.CorrelationReport;
import com.weatherline.backend.correlation.CorrelationStateStore;
import com.weatherline.backend.model.CorrelationFinding;
import com.weatherline.backend.model.CorrelationSnapshot;
import com.weatherline.backend.model.ProductionEvent;
import com.weatherline.backend.model.ProductionMetric;
import com.weatherline.backend.model.WeatherFactor;
import com.weatherline.backend.model.WeatherObservation;
import com.weatherline.backend.prediction.FittedPredictor;
import com.weatherline.backend.prediction.PredictorFitter;
import com.weatherline.backend.repository.CorrelationSnapshotRepository;
import com.weatherline.backend.repository.ProductionEventRepository;
import com.weatherline.backend.repository.WeatherObservationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Rolling snapshot access, periodic recomputation and batch correlation reports.
 */
@Service
public class CorrelationAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(CorrelationAnalysisService.class);

    private static final List<ProductionMetric> PREDICTED_METRICS = List.of(
            ProductionMetric.EFFICIENCY, ProductionMetric.QUALITY_SCORE,
            ProductionMetric.CYCLE_TIME, ProductionMetric.ENERGY_USAGE);

    private final CorrelationEngine correlationEngine;
    private final CorrelationStateStore correlationStateStore;
    private final CorrelationSnapshotRepository correlationSnapshotRepository;
    private final ProductionEventRepository productionEventRepository;
    private final WeatherObservationRepository weatherObservationRepository;
    private final TemporalAligner temporalAligner;
    private final PredictorFitter predictorFitter;
    private final Clock clock;

    public CorrelationAnalysisService(CorrelationEngine correlationEngine,
            CorrelationStateStore correlationStateStore,
            CorrelationSnapshotRepository correlationSnapshotRepository,
            ProductionEventRepository productionEventRepository,
            WeatherObservationRepository weatherObservationRepository,
            TemporalAligner temporalAligner,
            PredictorFitter predictorFitter,
            Clock clock) {
        this.correlationEngine = correlationEngine;
        this.correlationStateStore = correlationStateStore;
        this.correlationSnapshotRepository = correlationSnapshotRepository;
        this.productionEventRepository = productionEventRepository;
        this.weatherObservationRepository = weatherObservationRepository;
        this.temporalAligner = temporalAligner;
        this.predictorFitter = predictorFitter;
        this.clock = clock;
    }

    /**
     * Last rolling snapshot for a location; an empty snapshot for unknown locations.
     */
    public CorrelationSnapshot getSnapshot(String locationId) {
        return correlationStateStore.snapshot(locationId)
                .orElseGet(() -> CorrelationSnapshot.builder()
                        .locationId(locationId)
                        .windowSize(0)
                        .build());
    }

    @Scheduled(fixedDelayString = "${weatherline.processing.recompute-interval:PT5M}",
            initialDelayString = "${weatherline.processing.recompute-interval:PT5M}")
    public void recomputeAll() {
        List<CorrelationSnapshot> snapshots = correlationStateStore.recomputeAll();
        for (CorrelationSnapshot snapshot : snapshots) {
            log.info("[CORRELATION] Location: {} | Window: {} | Findings: {}", snapshot.getLocationId(),
                    snapshot.getWindowSize(), snapshot.getFindings().size());
            try {
                correlationSnapshotRepository.save(snapshot);
            } catch (RuntimeException e) {
                log.error("[CORRELATION] Failed to store snapshot for location: {}", snapshot.getLocationId(), e);
            }
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void restoreSnapshots() {
        try {
            List<CorrelationSnapshot> persisted = correlationSnapshotRepository.findAll();
            persisted.forEach(correlationStateStore::restore);
            log.info("[CORRELATION] Restored {} persisted snapshots", persisted.size());
        } catch (RuntimeException e) {
            log.error("[CORRELATION] Failed to restore persisted snapshots", e);
        }
    }

    /**
     * Aligns the stored events and readings of a location within {@code [from, to]} and
     * analyzes them as one sample.
     */
    public CorrelationReport report(String locationId, Instant from, Instant to) {
        List<AlignedPair> pairs = alignStored(locationId, from, to);
        log.info("[CORRELATION] Report for location: {} | Range: {} - {} | Pairs: {}", locationId, from, to, pairs.size());

        Map<WeatherFactor, List<BandStatistics>> bands = new EnumMap<>(WeatherFactor.class);
        for (WeatherFactor factor : WeatherFactor.values()) {
            List<BandStatistics> stats = correlationEngine.bandStatistics(pairs, factor);
            if (!stats.isEmpty()) {
                bands.put(factor, stats);
            }
        }

        List<CorrelationFinding> findings = new ArrayList<>(correlationEngine.computeCorrelations(pairs).values());

        return new CorrelationReport(locationId, from, to, clock.instant(), pairs.size(),
                findings,
                bands,
                correlationEngine.optimalRanges(pairs),
                correlationEngine.detectWeatherFronts(pairs),
                fitPredictors(pairs));
    }

    List<AlignedPair> alignStored(String locationId, Instant from, Instant to) {
        Duration tolerance = Duration.ofMillis(Math.round(temporalAligner.getMaxAgeMinutes() * 60_000));
        List<ProductionEvent> events = productionEventRepository.findInRange(locationId, from, to);
        List<WeatherObservation> readings = weatherObservationRepository.findInRange(
                locationId, from.minus(tolerance), to.plus(tolerance));

        List<AlignedPair> pairs = new ArrayList<>();
        for (ProductionEvent event : events) {
            temporalAligner.closest(readings, locationId, event.getTimestamp())
                    .ifPresent(context -> pairs.add(AlignedPair.of(event, context)));
        }
        return pairs;
    }

    private List<FittedPredictor> fitPredictors(List<AlignedPair> pairs) {
        List<String> featureNames = Arrays.stream(WeatherFactor.values()).map(Enum::name).toList();
        List<FittedPredictor> predictors = new ArrayList<>();

        for (ProductionMetric metric : PREDICTED_METRICS) {
            List<double[]> rows = new ArrayList<>();
            List<Double> targets = new ArrayList<>();
            for (AlignedPair pair : pairs) {
                OptionalDouble target = pair.metric(metric);
                if (target.isEmpty()) {
                    continue;
                }
                double[] row = new double[WeatherFactor.values().length];
                for (WeatherFactor factor : WeatherFactor.values()) {
                    row[factor.ordinal()] = pair.factor(factor).orElse(0.0);
                }
                rows.add(row);
                targets.add(target.getAsDouble());
            }
            if (rows.size() < correlationEngine.getMinSamples()) {
                continue;
            }
            try {
                predictors.add(predictorFitter.fit(metric.name(), featureNames,
                        rows.toArray(new double[0][]),
                        targets.stream().mapToDouble(Double::doubleValue).toArray()));
            } catch (IllegalArgumentException e) {
                log.debug("[CORRELATION] Skipping predictor for {}: {}", metric, e.getMessage());
            }
        }
        return predictors;
    }
}
