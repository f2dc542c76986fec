package com.weatherline.backend.correlation;

import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.model.CorrelationFinding;
import com.weatherline.backend.model.FactorMetricPair;
import com.weatherline.backend.model.ProductionMetric;
import com.weatherline.backend.model.Significance;
import com.weatherline.backend.model.WeatherFactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;

/**
 * Statistical relationships between weather factors and production metrics.
 * <p>
 * Every method works on a complete set of aligned pairs and holds no state; rolling
 * behaviour lives in {@link LocationCorrelationState}.
 */
@Component
public class CorrelationEngine {

    private static final Logger log = LoggerFactory.getLogger(CorrelationEngine.class);

    private static final double SECONDS_PER_HOUR = 3600.0;

    private final WeatherlineProperties.Correlation settings;

    public CorrelationEngine(WeatherlineProperties properties) {
        this.settings = properties.getCorrelation();
    }

    public int getMinSamples() {
        return settings.getMinSamples();
    }

    /**
     * Pearson correlation for every factor/metric pair. Returns an empty map when fewer
     * than the minimum number of pairs is supplied; a factor/metric pair is left out when
     * it has too few samples reporting the metric or either series is constant.
     */
    public Map<FactorMetricPair, CorrelationFinding> computeCorrelations(List<AlignedPair> pairs) {
        if (pairs == null || pairs.size() < settings.getMinSamples()) {
            log.debug("[CORRELATION] Insufficient sample: {} pairs (minimum {})",
                    pairs == null ? 0 : pairs.size(), settings.getMinSamples());
            return Map.of();
        }

        Map<FactorMetricPair, CorrelationFinding> findings = new LinkedHashMap<>();
        for (WeatherFactor factor : WeatherFactor.values()) {
            for (ProductionMetric metric : ProductionMetric.values()) {
                correlate(pairs, factor, metric)
                        .ifPresent(finding -> findings.put(new FactorMetricPair(factor, metric), finding));
            }
        }
        return findings;
    }

    Optional<CorrelationFinding> correlate(List<AlignedPair> pairs, WeatherFactor factor, ProductionMetric metric) {
        List<Double> xs = new ArrayList<>();
        List<Double> ys = new ArrayList<>();
        for (AlignedPair pair : pairs) {
            OptionalDouble x = pair.factor(factor);
            OptionalDouble y = pair.metric(metric);
            if (x.isPresent() && y.isPresent() && Double.isFinite(x.getAsDouble()) && Double.isFinite(y.getAsDouble())) {
                xs.add(x.getAsDouble());
                ys.add(y.getAsDouble());
            }
        }
        int n = xs.size();
        if (n < settings.getMinSamples()) {
            return Optional.empty();
        }

        double r = Statistics.pearson(Statistics.toArray(xs), Statistics.toArray(ys));
        if (Double.isNaN(r)) {
            return Optional.empty();
        }
        double pValue = Statistics.correlationPValue(r, n);
        double[] interval = Statistics.correlationConfidenceInterval(r, n);

        return Optional.of(CorrelationFinding.builder()
                .weatherFactor(factor)
                .productionMetric(metric)
                .coefficient(r)
                .pValue(pValue)
                .significance(Significance.fromPValue(pValue))
                .sampleSize(n)
                .confidenceLow(interval[0])
                .confidenceHigh(interval[1])
                .build());
    }

    /**
     * Mean and standard deviation of every metric per named band of {@code factor}.
     * Bands without samples are omitted.
     */
    public List<BandStatistics> bandStatistics(List<AlignedPair> pairs, WeatherFactor factor) {
        Map<WeatherBand, List<AlignedPair>> byBand = new LinkedHashMap<>();
        for (WeatherBand band : FactorBands.bandsFor(factor)) {
            byBand.put(band, new ArrayList<>());
        }
        for (AlignedPair pair : pairs) {
            pair.factor(factor).ifPresent(value ->
                    FactorBands.classify(factor, value).ifPresent(band -> byBand.get(band).add(pair)));
        }

        Map<WeatherBand, Map<ProductionMetric, MetricSummary>> summaries = new LinkedHashMap<>();
        double maxCycleTime = 0;
        for (Map.Entry<WeatherBand, List<AlignedPair>> entry : byBand.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            Map<ProductionMetric, MetricSummary> metrics = summarize(entry.getValue());
            summaries.put(entry.getKey(), metrics);
            MetricSummary cycle = metrics.get(ProductionMetric.CYCLE_TIME);
            if (cycle != null) {
                maxCycleTime = Math.max(maxCycleTime, cycle.mean());
            }
        }

        List<BandStatistics> result = new ArrayList<>();
        for (Map.Entry<WeatherBand, Map<ProductionMetric, MetricSummary>> entry : summaries.entrySet()) {
            int count = byBand.get(entry.getKey()).size();
            double score = compositeScore(entry.getValue(), maxCycleTime);
            result.add(new BandStatistics(factor, entry.getKey(), count, entry.getValue(), score));
        }
        return result;
    }

    /**
     * Band of {@code factor} with the highest composite score, if any band has samples.
     */
    public Optional<OptimalRange> optimalRange(List<AlignedPair> pairs, WeatherFactor factor) {
        return bandStatistics(pairs, factor).stream()
                .max(Comparator.comparingDouble(BandStatistics::compositeScore))
                .map(stats -> new OptimalRange(factor, stats.band().name(), stats.band().lower(),
                        stats.band().upper(), stats.compositeScore()));
    }

    public Map<WeatherFactor, OptimalRange> optimalRanges(List<AlignedPair> pairs) {
        Map<WeatherFactor, OptimalRange> ranges = new EnumMap<>(WeatherFactor.class);
        for (WeatherFactor factor : WeatherFactor.values()) {
            optimalRange(pairs, factor).ifPresent(range -> ranges.put(factor, range));
        }
        return ranges;
    }

    /**
     * Flags readings whose pressure changed faster than the front threshold since the previous
     * reading at the same location, then compares quality and cycle time of pairs aligned to
     * those readings against the remaining pairs.
     */
    public WeatherFrontAnalysis detectWeatherFronts(List<AlignedPair> pairs) {
        Map<String, TreeMap<Instant, Double>> readingsByLocation = new LinkedHashMap<>();
        for (AlignedPair pair : pairs) {
            OptionalDouble pressure = pair.factor(WeatherFactor.PRESSURE);
            if (pair.observationTimestamp() == null || pressure.isEmpty()) {
                continue;
            }
            readingsByLocation.computeIfAbsent(pair.locationId(), k -> new TreeMap<>())
                    .putIfAbsent(pair.observationTimestamp(), pressure.getAsDouble());
        }

        Set<String> frontKeys = new HashSet<>();
        List<Instant> frontTimestamps = new ArrayList<>();
        for (Map.Entry<String, TreeMap<Instant, Double>> location : readingsByLocation.entrySet()) {
            Map.Entry<Instant, Double> previous = null;
            for (Map.Entry<Instant, Double> reading : location.getValue().entrySet()) {
                if (previous != null) {
                    double hours = Duration.between(previous.getKey(), reading.getKey()).toMillis() / 1000.0 / SECONDS_PER_HOUR;
                    if (hours > 0) {
                        double rate = Math.abs(reading.getValue() - previous.getValue()) / hours;
                        if (rate > settings.getFrontThresholdInHgPerHour()) {
                            frontKeys.add(location.getKey() + "|" + reading.getKey());
                            frontTimestamps.add(reading.getKey());
                        }
                    }
                }
                previous = reading;
            }
        }

        if (frontKeys.isEmpty()) {
            return WeatherFrontAnalysis.none();
        }

        List<AlignedPair> frontPairs = new ArrayList<>();
        List<AlignedPair> baselinePairs = new ArrayList<>();
        for (AlignedPair pair : pairs) {
            String key = pair.locationId() + "|" + pair.observationTimestamp();
            (frontKeys.contains(key) ? frontPairs : baselinePairs).add(pair);
        }

        frontTimestamps.sort(Comparator.naturalOrder());
        return new WeatherFrontAnalysis(frontKeys.size(), frontTimestamps,
                meanOf(frontPairs, ProductionMetric.QUALITY_SCORE) - meanOf(baselinePairs, ProductionMetric.QUALITY_SCORE),
                meanOf(frontPairs, ProductionMetric.CYCLE_TIME) - meanOf(baselinePairs, ProductionMetric.CYCLE_TIME));
    }

    private double compositeScore(Map<ProductionMetric, MetricSummary> metrics, double maxCycleTime) {
        double efficiency = meanOrZero(metrics, ProductionMetric.EFFICIENCY);
        double quality = meanOrZero(metrics, ProductionMetric.QUALITY_SCORE);
        double cycleTime = meanOrZero(metrics, ProductionMetric.CYCLE_TIME);
        double normalizedCycle = maxCycleTime > 0 ? cycleTime / maxCycleTime : 0.0;
        return efficiency * settings.getEfficiencyWeight()
                + quality * settings.getQualityWeight()
                - normalizedCycle * settings.getCycleTimePenaltyWeight();
    }

    private static double meanOrZero(Map<ProductionMetric, MetricSummary> metrics, ProductionMetric metric) {
        MetricSummary summary = metrics.get(metric);
        return summary != null ? summary.mean() : 0.0;
    }

    private static Map<ProductionMetric, MetricSummary> summarize(List<AlignedPair> pairs) {
        Map<ProductionMetric, MetricSummary> summaries = new EnumMap<>(ProductionMetric.class);
        for (ProductionMetric metric : ProductionMetric.values()) {
            List<Double> values = new ArrayList<>();
            for (AlignedPair pair : pairs) {
                pair.metric(metric).ifPresent(values::add);
            }
            if (!values.isEmpty()) {
                summaries.put(metric, new MetricSummary(Statistics.mean(values),
                        Statistics.standardDeviation(values), values.size()));
            }
        }
        return summaries;
    }

    private static double meanOf(List<AlignedPair> pairs, ProductionMetric metric) {
        List<Double> values = new ArrayList<>();
        for (AlignedPair pair : pairs) {
            pair.metric(metric).ifPresent(values::add);
        }
        return values.isEmpty() ? Double.NaN : Statistics.mean(values);
    }
}
