package com.weatherline.backend.correlation;

import com.weatherline.backend.model.ProductionEvent;
import com.weatherline.backend.model.ProductionMetric;
import com.weatherline.backend.model.ProductionStatus;
import com.weatherline.backend.model.WeatherContext;
import com.weatherline.backend.model.WeatherFactor;
import com.weatherline.backend.model.WeatherObservation;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * A production event and the weather observation it was aligned to, reduced to numbers.
 * Metrics the event did not report are absent from {@link #productionMetrics()}.
 */
public record AlignedPair(
        String locationId,
        Instant eventTimestamp,
        Instant observationTimestamp,
        Map<WeatherFactor, Double> weatherFactors,
        Map<ProductionMetric, Double> productionMetrics) {

    public AlignedPair {
        weatherFactors = weatherFactors.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(weatherFactors));
        productionMetrics = productionMetrics.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(productionMetrics));
    }

    public static AlignedPair of(ProductionEvent event, WeatherContext context) {
        WeatherObservation observation = context.getObservation();

        Map<WeatherFactor, Double> factors = new EnumMap<>(WeatherFactor.class);
        for (WeatherFactor factor : WeatherFactor.values()) {
            factors.put(factor, factor.valueFrom(observation));
        }

        Map<ProductionMetric, Double> metrics = new EnumMap<>(ProductionMetric.class);
        metrics.put(ProductionMetric.CYCLE_TIME, event.getCycleTime());
        Double efficiency = event.efficiency();
        if (efficiency != null) {
            metrics.put(ProductionMetric.EFFICIENCY, efficiency);
        }
        Double quality = event.detailParameter(ProductionEvent.PARAM_QUALITY_SCORE);
        if (quality != null) {
            metrics.put(ProductionMetric.QUALITY_SCORE, quality);
        }
        Double energy = event.detailParameter(ProductionEvent.PARAM_ENERGY_USAGE);
        if (energy != null) {
            metrics.put(ProductionMetric.ENERGY_USAGE, energy);
        }
        metrics.put(ProductionMetric.STATUS_GAIN, event.getStatus() == ProductionStatus.GAIN ? 1.0 : 0.0);

        return new AlignedPair(event.getLocationId(), event.getTimestamp(), observation.getTimestamp(),
                factors, metrics);
    }

    public OptionalDouble factor(WeatherFactor factor) {
        Double value = weatherFactors.get(factor);
        return value != null ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    public OptionalDouble metric(ProductionMetric metric) {
        Double value = productionMetrics.get(metric);
        return value != null ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
