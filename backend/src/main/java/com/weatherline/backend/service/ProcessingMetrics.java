package com.weatherline.backend.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for the stream processor, logged once an hour.
 */
@Component
public class ProcessingMetrics {

    private static final Logger log = LoggerFactory.getLogger(ProcessingMetrics.class);

    private final AtomicLong eventsProcessed = new AtomicLong();
    private final AtomicLong duplicatesIgnored = new AtomicLong();
    private final AtomicLong eventsWithoutContext = new AtomicLong();
    private final AtomicLong optimizationsGenerated = new AtomicLong();
    private final AtomicLong weatherReadings = new AtomicLong();
    private final AtomicLong alertsRaised = new AtomicLong();
    private final AtomicLong totalProcessingNanos = new AtomicLong();

    public void recordEvent(long processingNanos, boolean aligned, boolean optimized) {
        eventsProcessed.incrementAndGet();
        totalProcessingNanos.addAndGet(processingNanos);
        if (!aligned) {
            eventsWithoutContext.incrementAndGet();
        }
        if (optimized) {
            optimizationsGenerated.incrementAndGet();
        }
    }

    public void recordDuplicate() {
        duplicatesIgnored.incrementAndGet();
    }

    public void recordWeatherReading(int alerts) {
        weatherReadings.incrementAndGet();
        alertsRaised.addAndGet(alerts);
    }

    public long getEventsProcessed() {
        return eventsProcessed.get();
    }

    public long getDuplicatesIgnored() {
        return duplicatesIgnored.get();
    }

    public long getEventsWithoutContext() {
        return eventsWithoutContext.get();
    }

    public long getOptimizationsGenerated() {
        return optimizationsGenerated.get();
    }

    public long getWeatherReadings() {
        return weatherReadings.get();
    }

    public long getAlertsRaised() {
        return alertsRaised.get();
    }

    public double getAverageProcessingMillis() {
        long events = eventsProcessed.get();
        return events == 0 ? 0.0 : totalProcessingNanos.get() / 1_000_000.0 / events;
    }

    @Scheduled(fixedRateString = "${weatherline.processing.metrics-interval:PT1H}",
            initialDelayString = "${weatherline.processing.metrics-interval:PT1H}")
    public void logMetrics() {
        log.info("[STREAM] Metrics | Events: {} | Duplicates: {} | No context: {} | Optimizations: {} | Readings: {} | Alerts: {} | Avg ms: {}",
                getEventsProcessed(), getDuplicatesIgnored(), getEventsWithoutContext(),
                getOptimizationsGenerated(), getWeatherReadings(), getAlertsRaised(),
                String.format("%.2f", getAverageProcessingMillis()));
    }
}
