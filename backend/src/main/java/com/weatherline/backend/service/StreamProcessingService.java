package com.weatherline.backend.service;

import com.weatherline.backend.alignment.HistoricalWeatherStore;
import com.weatherline.backend.alignment.LiveWeatherCache;
import com.weatherline.backend.alignment.TemporalAligner;
import com.weatherline.backend.config.ProcessingConfig;
import com.weatherline.backend.config.RedisMessageConfig;
import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.correlation.AlignedPair;
import com.weatherline.backend.correlation.CorrelationStateStore;
import com.weatherline.backend.correlation.FactorImpactAssessment;
import com.weatherline.backend.correlation.FactorImpactAssessor;
import com.weatherline.backend.model.EnrichedProductionEvent;
import com.weatherline.backend.model.OptimizationRecord;
import com.weatherline.backend.model.ProductionEvent;
import com.weatherline.backend.model.WeatherAlert;
import com.weatherline.backend.model.WeatherContext;
import com.weatherline.backend.model.WeatherObservation;
import com.weatherline.backend.optimization.OptimizationDispatcher;
import com.weatherline.backend.pubsub.ChannelMessage;
import com.weatherline.backend.pubsub.ChannelPublisher;
import com.weatherline.backend.repository.EnrichedProductionEventRepository;
import com.weatherline.backend.repository.ProductionEventRepository;
import com.weatherline.backend.repository.WeatherObservationRepository;
import com.weatherline.backend.weather.PressureTrendTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Real-time processing of the production and weather streams.
 * <p>
 * A production event is persisted, aligned to weather, added to its location's rolling
 * correlation window, assessed and dispatched for optimization, then stored enriched.
 * Failures of a single event are logged and do not stop the stream.
 */
@Service
public class StreamProcessingService {

    private static final Logger log = LoggerFactory.getLogger(StreamProcessingService.class);

    private final ProductionEventRepository productionEventRepository;
    private final WeatherObservationRepository weatherObservationRepository;
    private final EnrichedProductionEventRepository enrichedProductionEventRepository;
    private final TemporalAligner temporalAligner;
    private final LiveWeatherCache liveWeatherCache;
    private final HistoricalWeatherStore historicalWeatherStore;
    private final CorrelationStateStore correlationStateStore;
    private final FactorImpactAssessor factorImpactAssessor;
    private final PressureTrendTracker pressureTrendTracker;
    private final OptimizationDispatcher optimizationDispatcher;
    private final WeatherAlertService weatherAlertService;
    private final ChannelPublisher channelPublisher;
    private final ProcessingMetrics processingMetrics;
    private final TaskExecutor streamExecutor;
    private final AsyncTaskExecutor weatherLookupExecutor;
    private final Duration lookupTimeout;
    private final Set<String> seenEventIds;

    public StreamProcessingService(ProductionEventRepository productionEventRepository,
            WeatherObservationRepository weatherObservationRepository,
            EnrichedProductionEventRepository enrichedProductionEventRepository,
            TemporalAligner temporalAligner,
            LiveWeatherCache liveWeatherCache,
            HistoricalWeatherStore historicalWeatherStore,
            CorrelationStateStore correlationStateStore,
            FactorImpactAssessor factorImpactAssessor,
            PressureTrendTracker pressureTrendTracker,
            OptimizationDispatcher optimizationDispatcher,
            WeatherAlertService weatherAlertService,
            ChannelPublisher channelPublisher,
            ProcessingMetrics processingMetrics,
            @Qualifier(ProcessingConfig.STREAM_EXECUTOR) TaskExecutor streamExecutor,
            @Qualifier(ProcessingConfig.WEATHER_LOOKUP_EXECUTOR) AsyncTaskExecutor weatherLookupExecutor,
            WeatherlineProperties properties) {
        this.productionEventRepository = productionEventRepository;
        this.weatherObservationRepository = weatherObservationRepository;
        this.enrichedProductionEventRepository = enrichedProductionEventRepository;
        this.temporalAligner = temporalAligner;
        this.liveWeatherCache = liveWeatherCache;
        this.historicalWeatherStore = historicalWeatherStore;
        this.correlationStateStore = correlationStateStore;
        this.factorImpactAssessor = factorImpactAssessor;
        this.pressureTrendTracker = pressureTrendTracker;
        this.optimizationDispatcher = optimizationDispatcher;
        this.weatherAlertService = weatherAlertService;
        this.channelPublisher = channelPublisher;
        this.processingMetrics = processingMetrics;
        this.streamExecutor = streamExecutor;
        this.weatherLookupExecutor = weatherLookupExecutor;
        this.lookupTimeout = properties.getAlignment().getLookupTimeout();
        this.seenEventIds = boundedIdSet(properties.getProcessing().getSeenEventCapacity());
    }

    /**
     * Hands the event to the worker pool.
     */
    public void submitProductionEvent(ProductionEvent event) {
        streamExecutor.execute(() -> processProductionEvent(event));
    }

    /**
     * Processes one production event on the calling thread.
     *
     * @return the optimization emitted for the event, if any
     */
    public Optional<OptimizationRecord> processProductionEvent(ProductionEvent event) {
        if (event.getEventId() == null) {
            event.setEventId(UUID.randomUUID().toString());
        }
        if (!seenEventIds.add(event.getEventId())) {
            log.debug("[STREAM] Ignoring duplicate event: {}", event.getEventId());
            processingMetrics.recordDuplicate();
            return Optional.empty();
        }

        long start = System.nanoTime();
        try {
            persist(event);

            Optional<WeatherContext> context = alignWithTimeout(event);
            Optional<OptimizationRecord> optimization = Optional.empty();
            if (context.isPresent()) {
                WeatherContext weather = context.get();
                correlationStateStore.append(AlignedPair.of(event, weather));

                FactorImpactAssessment assessment = factorImpactAssessor.assess(event, weather,
                        pressureTrendTracker.trend(event.getLocationId()),
                        correlationStateStore.significantFindings(event.getLocationId()));
                optimization = optimizationDispatcher.dispatch(event, weather, assessment);
            } else {
                log.debug("[STREAM] No weather context for event: {} at location: {}",
                        event.getEventId(), event.getLocationId());
            }

            storeEnriched(event, context.orElse(null));
            processingMetrics.recordEvent(System.nanoTime() - start, context.isPresent(), optimization.isPresent());
            return optimization;
        } catch (RuntimeException e) {
            log.error("[STREAM] Failed to process event: {}", event.getEventId(), e);
            return Optional.empty();
        }
    }

    /**
     * Handles a weather reading.
     *
     * @param republish whether to forward the reading on the weather channel (readings received over HTTP)
     * @return alerts raised by the reading
     */
    public List<WeatherAlert> processWeatherObservation(WeatherObservation observation, boolean republish) {
        if (observation.getId() == null) {
            observation.setId(observation.getLocationId() + "_" + observation.getTimestamp().toEpochMilli());
        }

        boolean newest = liveWeatherCache.update(observation);
        OptionalDouble pressureChange = pressureTrendTracker.record(observation);

        try {
            weatherObservationRepository.save(observation);
        } catch (RuntimeException e) {
            log.error("[STREAM] Failed to store weather reading: {}", observation.getId(), e);
        }

        if (republish) {
            channelPublisher.publish(RedisMessageConfig.WEATHER_DATA_CHANNEL, ChannelMessage.WEATHER_READING,
                    observation.getLocationId(), observation);
        }

        List<WeatherAlert> alerts = newest
                ? weatherAlertService.raiseAlerts(observation, pressureChange)
                : List.of();
        processingMetrics.recordWeatherReading(alerts.size());
        return alerts;
    }

    private Optional<WeatherContext> alignWithTimeout(ProductionEvent event) {
        Callable<Optional<WeatherContext>> lookup =
                () -> temporalAligner.align(event, liveWeatherCache, historicalWeatherStore);
        Future<Optional<WeatherContext>> pending;
        try {
            pending = weatherLookupExecutor.submit(lookup);
        } catch (TaskRejectedException e) {
            log.warn("[STREAM] Weather lookup pool busy, skipping weather for event: {}", event.getEventId());
            return Optional.empty();
        }

        try {
            return pending.get(lookupTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            log.warn("[STREAM] Weather lookup timed out after {} for event: {}", lookupTimeout, event.getEventId());
        } catch (ExecutionException e) {
            log.error("[STREAM] Weather lookup failed for event: {}", event.getEventId(), e.getCause());
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("[STREAM] Interrupted during weather lookup for event: {}", event.getEventId());
        }
        return Optional.empty();
    }

    private void persist(ProductionEvent event) {
        try {
            productionEventRepository.save(event);
        } catch (RuntimeException e) {
            log.error("[STREAM] Failed to store production event: {}", event.getEventId(), e);
        }
    }

    private void storeEnriched(ProductionEvent event, WeatherContext context) {
        try {
            enrichedProductionEventRepository.save(EnrichedProductionEvent.builder()
                    .locationId(event.getLocationId())
                    .event(event)
                    .weatherContext(context)
                    .build());
        } catch (RuntimeException e) {
            log.error("[STREAM] Failed to store enriched event: {}", event.getEventId(), e);
        }
    }

    private static Set<String> boundedIdSet(int capacity) {
        Map<String, Boolean> ids = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        };
        return Collections.synchronizedSet(Collections.newSetFromMap(ids));
    }
}
