package com.weatherline.backend.pubsub;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.weatherline.backend.model.ProductionEvent;
import com.weatherline.backend.model.WeatherObservation;
import com.weatherline.backend.service.StreamProcessingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Receives production events and weather readings from Redis Pub/Sub and hands them to the
 * stream processor. Called by Spring's MessageListenerAdapter, one method per channel.
 */
@Component
public class StreamSubscriber {

    private static final Logger log = LoggerFactory.getLogger(StreamSubscriber.class);

    private final ObjectMapper objectMapper;
    private final StreamProcessingService streamProcessingService;

    public StreamSubscriber(ObjectMapper objectMapper, StreamProcessingService streamProcessingService) {
        this.objectMapper = objectMapper;
        this.streamProcessingService = streamProcessingService;
    }

    public void handleProductionEvent(String message) {
        try {
            ChannelMessage envelope = objectMapper.readValue(message, ChannelMessage.class);
            ProductionEvent event = objectMapper.treeToValue(envelope.payload(), ProductionEvent.class);
            log.debug("[PUB/SUB] Received production event: {} for location: {}",
                    event.getEventId(), event.getLocationId());

            streamProcessingService.submitProductionEvent(event);
        } catch (Exception e) {
            log.error("[PUB/SUB] Failed to process production event message: {}", message, e);
        }
    }

    public void handleWeatherReading(String message) {
        try {
            ChannelMessage envelope = objectMapper.readValue(message, ChannelMessage.class);
            WeatherObservation observation = objectMapper.treeToValue(envelope.payload(), WeatherObservation.class);
            log.debug("[PUB/SUB] Received weather reading for location: {} at {}",
                    observation.getLocationId(), observation.getTimestamp());

            streamProcessingService.processWeatherObservation(observation, false);
        } catch (Exception e) {
            log.error("[PUB/SUB] Failed to process weather message: {}", message, e);
        }
    }
}
