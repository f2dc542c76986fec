package com.weatherline.backend.pubsub;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Envelope for every message on the Redis channels.
 *
 * @param type    message kind, e.g. {@code production_event} or {@code weather_alert}
 * @param key     partition key, normally the location id
 * @param payload the serialized domain object
 */
public record ChannelMessage(String type, String key, JsonNode payload, Instant timestamp) {

    public static final String PRODUCTION_EVENT = "production_event";
    public static final String WEATHER_READING = "weather_reading";
    public static final String PRODUCTION_OPTIMIZATION = "production_optimization";
    public static final String WEATHER_ALERT = "weather_alert";
}
