package com.weatherline.backend.config;

import com.weatherline.backend.pubsub.StreamSubscriber;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.adapter.MessageListenerAdapter;

/**
 * Redis Pub/Sub channels for the production and weather streams.
 */
@Configuration
public class RedisMessageConfig {

    // Inbound
    public static final String PRODUCTION_EVENTS_CHANNEL = "production-events";
    // Inbound, and outbound for readings received over HTTP
    public static final String WEATHER_DATA_CHANNEL = "weather-data";
    // Outbound
    public static final String PRODUCTION_OPTIMIZATIONS_CHANNEL = "production-optimizations";
    public static final String WEATHER_ALERTS_CHANNEL = "weather-alerts";

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(
            RedisConnectionFactory connectionFactory,
            @Qualifier("productionEventListener") MessageListenerAdapter productionEventListener,
            @Qualifier("weatherReadingListener") MessageListenerAdapter weatherReadingListener) {

        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(productionEventListener, new PatternTopic(PRODUCTION_EVENTS_CHANNEL));
        container.addMessageListener(weatherReadingListener, new PatternTopic(WEATHER_DATA_CHANNEL));
        return container;
    }

    @Bean
    public MessageListenerAdapter productionEventListener(StreamSubscriber subscriber) {
        return new MessageListenerAdapter(subscriber, "handleProductionEvent");
    }

    @Bean
    public MessageListenerAdapter weatherReadingListener(StreamSubscriber subscriber) {
        return new MessageListenerAdapter(subscriber, "handleWeatherReading");
    }
}
