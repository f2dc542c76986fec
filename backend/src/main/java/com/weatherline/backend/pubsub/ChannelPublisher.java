package com.weatherline.backend.pubsub;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Publishes domain objects to Redis Pub/Sub channels wrapped in a {@link ChannelMessage}.
 * Publishing is best-effort: failures are logged and never reach the caller.
 */
@Component
public class ChannelPublisher {

    private static final Logger log = LoggerFactory.getLogger(ChannelPublisher.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ChannelPublisher(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @return whether the message was handed to Redis
     */
    public boolean publish(String channel, String type, String key, Object payload) {
        try {
            ChannelMessage message = new ChannelMessage(type, key, objectMapper.valueToTree(payload), clock.instant());
            String json = objectMapper.writeValueAsString(message);

            redisTemplate.convertAndSend(channel, json);
            log.debug("[PUB/SUB] Published {} to {} for key: {}", type, channel, key);
            return true;
        } catch (Exception e) {
            log.error("[PUB/SUB] Failed to publish {} to {} for key: {}", type, channel, key, e);
            return false;
        }
    }
}
