package com.weatherline.backend.service;

import com.weatherline.backend.config.RedisMessageConfig;
import com.weatherline.backend.model.WeatherAlert;
import com.weatherline.backend.model.WeatherObservation;
import com.weatherline.backend.pubsub.ChannelMessage;
import com.weatherline.backend.pubsub.ChannelPublisher;
import com.weatherline.backend.repository.WeatherAlertRepository;
import com.weatherline.backend.weather.WeatherAlertEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Raises, stores and publishes weather alerts.
 */
@Service
public class WeatherAlertService {

    private static final Logger log = LoggerFactory.getLogger(WeatherAlertService.class);

    private final WeatherAlertEvaluator evaluator;
    private final WeatherAlertRepository weatherAlertRepository;
    private final ChannelPublisher channelPublisher;
    private final Clock clock;

    public WeatherAlertService(WeatherAlertEvaluator evaluator,
            WeatherAlertRepository weatherAlertRepository,
            ChannelPublisher channelPublisher,
            Clock clock) {
        this.evaluator = evaluator;
        this.weatherAlertRepository = weatherAlertRepository;
        this.channelPublisher = channelPublisher;
        this.clock = clock;
    }

    public List<WeatherAlert> raiseAlerts(WeatherObservation observation, OptionalDouble pressureChange) {
        List<WeatherAlert> alerts = evaluator.evaluate(observation, pressureChange, clock.instant());
        for (WeatherAlert alert : alerts) {
            log.warn("[ALERT] {} {} at {}: {}", alert.getSeverity(), alert.getAlertType(),
                    alert.getLocationId(), alert.getMessage());
            try {
                weatherAlertRepository.save(alert);
            } catch (RuntimeException e) {
                log.error("[ALERT] Failed to store alert: {}", alert.getId(), e);
            }
            channelPublisher.publish(RedisMessageConfig.WEATHER_ALERTS_CHANNEL,
                    ChannelMessage.WEATHER_ALERT, alert.getLocationId(), alert);
        }
        return alerts;
    }

    public List<WeatherAlert> getAlerts(String locationId, boolean activeOnly) {
        if (activeOnly) {
            return weatherAlertRepository.findByLocationIdAndValidUntilAfterOrderByIssuedAtDesc(locationId, clock.instant());
        }
        return weatherAlertRepository.findByLocationIdOrderByIssuedAtDesc(locationId);
    }
}
