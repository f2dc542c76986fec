package com.weatherline.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pools for production events and their historical weather lookups, and the clock
 * shared by time-stamping components.
 */
@Configuration
public class ProcessingConfig {

    public static final String STREAM_EXECUTOR = "streamExecutor";
    public static final String WEATHER_LOOKUP_EXECUTOR = "weatherLookupExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = STREAM_EXECUTOR)
    public ThreadPoolTaskExecutor streamExecutor(WeatherlineProperties properties) {
        WeatherlineProperties.Processing processing = properties.getProcessing();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(processing.getCorePoolSize());
        executor.setMaxPoolSize(processing.getMaxPoolSize());
        executor.setQueueCapacity(processing.getQueueCapacity());
        executor.setThreadNamePrefix("stream-");
        // Full queue: the submitting listener thread runs the event itself
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    /**
     * Runs historical weather lookups so a stream worker can stop waiting on one after the
     * lookup timeout. A full queue rejects the lookup and the event goes on without weather.
     */
    @Bean(name = WEATHER_LOOKUP_EXECUTOR)
    public ThreadPoolTaskExecutor weatherLookupExecutor(WeatherlineProperties properties) {
        WeatherlineProperties.Processing processing = properties.getProcessing();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(processing.getLookupPoolSize());
        executor.setMaxPoolSize(processing.getLookupPoolSize());
        executor.setQueueCapacity(processing.getLookupQueueCapacity());
        executor.setThreadNamePrefix("weather-lookup-");
        return executor;
    }
}
