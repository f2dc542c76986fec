package com.weatherline.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunable parameters of the correlation core.
 * <p>
 * The rule coefficients and thresholds are site heuristics without an empirical
 * derivation behind them; they live here so each facility can override them.
 */
@Data
@ConfigurationProperties(prefix = "weatherline")
public class WeatherlineProperties {

    private Alignment alignment = new Alignment();
    private Correlation correlation = new Correlation();
    private Impact impact = new Impact();
    private Recommender recommender = new Recommender();
    private Optimization optimization = new Optimization();
    private Alerts alerts = new Alerts();
    private Processing processing = new Processing();

    @Data
    public static class Alignment {
        private double maxAgeMinutes = 30.0;
        private Duration lookupTimeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Correlation {
        private int minSamples = 10;
        private Duration windowDuration = Duration.ofHours(1);
        private int windowMaxEvents = 1000;
        private double frontThresholdInHgPerHour = 0.1;
        private double efficiencyWeight = 0.4;
        private double qualityWeight = 0.4;
        private double cycleTimePenaltyWeight = 0.2;
    }

    @Data
    public static class Impact {
        private double humidityThreshold = 70.0;
        private double humidityConfidence = 0.85;
        private double temperatureThreshold = 85.0;
        private double temperatureSevereThreshold = 95.0;
        private double temperatureLinearRate = 0.015;
        private double temperatureSevereBase = 0.15;
        private double temperatureSevereRate = 0.03;
        private double temperatureImpactMin = 0.10;
        private double temperatureImpactHigh = 0.20;
        private double temperatureConfidence = 0.78;
        private double pressureTrendThreshold = 0.1;
        private double pressureConfidence = 0.72;
    }

    @Data
    public static class Recommender {
        private double defaultDryerTemp = 150.0;
        private double defaultConfidence = 0.5;

        // Moisture
        private double baseMoisture = 8.0;
        private double rainfallMoistureFactor = 2.5;
        private double rainfallMoistureCap = 10.0;
        private double moistureMajorDeviation = 2.0;
        private double moistureMinorDeviation = 1.0;
        private double moistureDryerPerUnit = 5.0;
        private double moistureDryerCap = 25.0;
        private double moisturePreMixPerUnit = 30.0;
        private double moistureMinorDryerIncrease = 10.0;
        private int moistureMinorPreMixIncrease = 60;

        // Precipitation
        private double heavyRainfallInches = 1.5;
        private double rainProbabilityThreshold = 70.0;
        private int rainPreMixReduction = 120;

        // Temperature
        private double optimalTemperature = 75.0;
        private double hotThreshold = 85.0;
        private double coldThreshold = 60.0;
        private double hotDryerFactor = 0.8;
        private double hotDryerCap = 20.0;
        private int hotPreMixIncrease = 90;
        private double coldDryerFactor = 1.2;
        private double coldDryerCap = 30.0;
        private double extremeDeviation = 25.0;
        private double freezingThreshold = 32.0;
        private double extremeHeatThreshold = 105.0;

        // Efficiency
        private double criticalEfficiencyLoss = 0.25;
        private double efficiencyLossThreshold = 0.05;
        private double criticalDryerIncrease = 15.0;
        private int criticalPreMixIncrease = 180;
        private double moderateDryerIncrease = 8.0;
        private int moderatePreMixIncrease = 60;

        // Safety
        private double safetyRainfallInches = 2.0;
        private double safetyRainfallPenalty = 0.3;
        private double safetyRainProbability = 80.0;
        private double safetyRainProbabilityPenalty = 0.2;
        private double safetyColdThreshold = 35.0;
        private double safetyHeatThreshold = 100.0;
        private double safetyTemperaturePenalty = 0.4;
        private double safetyHumidityThreshold = 90.0;
        private double safetyHumidityPenalty = 0.1;
        private double safetyCriticalScore = 0.3;
        private double safetyWarningScore = 0.7;
        private double criticalConfidence = 0.95;

        // Bounds
        private double minDryerTemp = 100.0;
        private double maxDryerTemp = 200.0;
        private int minPreMixDelta = -300;
        private int maxPreMixDelta = 600;

        // Confidence scoring
        private double baseConfidence = 0.8;
        private double lowSensorQualityThreshold = 0.8;
        private double lowSensorQualityPenalty = 0.2;
        private int shortRationaleLength = 50;
        private double shortRationalePenalty = 0.1;
        private double minConfidence = 0.1;
        private double maxConfidence = 1.0;
        private double fallbackConfidence = 0.1;
    }

    @Data
    public static class Optimization {
        private double confidenceThreshold = 0.7;
        private double baselineDryerTemp = 150.0;
        private double baselinePreMixTime = 60.0;
        private Duration rainfallLookback = Duration.ofHours(24);
    }

    @Data
    public static class Alerts {
        private double temperatureHigh = 85.0;
        private double temperatureCritical = 95.0;
        private double humidityHigh = 75.0;
        private double pressureChange = 0.15;
        private Duration temperatureHighValidity = Duration.ofHours(1);
        private Duration temperatureCriticalValidity = Duration.ofHours(2);
        private Duration humidityValidity = Duration.ofHours(2);
        private Duration pressureValidity = Duration.ofHours(4);
    }

    @Data
    public static class Processing {
        private int corePoolSize = 4;
        private int maxPoolSize = 8;
        private int queueCapacity = 1000;
        private int lookupPoolSize = 4;
        private int lookupQueueCapacity = 200;
        private Duration recomputeInterval = Duration.ofMinutes(5);
        private Duration metricsInterval = Duration.ofHours(1);
        private int seenEventCapacity = 10000;
    }
}
