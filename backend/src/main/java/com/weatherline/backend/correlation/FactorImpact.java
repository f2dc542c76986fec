package com.weatherline.backend.correlation;

import com.weatherline.backend.model.RiskLevel;
import com.weatherline.backend.model.WeatherFactor;

/**
 * Impact of one weather factor on a single production event.
 *
 * @param value  factor value that triggered the impact
 * @param trend  change since the previous reading, NaN when not applicable
 */
public record FactorImpact(
        WeatherFactor factor,
        double value,
        double trend,
        RiskLevel impact,
        double confidence) {
}
