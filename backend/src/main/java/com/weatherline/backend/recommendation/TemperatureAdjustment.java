package com.weatherline.backend.recommendation;

/**
 * @param hotExcess   degrees above the hot threshold, 0 when not hot
 * @param coldDeficit degrees below the cold threshold, 0 when not cold
 */
public record TemperatureAdjustment(
        double temperature,
        double offsetFromOptimal,
        double hotExcess,
        double coldDeficit,
        boolean extreme) {
}
