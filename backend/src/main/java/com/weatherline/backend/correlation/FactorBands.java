package com.weatherline.backend.correlation;

import com.weatherline.backend.model.WeatherFactor;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operating bands per weather factor used for "optimal range" discovery.
 */
public final class FactorBands {

    private static final double NEG_INF = Double.NEGATIVE_INFINITY;
    private static final double POS_INF = Double.POSITIVE_INFINITY;

    private static final Map<WeatherFactor, List<WeatherBand>> BANDS = new EnumMap<>(WeatherFactor.class);

    static {
        BANDS.put(WeatherFactor.HUMIDITY, List.of(
                new WeatherBand("Low", NEG_INF, 45),
                new WeatherBand("Optimal", 45, 65),
                new WeatherBand("High", 65, 85),
                new WeatherBand("Extreme", 85, POS_INF)));
        BANDS.put(WeatherFactor.TEMPERATURE, List.of(
                new WeatherBand("Cool", NEG_INF, 75),
                new WeatherBand("Optimal", 75, 85),
                new WeatherBand("Hot", 85, 95),
                new WeatherBand("Extreme", 95, POS_INF)));
        BANDS.put(WeatherFactor.PRESSURE, List.of(
                new WeatherBand("Low", NEG_INF, 29.8),
                new WeatherBand("Normal", 29.8, 30.2),
                new WeatherBand("High", 30.2, POS_INF)));
        BANDS.put(WeatherFactor.WIND_SPEED, List.of(
                new WeatherBand("Calm", NEG_INF, 5),
                new WeatherBand("Breezy", 5, 15),
                new WeatherBand("Windy", 15, 25),
                new WeatherBand("Gale", 25, POS_INF)));
        BANDS.put(WeatherFactor.PRECIPITATION, List.of(
                new WeatherBand("Dry", NEG_INF, 0.01),
                new WeatherBand("Light", 0.01, 0.1),
                new WeatherBand("Moderate", 0.1, 0.5),
                new WeatherBand("Heavy", 0.5, POS_INF)));
    }

    private FactorBands() {
    }

    public static List<WeatherBand> bandsFor(WeatherFactor factor) {
        return BANDS.get(factor);
    }

    public static Optional<WeatherBand> classify(WeatherFactor factor, double value) {
        return bandsFor(factor).stream().filter(band -> band.contains(value)).findFirst();
    }
}
