package com.weatherline.backend.recommendation;

public record PrecipitationRisk(
        double rainfallLast24h,
        double rainProbabilityNext6h,
        boolean heavyRainfall,
        boolean highRainProbability) {
}
