package com.weatherline.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Weather observation attached to a production event, with its age relative to the event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeatherContext {

    private WeatherObservation observation;

    private double dataAgeMinutes;
}
