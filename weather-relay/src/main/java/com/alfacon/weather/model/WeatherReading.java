package com.alfacon.weather.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One upstream observation, fetched once per run and shared read-only by every push.
 */
@Value
@Builder
public class WeatherReading {

    double temperature;
    int humidity;
    String description;
    Instant observedAt;
    String location;        // configured label, e.g. "Athens, GR"
}
