package com.alfacon.weather.service;

import com.alfacon.weather.model.WeatherReading;

import java.util.Optional;

/**
 * Supplies the single reading a run fans out. Empty means the fetch failed after retries;
 * the reason has already been logged.
 */
public interface WeatherSource {

    Optional<WeatherReading> fetchReading();
}
