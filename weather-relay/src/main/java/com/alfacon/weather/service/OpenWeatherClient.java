package com.alfacon.weather.service;

import com.alfacon.weather.config.WeatherRelayProperties;
import com.alfacon.weather.model.OpenWeatherResponse;
import com.alfacon.weather.model.WeatherReading;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Instant;
import java.util.Optional;

/**
 * Thin client over the OpenWeatherMap current-weather endpoint.
 *
 * Non-2xx responses and transport errors are retried (3 attempts by default, linear backoff).
 * A payload without main.temp or main.humidity is a failure that is not retried.
 * Callers only see a reading or empty; the reason is logged here.
 */
@Service
@Slf4j
public class OpenWeatherClient implements WeatherSource {

    private final RestTemplate restTemplate;
    private final WeatherRelayProperties.Weather settings;
    private final Retry retry;

    public OpenWeatherClient(@Qualifier("weatherRestTemplate") RestTemplate restTemplate,
                             WeatherRelayProperties properties) {
        this.restTemplate = restTemplate;
        this.settings = properties.getWeather();
        this.retry = RetryPolicies.weather(settings.getRetry());
    }

    @Override
    public Optional<WeatherReading> fetchReading() {
        try {
            WeatherReading reading = retry.executeSupplier(this::fetchOnce);
            log.info("{} weather: {}°C, {}% humidity, {}",
                    reading.getLocation(), reading.getTemperature(), reading.getHumidity(), reading.getDescription());
            return Optional.of(reading);

        } catch (MalformedWeatherResponseException e) {
            log.error("Weather payload rejected: {}", e.getMessage());
            return Optional.empty();

        } catch (Exception e) {
            log.error("Weather fetch failed after {} attempt(s): {}",
                    settings.getRetry().getMaxAttempts(), RetryPolicies.describe(e));
            return Optional.empty();
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private WeatherReading fetchOnce() {
        String url = UriComponentsBuilder
                .fromHttpUrl(settings.getApiUrl())
                .queryParam("lat", settings.getLatitude())
                .queryParam("lon", settings.getLongitude())
                .queryParam("appid", settings.getApiKey())
                .queryParam("units", settings.getUnits())
                .toUriString();

        // the key is part of the query string, so log the endpoint only
        log.debug("Calling weather API: {}", settings.getApiUrl());

        ResponseEntity<OpenWeatherResponse> response = restTemplate.getForEntity(url, OpenWeatherResponse.class);
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new UnexpectedStatusException(response.getStatusCode().value(), settings.getApiUrl());
        }
        return toReading(response.getBody());
    }

    WeatherReading toReading(OpenWeatherResponse body) {
        if (body == null || body.getMain() == null) {
            throw new MalformedWeatherResponseException("response has no 'main' section");
        }
        if (body.getMain().getTemp() == null) {
            throw new MalformedWeatherResponseException("main.temp is missing");
        }
        if (body.getMain().getHumidity() == null) {
            throw new MalformedWeatherResponseException("main.humidity is missing");
        }

        String description = "Unknown";
        if (body.getWeather() != null && !body.getWeather().isEmpty()
                && body.getWeather().get(0).getDescription() != null) {
            description = body.getWeather().get(0).getDescription();
        }

        Instant observedAt = body.getDt() != null ? Instant.ofEpochSecond(body.getDt()) : Instant.now();

        return WeatherReading.builder()
                .temperature(body.getMain().getTemp())
                .humidity(body.getMain().getHumidity())
                .description(description)
                .observedAt(observedAt)
                .location(settings.getLocation())
                .build();
    }
}
