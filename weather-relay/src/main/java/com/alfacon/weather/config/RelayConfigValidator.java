package com.alfacon.weather.config;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the bound properties before a run touches the network.
 * All problems are collected so a misconfigured deployment is fixed in one pass.
 */
@Component
public class RelayConfigValidator {

    public void validate(WeatherRelayProperties properties) {
        List<String> problems = new ArrayList<>();

        WeatherRelayProperties.Platform platform = properties.getPlatform();
        requireText(platform.getToken(), "platform.token (THINGER_TOKEN) is not set", problems);
        requireText(platform.getBaseUrl(), "platform.base-url (THINGER_SERVER) is not set", problems);
        requireText(platform.getUsername(), "platform.username (THINGER_USERNAME) is not set", problems);
        requireText(platform.getResource(), "platform.resource is not set", problems);

        WeatherRelayProperties.Weather weather = properties.getWeather();
        requireText(weather.getApiKey(), "weather.api-key (WEATHER_API_KEY) is not set", problems);
        requireText(weather.getApiUrl(), "weather.api-url is not set", problems);

        WeatherRelayProperties.Devices devices = properties.getDevices();
        requireText(devices.getPrefix(), "devices.prefix is not set", problems);
        if (devices.getStart() > devices.getEnd()) {
            problems.add("devices.start (" + devices.getStart() + ") is after devices.end (" + devices.getEnd() + ")");
        }

        if (properties.getDiscovery().getConcurrency() < 1) {
            problems.add("discovery.concurrency must be at least 1");
        }
        if (properties.getDispatch().getConcurrency() < 1) {
            problems.add("dispatch.concurrency must be at least 1");
        }
        if (properties.getDispatch().getBatchSize() < 1) {
            problems.add("dispatch.batch-size must be at least 1");
        }
        if (properties.getDispatch().getInterDeviceDelayMs() < 0) {
            problems.add("dispatch.inter-device-delay-ms must not be negative");
        }

        checkRetry(weather.getRetry(), "weather.retry", problems);
        checkRetry(properties.getDiscovery().getRetry(), "discovery.retry", problems);
        checkRetry(properties.getDispatch().getRetry(), "dispatch.retry", problems);

        double threshold = properties.getRun().getSuccessThreshold();
        if (threshold < 0.0 || threshold > 1.0) {
            problems.add("run.success-threshold must be between 0 and 1, was " + threshold);
        }

        if (!problems.isEmpty()) {
            throw new RelayConfigurationException(problems);
        }
    }

    private void checkRetry(WeatherRelayProperties.RetrySettings retry, String name, List<String> problems) {
        if (retry.getMaxAttempts() < 1) {
            problems.add(name + ".max-attempts must be at least 1");
        }
        if (retry.getBaseDelayMs() < 1) {
            problems.add(name + ".base-delay-ms must be at least 1");
        }
    }

    private void requireText(String value, String message, List<String> problems) {
        if (value == null || value.isBlank()) {
            problems.add(message);
        }
    }
}
