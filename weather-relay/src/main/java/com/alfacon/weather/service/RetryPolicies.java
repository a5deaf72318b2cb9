package com.alfacon.weather.service;

import com.alfacon.weather.config.WeatherRelayProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.util.function.Predicate;

/**
 * Builds the Resilience4j retry used by each outbound call type.
 *
 * All three share a linear backoff: the wait before retry n is baseDelay * n.
 * What differs is the predicate deciding which failures are worth another attempt.
 */
@Slf4j
public final class RetryPolicies {

    private RetryPolicies() {
    }

    /**
     * Device pushes: transport errors, timeouts and any non-2xx status except 404.
     * A 404 means the device or resource does not exist; asking again will not change that.
     */
    public static boolean isRetryable(Throwable t) {
        if (t instanceof ResourceAccessException || t instanceof UnexpectedStatusException) {
            return true;
        }
        if (t instanceof RestClientResponseException response) {
            return response.getStatusCode().value() != HttpStatus.NOT_FOUND.value();
        }
        return false;
    }

    /**
     * Weather fetches retry transport errors and every non-2xx, 404 included.
     * A payload that parsed but is unusable is not retried.
     */
    public static boolean isRetryableWeatherFailure(Throwable t) {
        return t instanceof ResourceAccessException
                || t instanceof UnexpectedStatusException
                || t instanceof RestClientResponseException;
    }

    /** Probes only retry what might be a blip: transport errors and 5xx. */
    public static boolean isRetryableProbeFailure(Throwable t) {
        if (t instanceof ResourceAccessException) {
            return true;
        }
        return t instanceof RestClientResponseException response && response.getStatusCode().is5xxServerError();
    }

    public static Retry weather(WeatherRelayProperties.RetrySettings settings) {
        return build("weatherApi", settings, RetryPolicies::isRetryableWeatherFailure);
    }

    public static Retry devicePush(WeatherRelayProperties.RetrySettings settings) {
        return build("devicePush", settings, RetryPolicies::isRetryable);
    }

    /** Short fixed delay between probe attempts; most misses are plain "unassigned id". */
    public static Retry deviceProbe(WeatherRelayProperties.RetrySettings settings) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(IntervalFunction.of(settings.getBaseDelayMs()))
                .retryOnException(RetryPolicies::isRetryableProbeFailure)
                .build();
        return Retry.of("deviceProbe", config);
    }

    static Retry build(String name, WeatherRelayProperties.RetrySettings settings, Predicate<Throwable> retryable) {
        long base = settings.getBaseDelayMs();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(IntervalFunction.of(base, previous -> previous + base))
                .retryOnException(retryable)
                .build();

        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event -> log.debug("{}: attempt {} failed ({}), retrying in {}ms",
                name,
                event.getNumberOfRetryAttempts(),
                describe(event.getLastThrowable()),
                event.getWaitInterval().toMillis()));
        return retry;
    }

    static String describe(Throwable t) {
        if (t == null) {
            return "unknown";
        }
        if (t instanceof RestClientResponseException response) {
            return "HTTP " + response.getStatusCode().value();
        }
        return t.getClass().getSimpleName() + ": " + t.getMessage();
    }
}
