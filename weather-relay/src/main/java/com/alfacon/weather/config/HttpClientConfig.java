package com.alfacon.weather.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * One RestTemplate per call type so each gets its own read timeout.
 * A timed-out call surfaces as ResourceAccessException and is retried like any transport error.
 */
@Configuration
public class HttpClientConfig {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    @Bean
    public RestTemplate probeRestTemplate(RestTemplateBuilder builder, WeatherRelayProperties properties) {
        return withTimeout(builder, properties.getDiscovery().getTimeout());
    }

    @Bean
    public RestTemplate pushRestTemplate(RestTemplateBuilder builder, WeatherRelayProperties properties) {
        return withTimeout(builder, properties.getDispatch().getTimeout());
    }

    @Bean
    public RestTemplate weatherRestTemplate(RestTemplateBuilder builder, WeatherRelayProperties properties) {
        return withTimeout(builder, properties.getWeather().getTimeout());
    }

    private RestTemplate withTimeout(RestTemplateBuilder builder, Duration readTimeout) {
        return builder
                .setConnectTimeout(CONNECT_TIMEOUT)
                .setReadTimeout(readTimeout)
                .build();
    }
}
