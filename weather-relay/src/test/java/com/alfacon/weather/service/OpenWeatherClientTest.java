package com.alfacon.weather.service;

import com.alfacon.weather.RelayTestProperties;
import com.alfacon.weather.model.WeatherReading;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenWeatherClientTest {

    private static final String ATHENS = """
            {
              "coord": {"lon": 23.7275, "lat": 37.9838},
              "weather": [{"id": 800, "main": "Clear", "description": "clear sky"}],
              "main": {"temp": 21.5, "feels_like": 21.0, "humidity": 60, "pressure": 1015},
              "dt": 1760000000,
              "name": "Athens"
            }
            """;

    private MockRestServiceServer server;
    private OpenWeatherClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new OpenWeatherClient(restTemplate, RelayTestProperties.create());
    }

    @Test
    void mapsCurrentWeatherPayload() {
        server.expect(requestTo(startsWith(RelayTestProperties.WEATHER_URL)))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("appid", "test-key"))
                .andExpect(queryParam("units", "metric"))
                .andExpect(queryParam("lat", "37.9838"))
                .andRespond(withSuccess(ATHENS, MediaType.APPLICATION_JSON));

        Optional<WeatherReading> reading = client.fetchReading();

        assertThat(reading).isPresent();
        assertThat(reading.get().getTemperature()).isEqualTo(21.5);
        assertThat(reading.get().getHumidity()).isEqualTo(60);
        assertThat(reading.get().getDescription()).isEqualTo("clear sky");
        assertThat(reading.get().getObservedAt()).isEqualTo(Instant.ofEpochSecond(1760000000L));
        assertThat(reading.get().getLocation()).isEqualTo("Athens, GR");
        server.verify();
    }

    @Test
    void missingDescriptionDefaultsToUnknown() {
        server.expect(requestTo(startsWith(RelayTestProperties.WEATHER_URL)))
                .andRespond(withSuccess("{\"main\":{\"temp\":18.2,\"humidity\":71}}", MediaType.APPLICATION_JSON));

        WeatherReading reading = client.fetchReading().orElseThrow();

        assertThat(reading.getDescription()).isEqualTo("Unknown");
        assertThat(reading.getObservedAt()).isNotNull();
    }

    @Test
    void malformedPayloadFailsWithoutRetry() {
        server.expect(ExpectedCount.once(), requestTo(startsWith(RelayTestProperties.WEATHER_URL)))
                .andRespond(withSuccess("{\"main\":{\"humidity\":60}}", MediaType.APPLICATION_JSON));

        assertThat(client.fetchReading()).isEmpty();
        server.verify();
    }

    @Test
    void unparseableBodyFailsWithoutRetry() {
        server.expect(ExpectedCount.once(), requestTo(startsWith(RelayTestProperties.WEATHER_URL)))
                .andRespond(withSuccess("not json", MediaType.APPLICATION_JSON));

        assertThat(client.fetchReading()).isEmpty();
        server.verify();
    }

    @Test
    void serverErrorsAreRetriedThreeTimesThenFail() {
        server.expect(ExpectedCount.times(3), requestTo(startsWith(RelayTestProperties.WEATHER_URL)))
                .andRespond(withServerError());

        assertThat(client.fetchReading()).isEmpty();
        server.verify();
    }

    @Test
    void rejectedKeyIsRetriedLikeAnyNon2xx() {
        server.expect(ExpectedCount.times(3), requestTo(startsWith(RelayTestProperties.WEATHER_URL)))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThat(client.fetchReading()).isEmpty();
        server.verify();
    }

    @Test
    void notFoundIsRetriedLikeAnyNon2xx() {
        server.expect(ExpectedCount.times(3), requestTo(startsWith(RelayTestProperties.WEATHER_URL)))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.fetchReading()).isEmpty();
        server.verify();
    }

    @Test
    void recoversAfterTransportError() {
        server.expect(ExpectedCount.once(), requestTo(startsWith(RelayTestProperties.WEATHER_URL)))
                .andRespond(request -> {
                    throw new IOException("connection reset");
                });
        server.expect(ExpectedCount.once(), requestTo(startsWith(RelayTestProperties.WEATHER_URL)))
                .andRespond(withSuccess(ATHENS, MediaType.APPLICATION_JSON));

        assertThat(client.fetchReading()).map(WeatherReading::getTemperature).contains(21.5);
        server.verify();
    }
}
