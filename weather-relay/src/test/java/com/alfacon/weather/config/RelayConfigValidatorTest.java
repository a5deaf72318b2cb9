package com.alfacon.weather.config;

import com.alfacon.weather.RelayTestProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class RelayConfigValidatorTest {

    private final RelayConfigValidator validator = new RelayConfigValidator();

    @Test
    void acceptsCompleteConfiguration() {
        assertThatCode(() -> validator.validate(RelayTestProperties.create())).doesNotThrowAnyException();
    }

    @Test
    void reportsEveryMissingCredentialAtOnce() {
        WeatherRelayProperties properties = RelayTestProperties.create();
        properties.getPlatform().setToken(null);
        properties.getPlatform().setBaseUrl("");
        properties.getWeather().setApiKey("  ");

        RelayConfigurationException e = catchThrowableOfType(
                () -> validator.validate(properties), RelayConfigurationException.class);

        assertThat(e.getProblems())
                .hasSize(3)
                .anyMatch(p -> p.contains("THINGER_TOKEN"))
                .anyMatch(p -> p.contains("THINGER_SERVER"))
                .anyMatch(p -> p.contains("WEATHER_API_KEY"));
    }

    @Test
    void rejectsInvertedDeviceRange() {
        WeatherRelayProperties properties = RelayTestProperties.create();
        properties.getDevices().setStart(400);

        assertThatThrownBy(() -> validator.validate(properties))
                .hasMessageContaining("devices.start");
    }

    @Test
    void rejectsNonsensicalLimits() {
        WeatherRelayProperties properties = RelayTestProperties.create();
        properties.getDispatch().setBatchSize(0);
        properties.getDiscovery().setConcurrency(0);
        properties.getRun().setSuccessThreshold(1.5);
        properties.getDispatch().setRetry(new WeatherRelayProperties.RetrySettings(0, 0));

        assertThatThrownBy(() -> validator.validate(properties))
                .hasMessageContaining("dispatch.batch-size")
                .hasMessageContaining("discovery.concurrency")
                .hasMessageContaining("run.success-threshold")
                .hasMessageContaining("dispatch.retry.max-attempts")
                .hasMessageContaining("dispatch.retry.base-delay-ms");
    }
}
