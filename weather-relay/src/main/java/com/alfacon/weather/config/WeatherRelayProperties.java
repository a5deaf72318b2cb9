package com.alfacon.weather.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * All tunables for a relay run, bound once at startup from {@code weather-relay.*}.
 *
 * Secrets (platform token, weather API key) come from environment variables via application.yml
 * and are never logged.
 */
@Component
@ConfigurationProperties(prefix = "weather-relay")
@Data
public class WeatherRelayProperties {

    private Platform platform = new Platform();
    private Devices devices = new Devices();
    private Weather weather = new Weather();
    private Discovery discovery = new Discovery();
    private Dispatch dispatch = new Dispatch();
    private Run run = new Run();
    private Scheduling scheduling = new Scheduling();
    private Output output = new Output();

    @Data
    public static class Platform {
        private String baseUrl = "https://alfacon.aws.thinger.io";
        private String username = "Alfacon";
        private String token;
        /** Device resource that is probed and written, e.g. /devices/CAL251/OutTemp */
        private String resource = "OutTemp";
    }

    @Data
    public static class Devices {
        private String prefix = "CAL";
        private int start = 251;
        private int end = 351;
    }

    @Data
    public static class Weather {
        private String apiUrl = "https://api.openweathermap.org/data/2.5/weather";
        private String apiKey;
        private double latitude = 37.9838;
        private double longitude = 23.7275;
        private String units = "metric";
        private String location = "Athens, GR";
        private Duration timeout = Duration.ofSeconds(30);
        private RetrySettings retry = new RetrySettings(3, 2000);
    }

    @Data
    public static class Discovery {
        private int concurrency = 10;
        private Duration timeout = Duration.ofSeconds(10);
        private RetrySettings retry = new RetrySettings(2, 250);
    }

    @Data
    public static class Dispatch {
        private int batchSize = 8;
        private int concurrency = 3;
        private long interDeviceDelayMs = 100;
        /** Per push call. */
        private Duration timeout = Duration.ofSeconds(15);
        /** Upper bound for the whole dispatch phase; unfinished batches count as failed. */
        private Duration phaseTimeout = Duration.ofMinutes(8);
        private RetrySettings retry = new RetrySettings(3, 1000);
    }

    @Data
    public static class Run {
        /** Delivered / reachable must reach this for a PASSED run (inclusive). */
        private double successThreshold = 0.8;
    }

    @Data
    public static class Scheduling {
        private String cron = "0 */30 * * * *";
        private boolean runOnStartup = false;
        private boolean oneShot = false;
        private boolean connectivityCheckOnStartup = true;
    }

    @Data
    public static class Output {
        private boolean enabled = true;
        private String dir = "./relay-output";
        private String snapshotFile = "last-run.json";
        private String heartbeatFile = "heartbeat.txt";
        private String historyFile = "run-history.csv";
    }

    @Data
    public static class RetrySettings {
        /** Total attempts, first call included. */
        private int maxAttempts;
        /** Delay before retry n is baseDelayMs * n. */
        private long baseDelayMs;

        public RetrySettings() {
        }

        public RetrySettings(int maxAttempts, long baseDelayMs) {
            this.maxAttempts = maxAttempts;
            this.baseDelayMs = baseDelayMs;
        }
    }
}
