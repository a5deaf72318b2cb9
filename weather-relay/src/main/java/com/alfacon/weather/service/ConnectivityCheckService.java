package com.alfacon.weather.service;

import com.alfacon.weather.config.RelayConfigValidator;
import com.alfacon.weather.config.WeatherRelayProperties;
import com.alfacon.weather.model.ConnectivityReport;
import com.alfacon.weather.model.DeviceRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Pre-flight check of both upstreams: is the token accepted, do the first few devices exist,
 * and does the weather provider answer. Purely informational; runs decide for themselves.
 *
 * Invalid configuration fails the check with {@link com.alfacon.weather.config.RelayConfigurationException}
 * before either upstream is contacted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConnectivityCheckService {

    static final int SAMPLE_SIZE = 10;

    private final ThingerDeviceClient deviceClient;
    private final WeatherSource weatherSource;
    private final WeatherRelayProperties properties;
    private final RelayConfigValidator configValidator;

    public ConnectivityReport check() {
        configValidator.validate(properties);

        WeatherRelayProperties.Devices devices = properties.getDevices();
        List<String> candidates = new DeviceRange(devices.getPrefix(), devices.getStart(), devices.getEnd()).identifiers();
        String probeDevice = candidates.get(0);

        log.info("Testing platform access on {}...", probeDevice);
        int status = deviceClient.probeStatus(probeDevice);
        boolean authenticated = status > 0
                && status != HttpStatus.UNAUTHORIZED.value()
                && status != HttpStatus.FORBIDDEN.value();

        if (status < 0) {
            log.error("Platform unreachable at {}", properties.getPlatform().getBaseUrl());
        } else if (status == HttpStatus.OK.value()) {
            log.info("Can access {} on {}", properties.getPlatform().getResource(), probeDevice);
        } else if (status == HttpStatus.NOT_FOUND.value()) {
            log.warn("Device {} or its {} resource not found", probeDevice, properties.getPlatform().getResource());
        } else if (!authenticated) {
            log.error("Platform rejected the token (HTTP {})", status);
        } else {
            log.warn("Platform probe returned HTTP {}", status);
        }

        int sampleSize = Math.min(SAMPLE_SIZE, candidates.size());
        int sampleReachable = 0;
        for (String id : candidates.subList(0, sampleSize)) {
            if (deviceClient.probe(id)) {
                sampleReachable++;
            }
        }
        if (sampleReachable == 0) {
            log.warn("No devices found in first {} checked; runs will abort until devices are created", sampleSize);
        } else {
            log.info("Found {}/{} devices in sample check", sampleReachable, sampleSize);
        }

        boolean weatherAvailable = weatherSource.fetchReading().isPresent();
        if (!weatherAvailable) {
            log.error("Weather API check failed");
        }

        return new ConnectivityReport(probeDevice, status, authenticated, sampleSize, sampleReachable, weatherAvailable);
    }
}
