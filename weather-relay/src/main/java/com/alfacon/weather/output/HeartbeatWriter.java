package com.alfacon.weather.output;

import com.alfacon.weather.config.WeatherRelayProperties;
import com.alfacon.weather.model.RunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Overwrites a one-line marker after each run so an external monitor can tell the
 * service is alive: "{completedAt} {outcome} {runId}".
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HeartbeatWriter implements RunReportSink {

    private final WeatherRelayProperties properties;

    @Override
    public void write(RunSummary summary) throws IOException {
        Path dir = Paths.get(properties.getOutput().getDir());
        Files.createDirectories(dir);

        Path target = dir.resolve(properties.getOutput().getHeartbeatFile());
        String line = summary.getCompletedAt() + " " + summary.getOutcome() + " " + summary.getRunId() + System.lineSeparator();
        Files.writeString(target, line, StandardCharsets.UTF_8);

        log.debug("Heartbeat written to {}", target);
    }
}
