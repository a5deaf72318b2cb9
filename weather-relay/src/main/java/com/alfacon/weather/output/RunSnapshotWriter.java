package com.alfacon.weather.output;

import com.alfacon.weather.config.WeatherRelayProperties;
import com.alfacon.weather.model.RunSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Writes the latest run (counts, reading, reachable device list) as pretty JSON.
 *
 * Output path: {dir}/{snapshotFile}, e.g. ./relay-output/last-run.json
 * Written to a temp file first and moved into place so readers never see half a file.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunSnapshotWriter implements RunReportSink {

    private final ObjectMapper objectMapper;
    private final WeatherRelayProperties properties;

    @Override
    public void write(RunSummary summary) throws IOException {
        Path dir = Paths.get(properties.getOutput().getDir());
        Files.createDirectories(dir);

        Path target = dir.resolve(properties.getOutput().getSnapshotFile());
        Path tmp = dir.resolve(properties.getOutput().getSnapshotFile() + ".tmp");

        byte[] json = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .writeValueAsBytes(summary);
        Files.write(tmp, json);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);

        log.debug("Run snapshot written to {}", target);
    }
}
