package com.alfacon.weather.output;

import com.alfacon.weather.config.WeatherRelayProperties;
import com.alfacon.weather.model.RunSummary;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Appends one row per run to a CSV history file.
 *
 * Output path: {dir}/{historyFile}, e.g. ./relay-output/run-history.csv
 * The header is written once, when the file is created.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvRunHistoryWriter implements RunReportSink {

    static final String[] HEADERS = {
            "run_id", "started_at", "completed_at", "duration_ms",
            "outcome", "abort_reason",
            "searched", "reachable", "delivered", "failed", "not_found",
            "success_ratio", "threshold",
            "temperature", "humidity", "description"
    };

    private final WeatherRelayProperties properties;

    @Override
    public void write(RunSummary summary) throws IOException {
        Path dir = Paths.get(properties.getOutput().getDir());
        Files.createDirectories(dir);

        Path target = dir.resolve(properties.getOutput().getHistoryFile());
        boolean newFile = Files.notExists(target);

        try (CSVWriter writer = new CSVWriter(
                new FileWriter(target.toFile(), StandardCharsets.UTF_8, true),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (newFile) {
                writer.writeNext(HEADERS);
            }
            writer.writeNext(toRow(summary));
        }

        log.debug("Run {} appended to {}", summary.getRunId(), target);
    }

    private String[] toRow(RunSummary s) {
        boolean hasReading = s.getReading() != null;
        return new String[]{
                str(s.getRunId()),
                str(s.getStartedAt()),
                str(s.getCompletedAt()),
                s.getExecutionDuration() != null ? String.valueOf(s.getExecutionDuration().toMillis()) : "",
                str(s.getOutcome()),
                str(s.getAbortReason()),
                String.valueOf(s.getSearched()),
                String.valueOf(s.getReachable()),
                String.valueOf(s.getDelivered()),
                String.valueOf(s.getFailed()),
                String.valueOf(s.getNotFound()),
                String.format(Locale.ROOT, "%.3f", s.getSuccessRatio()),
                String.format(Locale.ROOT, "%.3f", s.getThreshold()),
                hasReading ? String.valueOf(s.getReading().getTemperature()) : "",
                hasReading ? String.valueOf(s.getReading().getHumidity()) : "",
                hasReading ? s.getReading().getDescription() : ""
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
