package com.alfacon.weather.output;

import com.alfacon.weather.config.WeatherRelayProperties;
import com.alfacon.weather.model.RunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Hands every finished run to the diagnostic sinks.
 * A sink failure is logged and dropped; it never changes how the run was classified.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunReportRouter {

    private final LatestRunHolder latestRunHolder;
    private final List<RunReportSink> sinks;
    private final WeatherRelayProperties properties;

    public void publish(RunSummary summary) {
        latestRunHolder.update(summary);

        if (!properties.getOutput().isEnabled()) {
            return;
        }
        for (RunReportSink sink : sinks) {
            try {
                sink.write(summary);
            } catch (Exception e) {
                log.warn("{} failed for run {}: {}", sink.getClass().getSimpleName(), summary.getRunId(), e.getMessage());
            }
        }
    }
}
