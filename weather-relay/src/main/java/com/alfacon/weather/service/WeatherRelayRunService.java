package com.alfacon.weather.service;

import com.alfacon.weather.config.RelayConfigValidator;
import com.alfacon.weather.config.RelayConfigurationException;
import com.alfacon.weather.config.WeatherRelayProperties;
import com.alfacon.weather.model.DeviceRange;
import com.alfacon.weather.model.DispatchTally;
import com.alfacon.weather.model.RunState;
import com.alfacon.weather.model.RunSummary;
import com.alfacon.weather.model.WeatherReading;
import com.alfacon.weather.output.RunReportRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.UUID;

/**
 * Orchestrates one relay cycle:
 *
 *   validate config -> discover devices -> fetch weather -> dispatch -> summarize
 *
 * Any phase may end the run early as ABORTED (bad config, nothing reachable, no reading).
 * Otherwise the run is PASSED when delivered / reachable reaches the configured threshold,
 * FAILED when it does not. Per-device failures never abort; they only lower the ratio.
 *
 * runOnce() never throws. Every run, aborted or not, is handed to the report router.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WeatherRelayRunService {

    private final WeatherRelayProperties properties;
    private final RelayConfigValidator configValidator;
    private final DeviceDiscoveryService discoveryService;
    private final WeatherSource weatherSource;
    private final DeviceDispatchService dispatchService;
    private final RunReportRouter reportRouter;

    /** Phase of the run in flight, or the terminal state of the last one. Observability only. */
    private volatile RunState currentState = RunState.IDLE;

    public RunSummary runOnce() {
        RunSummary.RunSummaryBuilder summary = RunSummary.builder()
                .runId(UUID.randomUUID().toString())
                .startedAt(Instant.now())
                .threshold(properties.getRun().getSuccessThreshold());

        log.info("=".repeat(60));
        log.info("Weather relay run started");

        RunSummary result;
        try {
            result = execute(summary);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = abort(summary, "interrupted");
        } catch (RuntimeException e) {
            log.error("Unexpected error during run: {}", e.getMessage(), e);
            result = abort(summary, "unexpected error: " + e.getMessage());
        }

        currentState = result.getOutcome();
        logSummary(result);
        reportRouter.publish(result);
        return result;
    }

    public RunState getCurrentState() {
        return currentState;
    }

    /**
     * delivered / reachable, or 0 when nothing was reachable.
     */
    public static double successRatio(int delivered, int reachable) {
        return reachable == 0 ? 0.0 : (double) delivered / reachable;
    }

    public static RunState classify(double successRatio, double threshold) {
        return successRatio >= threshold ? RunState.PASSED : RunState.FAILED;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RunSummary execute(RunSummary.RunSummaryBuilder summary) throws InterruptedException {
        enter(RunState.VALIDATING_CONFIG);
        try {
            configValidator.validate(properties);
        } catch (RelayConfigurationException e) {
            return abort(summary, e.getMessage());
        }

        WeatherRelayProperties.Devices devices = properties.getDevices();
        DeviceRange range = new DeviceRange(devices.getPrefix(), devices.getStart(), devices.getEnd());
        summary.searched(range.size());

        enter(RunState.DISCOVERING);
        log.info("Server: {}, user: {}, devices: {} ({})",
                properties.getPlatform().getBaseUrl(), properties.getPlatform().getUsername(), range, range.size());
        SortedSet<String> reachable = discoveryService.discover(range.identifiers());
        List<String> reachableList = new ArrayList<>(reachable);
        summary.reachable(reachable.size()).reachableDevices(List.copyOf(reachableList));
        if (reachable.isEmpty()) {
            return abort(summary, "no reachable devices in " + range);
        }

        enter(RunState.FETCHING_WEATHER);
        Optional<WeatherReading> reading = weatherSource.fetchReading();
        if (reading.isEmpty()) {
            return abort(summary, "weather fetch failed");
        }
        summary.reading(reading.get());

        enter(RunState.DISPATCHING);
        DispatchTally tally = dispatchService.dispatch(reachableList, reading.get().getTemperature());

        enter(RunState.SUMMARIZING);
        double ratio = successRatio(tally.delivered(), reachable.size());
        RunState outcome = classify(ratio, properties.getRun().getSuccessThreshold());

        return complete(summary
                .delivered(tally.delivered())
                .failed(tally.failed())
                .notFound(tally.notFound())
                .successRatio(ratio)
                .outcome(outcome));
    }

    private RunSummary abort(RunSummary.RunSummaryBuilder summary, String reason) {
        log.error("Run aborted: {}", reason);
        return complete(summary.outcome(RunState.ABORTED).abortReason(reason));
    }

    private RunSummary complete(RunSummary.RunSummaryBuilder summary) {
        RunSummary draft = summary.build();
        Instant completedAt = Instant.now();
        return summary
                .completedAt(completedAt)
                .executionDuration(Duration.between(draft.getStartedAt(), completedAt))
                .build();
    }

    private void enter(RunState state) {
        log.debug("Run state {} -> {}", currentState, state);
        currentState = state;
    }

    private void logSummary(RunSummary s) {
        log.info("=".repeat(60));
        log.info("RUN SUMMARY ({})", s.getOutcome());
        if (s.getReading() != null) {
            log.info("Weather: {}°C, {}% humidity, {}",
                    s.getReading().getTemperature(), s.getReading().getHumidity(), s.getReading().getDescription());
        }
        log.info("Devices searched: {}, reachable: {}", s.getSearched(), s.getReachable());
        log.info("Delivered: {}, failed: {}, not found: {}", s.getDelivered(), s.getFailed(), s.getNotFound());
        log.info("Success rate: {}% (threshold {}%)",
                String.format("%.1f", s.getSuccessRatio() * 100), String.format("%.1f", s.getThreshold() * 100));
        if (s.getAbortReason() != null) {
            log.info("Abort reason: {}", s.getAbortReason());
        }
        log.info("Execution time: {} ms", s.getExecutionDuration().toMillis());
        log.info("=".repeat(60));
    }
}
