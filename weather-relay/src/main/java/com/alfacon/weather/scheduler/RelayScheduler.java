package com.alfacon.weather.scheduler;

import com.alfacon.weather.config.RelayConfigurationException;
import com.alfacon.weather.config.WeatherRelayProperties;
import com.alfacon.weather.model.RunSummary;
import com.alfacon.weather.service.ConnectivityCheckService;
import com.alfacon.weather.service.WeatherRelayRunService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manages scheduled, on-startup and manual relay runs.
 *
 * Default schedule: every 30 minutes (UTC).
 * Override with RELAY_CRON env var or weather-relay.scheduling.cron property.
 *
 * At most one run is in flight; a trigger that arrives during a run is skipped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RelayScheduler {

    private final WeatherRelayRunService runService;
    private final ConnectivityCheckService connectivityCheck;
    private final WeatherRelayProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * On application startup:
     *  1. Optionally log a connectivity check of both upstreams
     *  2. Optionally run one cycle immediately if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        WeatherRelayProperties.Scheduling scheduling = properties.getScheduling();
        if (scheduling.isOneShot()) {
            return;
        }

        if (scheduling.isConnectivityCheckOnStartup()) {
            try {
                connectivityCheck.check();
            } catch (RelayConfigurationException e) {
                log.error("Skipping connectivity check: {}", e.getMessage());
            } catch (Exception e) {
                log.warn("Connectivity check could not complete: {}", e.getMessage());
            }
        }

        if (scheduling.isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, running initial update");
            triggerRun();
        } else {
            log.info("Relay ready. Schedule: {}", scheduling.getCron());
        }
    }

    @Scheduled(cron = "${weather-relay.scheduling.cron:0 */30 * * * *}", zone = "UTC")
    public void scheduledRun() {
        if (properties.getScheduling().isOneShot()) {
            return;
        }
        log.info("Scheduled run triggered");
        triggerRun();
    }

    /**
     * Runs one cycle unless another is in flight.
     *
     * @return the summary, or empty if the trigger was skipped
     */
    public Optional<RunSummary> triggerRun() {
        if (!running.compareAndSet(false, true)) {
            log.warn("A relay run is already in progress, skipping trigger");
            return Optional.empty();
        }
        return runClaimed();
    }

    /**
     * Claims the run slot and starts the cycle on a background thread.
     *
     * @return false if another run already holds the slot
     */
    public boolean triggerInBackground() {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        new Thread(this::runClaimed, "manual-relay-run").start();
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Optional<RunSummary> runClaimed() {
        try {
            return Optional.of(runService.runOnce());
        } catch (Exception e) {
            log.error("Relay run failed: {}", e.getMessage(), e);
            return Optional.empty();
        } finally {
            running.set(false);
        }
    }
}
