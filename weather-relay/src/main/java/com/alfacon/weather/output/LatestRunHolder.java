package com.alfacon.weather.output;

import com.alfacon.weather.model.RunSummary;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the most recent run for the status endpoint.
 */
@Component
public class LatestRunHolder {

    private final AtomicReference<RunSummary> latest = new AtomicReference<>();

    public void update(RunSummary summary) {
        latest.set(summary);
    }

    public Optional<RunSummary> latest() {
        return Optional.ofNullable(latest.get());
    }
}
