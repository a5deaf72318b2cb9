package com.alfacon.weather.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Final record of one relay run. Built once when the run reaches a terminal state.
 */
@Value
@Builder
public class RunSummary {

    String runId;
    Instant startedAt;
    Instant completedAt;
    Duration executionDuration;

    RunState outcome;           // PASSED | FAILED | ABORTED
    String abortReason;         // null unless ABORTED

    /** Size of the candidate identifier space. */
    int searched;
    int reachable;
    int delivered;
    int failed;
    int notFound;

    /** delivered / reachable; 0 when nothing was reachable. */
    double successRatio;
    double threshold;

    WeatherReading reading;     // null if the run aborted before the fetch succeeded

    @Builder.Default
    List<String> reachableDevices = List.of();

    public boolean isPassed() {
        return outcome == RunState.PASSED;
    }
}
