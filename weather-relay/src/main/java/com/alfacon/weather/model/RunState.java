package com.alfacon.weather.model;

/**
 * Phases a relay run moves through. PASSED, FAILED and ABORTED are terminal.
 */
public enum RunState {
    IDLE,
    VALIDATING_CONFIG,
    DISCOVERING,
    FETCHING_WEATHER,
    DISPATCHING,
    SUMMARIZING,
    PASSED,
    FAILED,
    ABORTED;

    public boolean isTerminal() {
        return this == PASSED || this == FAILED || this == ABORTED;
    }
}
