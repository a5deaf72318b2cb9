package com.alfacon.weather.config;

import java.util.List;

/**
 * Required settings are missing or out of range. Fatal to the run, raised before any network call.
 */
public class RelayConfigurationException extends RuntimeException {

    private final List<String> problems;

    public RelayConfigurationException(List<String> problems) {
        super("Invalid weather-relay configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
