package com.alfacon.weather.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Raw DTO for the OpenWeatherMap "current weather" payload.
 * Only the fields the relay reads are mapped; boxed types so absent fields stay null.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OpenWeatherResponse {

    private Main main;
    private List<Condition> weather;

    /** Observation time, unix seconds. */
    private Long dt;

    private String name;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Main {
        private Double temp;
        private Integer humidity;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Condition {
        private String main;
        private String description;
    }
}
