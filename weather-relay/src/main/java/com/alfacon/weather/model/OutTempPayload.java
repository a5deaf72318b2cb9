package com.alfacon.weather.model;

/**
 * Body written to the device resource: {"exterror": 0, "webout": 21.5}.
 */
public record OutTempPayload(int exterror, double webout) {

    public static OutTempPayload of(double value) {
        return new OutTempPayload(0, value);
    }
}
