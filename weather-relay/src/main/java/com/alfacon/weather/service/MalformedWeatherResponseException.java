package com.alfacon.weather.service;

/**
 * Weather payload arrived but lacks a required field. Not retried.
 */
public class MalformedWeatherResponseException extends RuntimeException {

    public MalformedWeatherResponseException(String message) {
        super(message);
    }
}
