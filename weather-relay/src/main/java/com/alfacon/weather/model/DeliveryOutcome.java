package com.alfacon.weather.model;

/**
 * Result of pushing a value to one device.
 */
public enum DeliveryOutcome {
    DELIVERED,
    /** Retries exhausted on transient errors. */
    FAILED,
    /** Platform answered 404: device or resource does not exist. Never retried. */
    NOT_FOUND
}
