package com.alfacon.weather.service;

import com.alfacon.weather.model.DeliveryOutcome;

/**
 * Writes one value to one device. Never throws for remote failures; they are
 * reported as {@link DeliveryOutcome#FAILED} or {@link DeliveryOutcome#NOT_FOUND}.
 */
@FunctionalInterface
public interface DevicePush {

    DeliveryOutcome push(String deviceId, double value);
}
