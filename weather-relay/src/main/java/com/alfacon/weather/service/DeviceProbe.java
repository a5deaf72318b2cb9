package com.alfacon.weather.service;

/**
 * Existence check for one device on the control platform.
 * Returns false for anything but an exact 200, including transport errors.
 */
@FunctionalInterface
public interface DeviceProbe {

    boolean probe(String deviceId);
}
