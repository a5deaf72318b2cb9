package com.alfacon.weather.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of the pre-flight connectivity check.
 *
 * @param probeDevice      device used for the platform check
 * @param platformStatus   HTTP status of the probe, or -1 on a transport error
 * @param authenticated    false when the platform rejected the token (401/403)
 * @param sampleSize       number of leading candidates probed
 * @param sampleReachable  how many of those answered 200
 * @param weatherAvailable whether the weather provider returned a usable reading
 */
public record ConnectivityReport(
        String probeDevice,
        int platformStatus,
        boolean authenticated,
        int sampleSize,
        int sampleReachable,
        boolean weatherAvailable) {

    @JsonProperty("healthy")
    public boolean healthy() {
        return authenticated && weatherAvailable;
    }
}
