package com.alfacon.weather.service;

import com.alfacon.weather.config.WeatherRelayProperties;
import com.alfacon.weather.model.DeliveryOutcome;
import com.alfacon.weather.model.OutTempPayload;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

/**
 * Client for the device resource API of a Thinger.io server.
 *
 * Both operations hit {server}/v1/users/{username}/devices/{deviceId}/{resource}:
 * GET to test that the device exists, POST {"exterror":0,"webout":value} to write.
 *
 * Probes are expected to miss most of the time (unassigned ids), so misses log at DEBUG.
 * Pushes retry everything except a 404.
 */
@Service
@Slf4j
public class ThingerDeviceClient implements DeviceProbe, DevicePush {

    private final RestTemplate probeRestTemplate;
    private final RestTemplate pushRestTemplate;
    private final WeatherRelayProperties.Platform platform;
    private final Retry probeRetry;
    private final Retry pushRetry;

    public ThingerDeviceClient(@Qualifier("probeRestTemplate") RestTemplate probeRestTemplate,
                               @Qualifier("pushRestTemplate") RestTemplate pushRestTemplate,
                               WeatherRelayProperties properties) {
        this.probeRestTemplate = probeRestTemplate;
        this.pushRestTemplate = pushRestTemplate;
        this.platform = properties.getPlatform();
        this.probeRetry = RetryPolicies.deviceProbe(properties.getDiscovery().getRetry());
        this.pushRetry = RetryPolicies.devicePush(properties.getDispatch().getRetry());
    }

    @Override
    public boolean probe(String deviceId) {
        return probeStatus(deviceId) == HttpStatus.OK.value();
    }

    /**
     * Raw status of the existence check, or -1 when the platform could not be reached.
     * Used by the connectivity check to tell "unknown device" from "bad token".
     */
    public int probeStatus(String deviceId) {
        try {
            ResponseEntity<String> response = probeRetry.executeSupplier(() -> probeRestTemplate.exchange(
                    resourceUri(deviceId), HttpMethod.GET, new HttpEntity<>(authHeaders()), String.class));
            int status = response.getStatusCode().value();
            if (status != HttpStatus.OK.value()) {
                log.debug("Device {} not reachable: HTTP {}", deviceId, status);
            }
            return status;

        } catch (RestClientResponseException e) {
            log.debug("Device {} not reachable: HTTP {}", deviceId, e.getStatusCode().value());
            return e.getStatusCode().value();

        } catch (Exception e) {
            log.debug("Device {} not reachable: {}", deviceId, RetryPolicies.describe(e));
            return -1;
        }
    }

    @Override
    public DeliveryOutcome push(String deviceId, double value) {
        try {
            pushRetry.executeSupplier(() -> pushOnce(deviceId, value));
            log.info("Device {}: {} sent", deviceId, value);
            return DeliveryOutcome.DELIVERED;

        } catch (HttpClientErrorException.NotFound e) {
            log.warn("Device {}: device or {} resource not found", deviceId, platform.getResource());
            return DeliveryOutcome.NOT_FOUND;

        } catch (Exception e) {
            log.warn("Device {}: delivery failed ({})", deviceId, RetryPolicies.describe(e));
            return DeliveryOutcome.FAILED;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Void pushOnce(String deviceId, double value) {
        HttpHeaders headers = authHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        URI uri = resourceUri(deviceId);
        ResponseEntity<String> response = pushRestTemplate.exchange(
                uri, HttpMethod.POST, new HttpEntity<>(OutTempPayload.of(value), headers), String.class);

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new UnexpectedStatusException(response.getStatusCode().value(), deviceId);
        }
        return null;
    }

    URI resourceUri(String deviceId) {
        return UriComponentsBuilder
                .fromHttpUrl(platform.getBaseUrl())
                .pathSegment("v1", "users", platform.getUsername(), "devices", deviceId, platform.getResource())
                .build()
                .encode()
                .toUri();
    }

    private HttpHeaders authHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(platform.getToken());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }
}
