package com.alfacon.weather.service;

/**
 * The remote call returned normally but with a status the relay does not treat as success
 * (e.g. a 3xx the client did not follow). Retryable.
 */
public class UnexpectedStatusException extends RuntimeException {

    private final int status;

    public UnexpectedStatusException(int status, String target) {
        super("Unexpected HTTP " + status + " from " + target);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
