package com.alfacon.weather.model;

/**
 * Delivery counters for one batch, or for a whole dispatch once batches are merged.
 */
public record DispatchTally(int delivered, int failed, int notFound) {

    public static final DispatchTally EMPTY = new DispatchTally(0, 0, 0);

    public static DispatchTally allFailed(int devices) {
        return new DispatchTally(0, devices, 0);
    }

    public DispatchTally plus(DispatchTally other) {
        return new DispatchTally(
                delivered + other.delivered,
                failed + other.failed,
                notFound + other.notFound);
    }

    public DispatchTally record(DeliveryOutcome outcome) {
        return switch (outcome) {
            case DELIVERED -> new DispatchTally(delivered + 1, failed, notFound);
            case FAILED -> new DispatchTally(delivered, failed + 1, notFound);
            case NOT_FOUND -> new DispatchTally(delivered, failed, notFound + 1);
        };
    }

    public int total() {
        return delivered + failed + notFound;
    }
}
