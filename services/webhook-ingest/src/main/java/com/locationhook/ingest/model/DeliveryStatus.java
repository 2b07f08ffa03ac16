package com.locationhook.ingest.model;

/**
 * Outcome of delivering one logged record to one sink.
 *
 * @param state    lifecycle state
 * @param reason   last error for {@link State#FAILED}, otherwise {@code null}
 * @param attempts attempts made so far
 */
public record DeliveryStatus(State state, String reason, int attempts) {

    public enum State {
        PENDING,
        DELIVERED,
        FAILED
    }

    public static DeliveryStatus pending() {
        return new DeliveryStatus(State.PENDING, null, 0);
    }

    public static DeliveryStatus delivered(int attempts) {
        return new DeliveryStatus(State.DELIVERED, null, attempts);
    }

    public static DeliveryStatus failed(String reason, int attempts) {
        return new DeliveryStatus(State.FAILED, reason, attempts);
    }

    public boolean isDelivered() {
        return state == State.DELIVERED;
    }
}
