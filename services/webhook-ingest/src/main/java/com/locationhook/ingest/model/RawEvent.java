package com.locationhook.ingest.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Webhook body exactly as it arrived, with the time it was received.
 */
public record RawEvent(byte[] payload, Instant receivedAt) {

    public RawEvent {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(receivedAt, "receivedAt");
        payload = payload.clone();
    }

    public static RawEvent received(byte[] payload) {
        return new RawEvent(payload, Instant.now());
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }
}
