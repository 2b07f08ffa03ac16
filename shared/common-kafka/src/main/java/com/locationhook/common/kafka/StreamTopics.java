package com.locationhook.common.kafka;

/**
 * Centralized Kafka topic and header names for the location webhook platform.
 */
public final class StreamTopics {

    // Location topics
    public static final String GEOFENCE_EVENTS = "webhook.location.geofence";

    // Record headers
    public static final String IDEMPOTENCY_KEY_HEADER = "idempotency-key";
    public static final String EVENT_TYPE_HEADER = "event-type";

    private StreamTopics() {
        throw new UnsupportedOperationException("Utility class");
    }
}
