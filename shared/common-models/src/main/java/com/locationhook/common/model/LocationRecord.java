package com.locationhook.common.model;

import java.time.Instant;

/**
 * A single position report for a user.
 *
 * @param userId    owner of the device
 * @param tripId    trip the position belongs to, or {@code null}
 * @param latitude  degrees in [-90, 90]
 * @param longitude degrees in [-180, 180]
 * @param timestamp when the position was observed (UTC)
 * @param eventType what the provider reported
 */
public record LocationRecord(
        String userId,
        String tripId,
        double latitude,
        double longitude,
        Instant timestamp,
        EventType eventType) {
}
