package com.locationhook.common.model;

import java.time.Instant;

/**
 * Trip metadata attached to a location event. Timestamps may be {@code null} when the
 * provider omits them; {@code updatedAt} is never before {@code createdAt}.
 */
public record TripRecord(
        String tripId,
        String externalId,
        String userId,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        String routeSessionType) {
}
