package com.locationhook.common.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Canonical form of a location webhook.
 * This is what gets logged, handed to every sink and published on the stream.
 *
 * <p>{@code location} is always present; {@code trip} and {@code user} are optional but,
 * when present, refer to the same user as the location.
 */
public record NormalizedRecord(
        LocationRecord location,
        TripRecord trip,
        UserRecord user) {

    public NormalizedRecord {
        Objects.requireNonNull(location, "location");
        if (trip != null && !location.userId().equals(trip.userId())) {
            throw new IllegalArgumentException("Trip user does not match location user");
        }
        if (user != null && !location.userId().equals(user.userId())) {
            throw new IllegalArgumentException("User record does not match location user");
        }
    }

    @JsonIgnore
    public String userId() {
        return location.userId();
    }

    @JsonIgnore
    public EventType eventType() {
        return location.eventType();
    }
}
