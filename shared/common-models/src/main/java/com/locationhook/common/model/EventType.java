package com.locationhook.common.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of activity a location webhook reports.
 * Serialized with its wire name ({@code location_update}, {@code geofence_enter}, ...).
 */
public enum EventType {
    LOCATION_UPDATE("location_update"),
    GEOFENCE_ENTER("geofence_enter"),
    GEOFENCE_EXIT("geofence_exit"),
    TRIP_STARTED("trip_started"),
    TRIP_UPDATED("trip_updated"),
    TRIP_STOPPED("trip_stopped");

    // Names used by the location provider's own webhook format
    private static final Map<String, EventType> PROVIDER_ALIASES = Map.of(
            "user.updated_location", LOCATION_UPDATE,
            "user.entered_geofence", GEOFENCE_ENTER,
            "user.exited_geofence", GEOFENCE_EXIT,
            "user.started_trip", TRIP_STARTED,
            "user.updated_trip", TRIP_UPDATED,
            "user.stopped_trip", TRIP_STOPPED);

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isGeofence() {
        return this == GEOFENCE_ENTER || this == GEOFENCE_EXIT;
    }

    /**
     * Resolves a wire name or provider alias, ignoring case and surrounding whitespace.
     */
    public static Optional<EventType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EventType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.ofNullable(PROVIDER_ALIASES.get(normalized));
    }

    @JsonCreator
    static EventType fromJson(String value) {
        return fromWire(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + value));
    }
}
