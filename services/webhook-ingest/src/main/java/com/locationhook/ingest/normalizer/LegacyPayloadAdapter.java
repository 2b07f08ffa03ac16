package com.locationhook.ingest.normalizer;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Rewrites payloads in the location provider's own webhook format into the canonical shape
 * read by {@link PayloadNormalizer}.
 *
 * <p>Provider format: {@code MMUserId}, {@code id}, {@code created_at}, {@code type} and
 * {@code live} at top level, coordinates under {@code location.coordinates}, and trip fields
 * {@code _id}, {@code externalId}, {@code MMUserId}, {@code createdAt}, {@code updatedAt},
 * {@code startedAt}, {@code metadata.route_session_type}. Values are moved, not converted;
 * coercion stays in the normalizer.
 */
@Component
@Slf4j
public class LegacyPayloadAdapter {

    public boolean isLegacy(ObjectNode payload) {
        return payload.has("MMUserId") || payload.path("location").has("coordinates");
    }

    public ObjectNode adapt(ObjectNode payload) {
        if (!isLegacy(payload)) {
            return payload;
        }
        log.debug("Adapting provider-format payload: id={}", payload.path("id").asText(null));

        ObjectNode canonical = JsonNodeFactory.instance.objectNode();
        copy(payload, "id", canonical, "id");

        JsonNode coordinates = payload.path("location").path("coordinates");
        ObjectNode location = canonical.putObject("location");
        copy(payload, "MMUserId", location, "user_id");
        copy(coordinates, "latitude", location, "latitude");
        copy(coordinates, "longitude", location, "longitude");
        copy(payload, "created_at", location, "timestamp");
        copy(payload, "type", location, "event_type");

        JsonNode trip = payload.get("trip");
        if (trip != null && trip.isObject()) {
            ObjectNode canonicalTrip = canonical.putObject("trip");
            copy(trip, "_id", canonicalTrip, "trip_id");
            copy(trip, "externalId", canonicalTrip, "external_id");
            copy(trip, "MMUserId", canonicalTrip, "user_id");
            copy(trip, "createdAt", canonicalTrip, "created_at");
            copy(trip, "updatedAt", canonicalTrip, "updated_at");
            copy(trip, "startedAt", canonicalTrip, "started_at");
            copy(trip.path("metadata"), "route_session_type", canonicalTrip, "route_session_type");
        } else if (trip != null && !trip.isNull()) {
            // let the normalizer report the type problem
            canonical.set("trip", trip);
        }

        if (payload.has("id")) {
            ObjectNode user = canonical.putObject("user");
            copy(payload, "MMUserId", user, "user_id");
            copy(payload, "id", user, "event_id");
            copy(payload, "created_at", user, "created_at");
            copy(payload, "live", user, "live");
        }
        return canonical;
    }

    private static void copy(JsonNode source, String from, ObjectNode target, String to) {
        JsonNode value = source.get(from);
        if (value != null && !value.isNull()) {
            target.set(to, value);
        }
    }
}
