package com.locationhook.ingest.normalizer;

import java.io.IOException;
import java.time.Instant;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.locationhook.common.model.EventType;
import com.locationhook.common.model.LocationRecord;
import com.locationhook.common.model.NormalizedRecord;
import com.locationhook.common.model.TripRecord;
import com.locationhook.common.model.UserRecord;
import com.locationhook.ingest.model.RawEvent;

import lombok.RequiredArgsConstructor;

/**
 * Turns an untrusted webhook body into a {@link NormalizedRecord}.
 * Pure: no I/O, no shared state, bad input is returned as a {@link ValidationError}.
 */
@Component
@RequiredArgsConstructor
public class PayloadNormalizer {

    // Width of the user_id and trip_id columns
    static final int MAX_ID_LENGTH = 100;

    // Coercion table for the canonical inbound shape
    private static final InboundField<String> EVENT_ID = InboundField.of("", "id", FieldCoercion.TEXT);

    private static final InboundField<String> LOCATION_USER_ID = InboundField.of("location", "user_id", FieldCoercion.TEXT);
    private static final InboundField<String> LOCATION_TRIP_ID = InboundField.of("location", "trip_id", FieldCoercion.TEXT);
    private static final InboundField<Double> LATITUDE = InboundField.of("location", "latitude", FieldCoercion.DECIMAL);
    private static final InboundField<Double> LONGITUDE = InboundField.of("location", "longitude", FieldCoercion.DECIMAL);
    private static final InboundField<Instant> LOCATION_TIMESTAMP = InboundField.of("location", "timestamp", FieldCoercion.INSTANT);
    private static final InboundField<String> EVENT_TYPE = InboundField.of("location", "event_type", FieldCoercion.TEXT);

    private static final InboundField<String> TRIP_ID = InboundField.of("trip", "trip_id", FieldCoercion.TEXT);
    private static final InboundField<String> TRIP_EXTERNAL_ID = InboundField.of("trip", "external_id", FieldCoercion.TEXT);
    private static final InboundField<String> TRIP_USER_ID = InboundField.of("trip", "user_id", FieldCoercion.TEXT);
    private static final InboundField<Instant> TRIP_CREATED_AT = InboundField.of("trip", "created_at", FieldCoercion.INSTANT);
    private static final InboundField<Instant> TRIP_UPDATED_AT = InboundField.of("trip", "updated_at", FieldCoercion.INSTANT);
    private static final InboundField<Instant> TRIP_STARTED_AT = InboundField.of("trip", "started_at", FieldCoercion.INSTANT);
    private static final InboundField<String> ROUTE_SESSION_TYPE = InboundField.of("trip", "route_session_type", FieldCoercion.TEXT);

    private static final InboundField<String> USER_ID = InboundField.of("user", "user_id", FieldCoercion.TEXT);
    private static final InboundField<String> USER_EVENT_ID = InboundField.of("user", "event_id", FieldCoercion.TEXT);
    private static final InboundField<Instant> USER_CREATED_AT = InboundField.of("user", "created_at", FieldCoercion.INSTANT);
    private static final InboundField<Boolean> USER_LIVE = InboundField.of("user", "live", FieldCoercion.FLAG);

    private final ObjectMapper objectMapper;
    private final LegacyPayloadAdapter legacyPayloadAdapter;

    public NormalizationResult normalize(RawEvent raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw.payload());
        } catch (JsonProcessingException e) {
            return NormalizationResult.rejected(ValidationError.malformed("Malformed JSON: " + e.getOriginalMessage()));
        } catch (IOException e) {
            return NormalizationResult.rejected(ValidationError.malformed("Unreadable payload: " + e.getMessage()));
        }
        if (root == null || !root.isObject()) {
            return NormalizationResult.rejected(ValidationError.malformed("Payload must be a JSON object"));
        }

        ObjectNode payload = legacyPayloadAdapter.adapt((ObjectNode) root);
        try {
            return NormalizationResult.accepted(toRecord(payload, raw.receivedAt()));
        } catch (InvalidFieldException e) {
            return NormalizationResult.rejected(e.getError());
        }
    }

    private NormalizedRecord toRecord(ObjectNode payload, Instant receivedAt) throws InvalidFieldException {
        JsonNode location = block(payload, "location");
        if (location == null) {
            throw InvalidFieldException.missing("location");
        }

        String userId = boundedId(LOCATION_USER_ID, LOCATION_USER_ID.require(location));
        double latitude = inRange(LATITUDE, LATITUDE.require(location), 90.0);
        double longitude = inRange(LONGITUDE, LONGITUDE.require(location), 180.0);
        Instant timestamp = LOCATION_TIMESTAMP.read(location);
        if (timestamp == null) {
            timestamp = receivedAt;
        }
        String eventTypeName = EVENT_TYPE.require(location);
        EventType eventType = EventType.fromWire(eventTypeName)
                .orElseThrow(() -> InvalidFieldException.typeMismatch(EVENT_TYPE.path(),
                        "known event type, got " + eventTypeName));

        TripRecord trip = readTrip(block(payload, "trip"), userId);
        UserRecord user = readUser(block(payload, "user"), EVENT_ID.read(payload), userId, timestamp);

        String tripId = trip != null ? trip.tripId() : boundedId(LOCATION_TRIP_ID, LOCATION_TRIP_ID.read(location));
        return new NormalizedRecord(
                new LocationRecord(userId, tripId, latitude, longitude, timestamp, eventType),
                trip,
                user);
    }

    private TripRecord readTrip(JsonNode trip, String userId) throws InvalidFieldException {
        if (trip == null) {
            return null;
        }
        Instant createdAt = TRIP_CREATED_AT.read(trip);
        Instant updatedAt = TRIP_UPDATED_AT.read(trip);
        if (createdAt != null && updatedAt != null && updatedAt.isBefore(createdAt)) {
            throw InvalidFieldException.outOfRange(TRIP_UPDATED_AT.path(), "updated_at is before created_at");
        }
        return new TripRecord(
                boundedId(TRIP_ID, TRIP_ID.require(trip)),
                TRIP_EXTERNAL_ID.read(trip),
                sameUser(TRIP_USER_ID, TRIP_USER_ID.read(trip), userId),
                createdAt,
                updatedAt,
                TRIP_STARTED_AT.read(trip),
                ROUTE_SESSION_TYPE.read(trip));
    }

    private UserRecord readUser(JsonNode user, String topLevelEventId, String userId, Instant timestamp)
            throws InvalidFieldException {
        if (user == null) {
            return null;
        }
        String eventId = USER_EVENT_ID.read(user);
        if (eventId == null) {
            eventId = topLevelEventId;
        }
        if (eventId == null) {
            throw InvalidFieldException.missing(USER_EVENT_ID.path());
        }
        Instant createdAt = USER_CREATED_AT.read(user);
        Boolean live = USER_LIVE.read(user);
        return new UserRecord(
                sameUser(USER_ID, USER_ID.read(user), userId),
                eventId,
                createdAt != null ? createdAt : timestamp,
                Boolean.TRUE.equals(live));
    }

    private static String sameUser(InboundField<String> field, String value, String locationUserId)
            throws InvalidFieldException {
        if (value == null) {
            return locationUserId;
        }
        if (!value.equals(locationUserId)) {
            throw InvalidFieldException.inconsistentUser(field.path(), locationUserId, value);
        }
        return value;
    }

    private static String boundedId(InboundField<String> field, String value) throws InvalidFieldException {
        if (value != null && value.length() > MAX_ID_LENGTH) {
            throw InvalidFieldException.outOfRange(field.path(),
                    "Length " + value.length() + " exceeds " + MAX_ID_LENGTH + " characters");
        }
        return value;
    }

    private static double inRange(InboundField<Double> field, double value, double bound)
            throws InvalidFieldException {
        if (value < -bound || value > bound) {
            throw InvalidFieldException.outOfRange(field.path(),
                    "Value " + value + " outside [" + -bound + ", " + bound + "]");
        }
        return value;
    }

    private static JsonNode block(ObjectNode payload, String name) throws InvalidFieldException {
        JsonNode node = payload.get(name);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw InvalidFieldException.typeMismatch(name, "object");
        }
        return node;
    }
}
