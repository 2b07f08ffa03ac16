package com.locationhook.ingest.normalizer;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * How a loosely-typed JSON value is turned into a Java value.
 * Webhook providers send numbers, booleans and timestamps as strings often enough that
 * every field goes through one of these instead of Jackson's strict accessors.
 *
 * <p>{@link #apply} returns {@code null} for absent, JSON {@code null} and blank-string values.
 */
public final class FieldCoercion<T> {

    private static final Pattern NUMERIC = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    // Epoch values at or above this magnitude are milliseconds (year 5138 in seconds)
    private static final BigDecimal EPOCH_MILLIS_THRESHOLD = new BigDecimal("100000000000");

    // Range of a PostgreSQL TIMESTAMPTZ column
    static final Instant EARLIEST_STORABLE = LocalDateTime.of(-4713, 11, 24, 0, 0).toInstant(ZoneOffset.UTC);
    static final Instant LATEST_STORABLE = LocalDateTime.of(294276, 12, 31, 23, 59, 59).toInstant(ZoneOffset.UTC);

    public static final FieldCoercion<String> TEXT = new FieldCoercion<>("text", FieldCoercion::toText);
    public static final FieldCoercion<Double> DECIMAL = new FieldCoercion<>("number", FieldCoercion::toDecimal);
    public static final FieldCoercion<Instant> INSTANT = new FieldCoercion<>("timestamp", FieldCoercion::toInstant);
    public static final FieldCoercion<Boolean> FLAG = new FieldCoercion<>("boolean", FieldCoercion::toFlag);

    @FunctionalInterface
    private interface Coercer<T> {
        T coerce(JsonNode node, String field) throws InvalidFieldException;
    }

    private final String description;
    private final Coercer<T> coercer;

    private FieldCoercion(String description, Coercer<T> coercer) {
        this.description = description;
        this.coercer = coercer;
    }

    T apply(JsonNode node, String field) throws InvalidFieldException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual() && node.asText().isBlank()) {
            return null;
        }
        return coercer.coerce(node, field);
    }

    @Override
    public String toString() {
        return description;
    }

    private static String toText(JsonNode node, String field) throws InvalidFieldException {
        if (node.isTextual()) {
            String text = node.asText();
            if (text.indexOf('\0') >= 0) {
                throw InvalidFieldException.typeMismatch(field, "text without NUL characters");
            }
            return text.trim();
        }
        if (node.isNumber()) {
            return node.asText();
        }
        throw InvalidFieldException.typeMismatch(field, "text");
    }

    private static Double toDecimal(JsonNode node, String field) throws InvalidFieldException {
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual() && NUMERIC.matcher(node.asText().trim()).matches()) {
            value = Double.parseDouble(node.asText().trim());
        } else {
            throw InvalidFieldException.typeMismatch(field, "number");
        }
        if (!Double.isFinite(value)) {
            throw InvalidFieldException.typeMismatch(field, "finite number");
        }
        return value;
    }

    private static Instant toInstant(JsonNode node, String field) throws InvalidFieldException {
        Instant instant = parseInstant(node, field);
        if (instant.isBefore(EARLIEST_STORABLE) || instant.isAfter(LATEST_STORABLE)) {
            throw InvalidFieldException.badTimestamp(field, node.asText());
        }
        return instant;
    }

    private static Instant parseInstant(JsonNode node, String field) throws InvalidFieldException {
        if (node.isNumber()) {
            return fromEpoch(node.decimalValue(), field, node.asText());
        }
        if (!node.isTextual()) {
            throw InvalidFieldException.typeMismatch(field, "timestamp");
        }
        String text = node.asText().trim();
        if (NUMERIC.matcher(text).matches()) {
            return fromEpoch(new BigDecimal(text), field, text);
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException withOffset) {
            try {
                // No offset given: providers send UTC
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException withoutOffset) {
                throw InvalidFieldException.badTimestamp(field, text);
            }
        }
    }

    private static Instant fromEpoch(BigDecimal value, String field, String text) throws InvalidFieldException {
        try {
            if (value.abs().compareTo(EPOCH_MILLIS_THRESHOLD) >= 0) {
                return Instant.ofEpochMilli(value.setScale(0, RoundingMode.HALF_UP).longValueExact());
            }
            long seconds = value.setScale(0, RoundingMode.FLOOR).longValueExact();
            long nanos = value.subtract(BigDecimal.valueOf(seconds)).movePointRight(9).longValue();
            return Instant.ofEpochSecond(seconds, nanos);
        } catch (ArithmeticException | DateTimeException e) {
            throw InvalidFieldException.badTimestamp(field, text);
        }
    }

    private static Boolean toFlag(JsonNode node, String field) throws InvalidFieldException {
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        String text = node.isIntegralNumber() ? node.asText() : node.isTextual() ? node.asText().trim() : null;
        if (text != null) {
            switch (text.toLowerCase(Locale.ROOT)) {
                case "true", "1":
                    return Boolean.TRUE;
                case "false", "0":
                    return Boolean.FALSE;
                default:
                    break;
            }
        }
        throw InvalidFieldException.typeMismatch(field, "boolean");
    }
}
