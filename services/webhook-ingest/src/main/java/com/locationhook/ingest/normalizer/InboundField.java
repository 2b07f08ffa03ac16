package com.locationhook.ingest.normalizer;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A field of the canonical inbound payload together with the coercion applied to it.
 *
 * @param block    enclosing object ({@code location}, {@code trip}, {@code user}) or empty for top level
 * @param name     JSON property name
 * @param coercion how the raw value is converted
 */
record InboundField<T>(String block, String name, FieldCoercion<T> coercion) {

    static <T> InboundField<T> of(String block, String name, FieldCoercion<T> coercion) {
        return new InboundField<>(block, name, coercion);
    }

    String path() {
        return block.isEmpty() ? name : block + "." + name;
    }

    T read(JsonNode container) throws InvalidFieldException {
        return coercion.apply(container.get(name), path());
    }

    T require(JsonNode container) throws InvalidFieldException {
        T value = read(container);
        if (value == null) {
            throw InvalidFieldException.missing(path());
        }
        return value;
    }
}
