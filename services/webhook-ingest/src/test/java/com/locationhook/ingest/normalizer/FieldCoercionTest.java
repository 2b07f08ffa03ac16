package com.locationhook.ingest.normalizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

class FieldCoercionTest {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Test
    void blankAndNullValuesAreAbsent() throws Exception {
        assertThat(FieldCoercion.TEXT.apply(null, "f")).isNull();
        assertThat(FieldCoercion.TEXT.apply(NODES.nullNode(), "f")).isNull();
        assertThat(FieldCoercion.DECIMAL.apply(NODES.textNode("   "), "f")).isNull();
        assertThat(FieldCoercion.INSTANT.apply(NODES.missingNode(), "f")).isNull();
    }

    @Test
    void epochSecondsKeepFractionAndLargeValuesAreMillis() throws Exception {
        assertThat(FieldCoercion.INSTANT.apply(NODES.numberNode(1714564800.25), "f"))
                .isEqualTo(Instant.ofEpochSecond(1714564800L, 250_000_000L));
        assertThat(FieldCoercion.INSTANT.apply(NODES.textNode("1714564800000"), "f"))
                .isEqualTo(Instant.ofEpochMilli(1714564800000L));
    }

    @Test
    void isoTimestampWithOffsetIsConvertedToUtc() throws Exception {
        assertThat(FieldCoercion.INSTANT.apply(NODES.textNode("2024-05-01T12:00:00+02:00"), "f"))
                .isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    void instantIsBoundedByStorableRange() throws Exception {
        assertThat(FieldCoercion.INSTANT.apply(NODES.textNode("+294276-12-31T23:59:59Z"), "f"))
                .isEqualTo(FieldCoercion.LATEST_STORABLE);
        assertThat(FieldCoercion.INSTANT.apply(NODES.textNode("-4713-11-24T00:00:00Z"), "f"))
                .isEqualTo(FieldCoercion.EARLIEST_STORABLE);

        for (String outside : new String[] {"+294277-01-01T00:00:00Z", "-4713-11-23T23:59:59Z"}) {
            JsonNode node = NODES.textNode(outside);
            assertThatThrownBy(() -> FieldCoercion.INSTANT.apply(node, "location.timestamp"))
                    .as(outside)
                    .isInstanceOf(InvalidFieldException.class)
                    .extracting(e -> ((InvalidFieldException) e).getError().reason())
                    .isEqualTo(ValidationError.Reason.BAD_TIMESTAMP);
        }
        JsonNode farFutureMillis = NODES.numberNode(99999999999999999L);
        assertThatThrownBy(() -> FieldCoercion.INSTANT.apply(farFutureMillis, "location.timestamp"))
                .isInstanceOf(InvalidFieldException.class);
    }

    @Test
    void textRejectsNulCharacters() {
        JsonNode withNul = NODES.textNode("trip\0name");

        assertThatThrownBy(() -> FieldCoercion.TEXT.apply(withNul, "trip.route_session_type"))
                .isInstanceOf(InvalidFieldException.class)
                .extracting(e -> ((InvalidFieldException) e).getError().reason())
                .isEqualTo(ValidationError.Reason.TYPE_MISMATCH);
    }

    @Test
    void flagAcceptsBooleanLikeValuesOnly() throws Exception {
        assertThat(FieldCoercion.FLAG.apply(NODES.booleanNode(true), "f")).isTrue();
        assertThat(FieldCoercion.FLAG.apply(NODES.textNode("TRUE"), "f")).isTrue();
        assertThat(FieldCoercion.FLAG.apply(NODES.numberNode(0), "f")).isFalse();

        JsonNode yes = NODES.textNode("yes");
        assertThatThrownBy(() -> FieldCoercion.FLAG.apply(yes, "user.live"))
                .isInstanceOf(InvalidFieldException.class)
                .extracting(e -> ((InvalidFieldException) e).getError().reason())
                .isEqualTo(ValidationError.Reason.TYPE_MISMATCH);
    }

    @Test
    void textRejectsObjects() {
        JsonNode object = NODES.objectNode().put("nested", 1);

        assertThatThrownBy(() -> FieldCoercion.TEXT.apply(object, "location.user_id"))
                .isInstanceOf(InvalidFieldException.class)
                .hasMessageContaining("location.user_id");
    }

    @Test
    void decimalRejectsNonFiniteValues() {
        JsonNode huge = NODES.textNode("1e400");

        assertThatThrownBy(() -> FieldCoercion.DECIMAL.apply(huge, "location.latitude"))
                .isInstanceOf(InvalidFieldException.class);
    }
}
