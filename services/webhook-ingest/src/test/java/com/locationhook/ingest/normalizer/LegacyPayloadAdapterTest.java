package com.locationhook.ingest.normalizer;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

class LegacyPayloadAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final LegacyPayloadAdapter adapter = new LegacyPayloadAdapter();

    private ObjectNode parse(String json) throws Exception {
        return (ObjectNode) objectMapper.readTree(json);
    }

    @Test
    void canonicalPayloadPassesThroughUntouched() throws Exception {
        ObjectNode canonical = parse("{\"location\":{\"user_id\":\"u-1\",\"latitude\":1}}");

        assertThat(adapter.isLegacy(canonical)).isFalse();
        assertThat(adapter.adapt(canonical)).isSameAs(canonical);
    }

    @Test
    void providerPayloadWithoutIdGetsNoUserBlock() throws Exception {
        ObjectNode adapted = adapter.adapt(parse("""
                {"MMUserId": "u-3", "type": "user.updated_location",
                 "location": {"coordinates": {"latitude": "12.5", "longitude": "8"}}}
                """));

        assertThat(adapted.path("location").path("user_id").asText()).isEqualTo("u-3");
        assertThat(adapted.path("location").path("latitude").asText()).isEqualTo("12.5");
        assertThat(adapted.path("location").path("event_type").asText()).isEqualTo("user.updated_location");
        assertThat(adapted.has("user")).isFalse();
        assertThat(adapted.has("trip")).isFalse();
    }
}
