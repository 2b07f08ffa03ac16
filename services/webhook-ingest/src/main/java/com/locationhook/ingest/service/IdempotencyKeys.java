package com.locationhook.ingest.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.f4b6a3.uuid.UuidCreator;
import com.locationhook.ingest.model.RawEvent;

import lombok.RequiredArgsConstructor;

/**
 * Derives the idempotency key of a webhook.
 *
 * <p>Payloads carrying a source event id ({@code id}, or {@code user.event_id}) are keyed by
 * that id, so provider retries of the same event collapse even if the body changed. Anything
 * else is keyed by its compact JSON form, so byte-identical and whitespace-only variants
 * collapse. Keys are name-based (SHA-1) UUIDs.
 */
@Component
@RequiredArgsConstructor
public class IdempotencyKeys {

    private static final UUID NAMESPACE = UUID.fromString("5b0e7a4c-2f3d-4c61-9a8e-6d1f0b2c3e4a");

    private final ObjectMapper objectMapper;

    public String derive(RawEvent raw) {
        byte[] payload = raw.payload();
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (IOException e) {
            // Unparseable bodies never reach the log; keep the key total anyway
            return UuidCreator.getNameBasedSha1(NAMESPACE, payload).toString();
        }

        String sourceEventId = sourceEventId(root);
        if (sourceEventId != null) {
            return UuidCreator.getNameBasedSha1(NAMESPACE, "event:" + sourceEventId).toString();
        }
        String canonical = root == null ? "" : root.toString();
        return UuidCreator.getNameBasedSha1(NAMESPACE, canonical.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static String sourceEventId(JsonNode root) {
        if (root == null || !root.isObject()) {
            return null;
        }
        String id = idValue(root.get("id"));
        return id != null ? id : idValue(root.path("user").get("event_id"));
    }

    private static String idValue(JsonNode node) {
        if (node == null || !(node.isTextual() || node.isIntegralNumber())) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
