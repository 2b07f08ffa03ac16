package com.locationhook.ingest.model;

import java.time.Instant;

import com.locationhook.common.model.NormalizedRecord;

/**
 * Reference to an entry in the durability log.
 *
 * @param idempotencyKey key the entry is stored under
 * @param receivedAt     receipt time of the first delivery of this event
 * @param created        {@code true} when this append wrote the entry, {@code false} for a replay
 * @param record         the normalized record
 * @param rawPayload     the original webhook body
 */
public record LogHandle(
        String idempotencyKey,
        Instant receivedAt,
        boolean created,
        NormalizedRecord record,
        byte[] rawPayload) {
}
