package com.locationhook.ingest.service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.locationhook.common.model.NormalizedRecord;
import com.locationhook.ingest.model.LogHandle;
import com.locationhook.ingest.model.RawEvent;

/**
 * Append-only, idempotent store of accepted webhooks. Owns the canonical copy of every raw
 * payload and its normalized record.
 */
public interface DurabilityLog {

    /**
     * Durably stores the event under its idempotency key. If the key is already present
     * nothing is written and the existing entry is returned with {@code created == false}.
     *
     * @throws DurabilityException if the storage layer fails
     * @throws UnstorableRecordException if the storage layer refuses the record's content
     */
    LogHandle append(RawEvent raw, NormalizedRecord record);

    Optional<LogHandle> lookup(String idempotencyKey);

    /** Records that every sink reached a terminal delivery state for the entry. */
    void markDispatched(String idempotencyKey);

    /** Oldest entries received before {@code receivedBefore} whose dispatch never completed. */
    List<LogHandle> findUndispatched(Instant receivedBefore, int limit);
}
