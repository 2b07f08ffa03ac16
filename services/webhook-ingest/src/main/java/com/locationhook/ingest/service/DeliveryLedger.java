package com.locationhook.ingest.service;

import java.util.Map;
import java.util.Optional;

import com.locationhook.ingest.model.DeliveryStatus;

/**
 * Per (logged event, sink) delivery status. Updates to one pair are linearizable; the last
 * recorded status wins.
 */
public interface DeliveryLedger {

    Optional<DeliveryStatus> find(String idempotencyKey, String sinkName);

    void record(String idempotencyKey, String sinkName, DeliveryStatus status);

    /** Statuses of every sink for the event, keyed by sink name. */
    Map<String, DeliveryStatus> findAll(String idempotencyKey);
}
