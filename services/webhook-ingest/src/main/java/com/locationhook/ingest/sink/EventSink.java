package com.locationhook.ingest.sink;

import com.locationhook.ingest.model.LogHandle;

/**
 * A downstream store that receives logged webhooks.
 *
 * <p>Enabled sinks are registered as beans at start-up and the dispatcher delivers to each
 * of them independently. Implementations must be thread-safe and should treat a repeated
 * delivery of the same idempotency key as a no-op where the target allows it.
 */
public interface EventSink {

    /** Stable name, used as the ledger key and metric tag. */
    String name();

    /** Whether this sink wants the record at all. Records it declines get no ledger entry. */
    default boolean accepts(LogHandle handle) {
        return true;
    }

    void deliver(LogHandle handle) throws SinkDeliveryException;
}
