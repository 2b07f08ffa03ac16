package com.locationhook.ingest.service;

/**
 * The storage layer refused an entry because of its content rather than because of a
 * concurrent append. Retrying the same payload fails the same way.
 */
public class UnstorableRecordException extends RuntimeException {

    public UnstorableRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
