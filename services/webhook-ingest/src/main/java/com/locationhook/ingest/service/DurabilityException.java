package com.locationhook.ingest.service;

/**
 * The durability log could not persist or read an entry. Fatal for the request; the webhook
 * sender is expected to retry.
 */
public class DurabilityException extends RuntimeException {

    public DurabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
