package com.locationhook.ingest.sink;

/**
 * A sink did not accept a delivery. Retryable; never reaches the webhook sender.
 */
public class SinkDeliveryException extends Exception {

    public SinkDeliveryException(String message) {
        super(message);
    }

    public SinkDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
