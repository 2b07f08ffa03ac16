package com.locationhook.ingest.normalizer;

/**
 * Why a webhook payload could not be normalized. Caller-data problem, never retryable.
 *
 * @param reason  machine-readable category
 * @param field   dotted path of the offending field, {@code null} for whole-payload problems
 * @param message human-readable detail returned to the webhook sender
 */
public record ValidationError(Reason reason, String field, String message) {

    public enum Reason {
        MISSING_FIELD,
        OUT_OF_RANGE,
        BAD_TIMESTAMP,
        TYPE_MISMATCH,
        INCONSISTENT_USER,
        MALFORMED_JSON
    }

    public static ValidationError malformed(String message) {
        return new ValidationError(Reason.MALFORMED_JSON, null, message);
    }
}
