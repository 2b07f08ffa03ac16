package com.locationhook.ingest.normalizer;

import com.locationhook.ingest.normalizer.ValidationError.Reason;

/**
 * Internal short-circuit for the normalizer; converted to a {@link ValidationError} result
 * before leaving {@link PayloadNormalizer}.
 */
class InvalidFieldException extends Exception {

    private final transient ValidationError error;

    private InvalidFieldException(Reason reason, String field, String message) {
        super(field + ": " + message);
        this.error = new ValidationError(reason, field, message);
    }

    ValidationError getError() {
        return error;
    }

    static InvalidFieldException missing(String field) {
        return new InvalidFieldException(Reason.MISSING_FIELD, field, "Field is required");
    }

    static InvalidFieldException typeMismatch(String field, String expected) {
        return new InvalidFieldException(Reason.TYPE_MISMATCH, field, "Expected " + expected);
    }

    static InvalidFieldException outOfRange(String field, String message) {
        return new InvalidFieldException(Reason.OUT_OF_RANGE, field, message);
    }

    static InvalidFieldException badTimestamp(String field, String value) {
        return new InvalidFieldException(Reason.BAD_TIMESTAMP, field, "Unparseable timestamp: " + value);
    }

    static InvalidFieldException inconsistentUser(String field, String expected, String actual) {
        return new InvalidFieldException(Reason.INCONSISTENT_USER, field,
                "User " + actual + " does not match location user " + expected);
    }
}
