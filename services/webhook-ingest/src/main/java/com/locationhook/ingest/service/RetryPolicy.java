package com.locationhook.ingest.service;

import java.time.Duration;

import com.locationhook.ingest.config.IngestProperties;

/**
 * Bounded exponential backoff for sink deliveries.
 *
 * @param maxAttempts total attempts per sink, including the first
 * @param baseBackoff wait after the first failed attempt
 * @param maxBackoff  cap on any single wait
 * @param callTimeout limit on one sink call
 */
public record RetryPolicy(int maxAttempts, Duration baseBackoff, Duration maxBackoff, Duration callTimeout) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("Backoff must not be negative");
        }
        if (callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be positive");
        }
    }

    public static RetryPolicy from(IngestProperties.Retry retry) {
        return new RetryPolicy(retry.maxAttempts(), retry.baseBackoff(), retry.maxBackoff(), retry.callTimeout());
    }

    /**
     * Wait after failed attempt {@code attempt} (1-based): {@code min(maxBackoff, baseBackoff * 2^(attempt-1))}.
     */
    public Duration backoffAfter(int attempt) {
        long base = baseBackoff.toMillis();
        long cap = maxBackoff.toMillis();
        int doublings = Math.min(Math.max(attempt - 1, 0), 62);
        if (base == 0) {
            return Duration.ZERO;
        }
        if (base > (cap >> doublings)) {
            return Duration.ofMillis(cap);
        }
        return Duration.ofMillis(Math.min(cap, base << doublings));
    }
}
