package com.locationhook.common.model;

import java.time.Instant;

public record UserRecord(
        String userId,
        String eventId,
        Instant createdAt,
        boolean live) {
}
