package com.locationhook.ingest.model;

import java.io.Serializable;
import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for location_snapshots table, the lookup store.
 * Keyed by user and event time so a redelivered event overwrites its own row.
 */
@Entity
@Table(name = "location_snapshots")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LocationSnapshot {

    @EmbeddedId
    private Key key;

    @Column(name = "trip_id", length = 100)
    private String tripId;

    @Column(name = "latitude", nullable = false)
    private double latitude;

    @Column(name = "longitude", nullable = false)
    private double longitude;

    @Column(name = "event_type", length = 30, nullable = false)
    private String eventType;

    @Column(name = "idempotency_key", length = 64, nullable = false)
    private String idempotencyKey;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }

    @Embeddable
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {

        @Column(name = "user_id", length = 100, nullable = false)
        private String userId;

        @Column(name = "event_timestamp", nullable = false)
        private Instant eventTimestamp;
    }
}
