package com.locationhook.ingest.model;

import java.time.Instant;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for webhook_events table.
 * One row holds both the raw body and the normalized record, so they are written together.
 */
@Entity
@Table(name = "webhook_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEvent implements Persistable<String> {

    @Id
    @Column(name = "idempotency_key", length = 64, updatable = false, nullable = false)
    private String idempotencyKey;

    @Column(name = "raw_payload", columnDefinition = "bytea", updatable = false, nullable = false)
    private byte[] rawPayload;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "normalized_record", columnDefinition = "jsonb", updatable = false, nullable = false)
    private String normalizedRecord;

    @Column(name = "user_id", length = 100, nullable = false)
    private String userId;

    @Column(name = "event_type", length = 30, nullable = false)
    private String eventType;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "dispatch_completed_at")
    private Instant dispatchCompletedAt;

    // Assigned keys: insert, never merge over an existing row
    @Transient
    @Builder.Default
    private boolean fresh = true;

    @Override
    public String getId() {
        return idempotencyKey;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    @PostLoad
    @PostPersist
    protected void markPersisted() {
        fresh = false;
    }
}
