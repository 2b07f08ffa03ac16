package com.locationhook.ingest.model;

import java.time.Instant;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for warehouse_staging table.
 * Queue of normalized records waiting for the external warehouse batch load,
 * which flips {@code loaded} once a row has been copied.
 */
@Entity
@Table(name = "warehouse_staging")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WarehouseStagingRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "idempotency_key", length = 64, nullable = false, unique = true)
    private String idempotencyKey;

    @Column(name = "user_id", length = 100, nullable = false)
    private String userId;

    @Column(name = "event_type", length = 30, nullable = false)
    private String eventType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", columnDefinition = "jsonb", nullable = false)
    private String payload;

    @Column(name = "loaded", nullable = false)
    private Boolean loaded;

    @Column(name = "enqueued_at", nullable = false)
    private Instant enqueuedAt;

    @PrePersist
    protected void onCreate() {
        if (enqueuedAt == null) {
            enqueuedAt = Instant.now();
        }
        if (loaded == null) {
            loaded = false;
        }
    }
}
