package com.locationhook.ingest.model;

import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for rejected_webhooks table.
 * Audit copy of payloads that failed normalization. Never fanned out.
 */
@Entity
@Table(name = "rejected_webhooks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RejectedWebhook {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "reason", length = 30, nullable = false)
    private String reason;

    @Column(name = "field", length = 100)
    private String field;

    @Column(name = "message", columnDefinition = "TEXT")
    private String message;

    @Column(name = "payload", columnDefinition = "bytea", nullable = false)
    private byte[] payload;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;
}
