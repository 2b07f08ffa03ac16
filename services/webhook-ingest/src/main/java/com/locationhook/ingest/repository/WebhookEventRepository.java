package com.locationhook.ingest.repository;

import java.time.Instant;
import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.locationhook.ingest.model.WebhookEvent;

@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEvent, String> {

    @Query("SELECT e FROM WebhookEvent e WHERE e.dispatchCompletedAt IS NULL AND e.receivedAt < :receivedBefore "
            + "ORDER BY e.receivedAt ASC")
    List<WebhookEvent> findUndispatched(Instant receivedBefore, Pageable pageable);

    @Modifying
    @Transactional
    @Query("UPDATE WebhookEvent e SET e.dispatchCompletedAt = :completedAt WHERE e.idempotencyKey = :idempotencyKey")
    int markDispatched(String idempotencyKey, Instant completedAt);
}
