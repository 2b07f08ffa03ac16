package com.locationhook.ingest.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.locationhook.ingest.model.RejectedWebhook;

@Repository
public interface RejectedWebhookRepository extends JpaRepository<RejectedWebhook, Long> {
}
