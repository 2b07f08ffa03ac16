package com.locationhook.ingest.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import com.locationhook.ingest.model.SinkDelivery;

import jakarta.persistence.LockModeType;

@Repository
public interface SinkDeliveryRepository extends JpaRepository<SinkDelivery, Long> {

    Optional<SinkDelivery> findByIdempotencyKeyAndSinkName(String idempotencyKey, String sinkName);

    List<SinkDelivery> findByIdempotencyKey(String idempotencyKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM SinkDelivery d WHERE d.idempotencyKey = :idempotencyKey AND d.sinkName = :sinkName")
    Optional<SinkDelivery> findForUpdate(String idempotencyKey, String sinkName);
}
