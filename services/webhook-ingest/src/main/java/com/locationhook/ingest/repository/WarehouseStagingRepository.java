package com.locationhook.ingest.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.locationhook.ingest.model.WarehouseStagingRecord;

@Repository
public interface WarehouseStagingRepository extends JpaRepository<WarehouseStagingRecord, Long> {

    boolean existsByIdempotencyKey(String idempotencyKey);
}
