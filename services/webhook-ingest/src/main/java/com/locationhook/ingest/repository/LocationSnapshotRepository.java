package com.locationhook.ingest.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.locationhook.ingest.model.LocationSnapshot;

@Repository
public interface LocationSnapshotRepository extends JpaRepository<LocationSnapshot, LocationSnapshot.Key> {
}
