package com.locationhook.ingest.sink;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import com.locationhook.common.model.LocationRecord;
import com.locationhook.ingest.model.LocationSnapshot;
import com.locationhook.ingest.model.LogHandle;
import com.locationhook.ingest.repository.LocationSnapshotRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Upserts the location into the lookup store, keyed by user and event time.
 */
@Component
@ConditionalOnProperty(prefix = "webhook.ingest.sinks.lookup", name = "enabled", havingValue = "true",
        matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LocationLookupSink implements EventSink {

    public static final String NAME = "lookup";

    private final LocationSnapshotRepository locationSnapshotRepository;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void deliver(LogHandle handle) throws SinkDeliveryException {
        LocationRecord location = handle.record().location();
        LocationSnapshot snapshot = LocationSnapshot.builder()
                .key(new LocationSnapshot.Key(location.userId(), location.timestamp()))
                .tripId(location.tripId())
                .latitude(location.latitude())
                .longitude(location.longitude())
                .eventType(location.eventType().wireName())
                .idempotencyKey(handle.idempotencyKey())
                .build();
        try {
            locationSnapshotRepository.save(snapshot);
            log.debug("Upserted location for user {} at {}", location.userId(), location.timestamp());
        } catch (DataAccessException e) {
            throw new SinkDeliveryException("Lookup store upsert failed", e);
        }
    }
}
