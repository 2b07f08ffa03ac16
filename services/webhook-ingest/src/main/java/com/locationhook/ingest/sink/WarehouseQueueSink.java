package com.locationhook.ingest.sink;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationhook.ingest.model.LogHandle;
import com.locationhook.ingest.model.WarehouseStagingRecord;
import com.locationhook.ingest.repository.WarehouseStagingRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Enqueues normalized records in warehouse_staging for the batch warehouse load.
 * Off unless {@code webhook.ingest.sinks.warehouse.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "webhook.ingest.sinks.warehouse", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class WarehouseQueueSink implements EventSink {

    public static final String NAME = "warehouse";

    private final WarehouseStagingRepository warehouseStagingRepository;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void deliver(LogHandle handle) throws SinkDeliveryException {
        String key = handle.idempotencyKey();
        try {
            if (warehouseStagingRepository.existsByIdempotencyKey(key)) {
                log.debug("Record {} already staged for warehouse", key);
                return;
            }
            warehouseStagingRepository.save(WarehouseStagingRecord.builder()
                    .idempotencyKey(key)
                    .userId(handle.record().userId())
                    .eventType(handle.record().eventType().wireName())
                    .payload(objectMapper.writeValueAsString(handle.record()))
                    .build());
        } catch (DataIntegrityViolationException e) {
            log.debug("Record {} staged concurrently", key);
        } catch (DataAccessException e) {
            throw new SinkDeliveryException("Warehouse staging insert failed", e);
        } catch (JsonProcessingException e) {
            throw new SinkDeliveryException("Failed to serialize record for warehouse", e);
        }
    }
}
