package com.locationhook.ingest.service;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.locationhook.ingest.model.DeliveryStatus;
import com.locationhook.ingest.model.SinkDelivery;
import com.locationhook.ingest.repository.SinkDeliveryRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Delivery ledger in the sink_deliveries table. Writes take a row lock so concurrent
 * updates of the same pair apply one after the other.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaDeliveryLedger implements DeliveryLedger {

    private final SinkDeliveryRepository sinkDeliveryRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<DeliveryStatus> find(String idempotencyKey, String sinkName) {
        return sinkDeliveryRepository.findByIdempotencyKeyAndSinkName(idempotencyKey, sinkName)
                .map(SinkDelivery::toStatus);
    }

    @Override
    @Transactional
    public void record(String idempotencyKey, String sinkName, DeliveryStatus status) {
        SinkDelivery delivery = sinkDeliveryRepository.findForUpdate(idempotencyKey, sinkName)
                .orElseGet(() -> SinkDelivery.builder()
                        .idempotencyKey(idempotencyKey)
                        .sinkName(sinkName)
                        .build());
        delivery.setStatus(status.state());
        delivery.setAttempts(status.attempts());
        delivery.setLastError(status.reason());
        sinkDeliveryRepository.save(delivery);
        log.debug("Ledger {} / {} -> {}", idempotencyKey, sinkName, status.state());
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, DeliveryStatus> findAll(String idempotencyKey) {
        Map<String, DeliveryStatus> statuses = new TreeMap<>();
        for (SinkDelivery delivery : sinkDeliveryRepository.findByIdempotencyKey(idempotencyKey)) {
            statuses.put(delivery.getSinkName(), delivery.toStatus());
        }
        return statuses;
    }
}
