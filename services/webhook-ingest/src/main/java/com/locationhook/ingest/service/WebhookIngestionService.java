package com.locationhook.ingest.service;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import com.locationhook.common.model.NormalizedRecord;
import com.locationhook.ingest.config.IngestProperties;
import com.locationhook.ingest.model.DeliveryStatus;
import com.locationhook.ingest.model.LogHandle;
import com.locationhook.ingest.model.RawEvent;
import com.locationhook.ingest.model.RejectedWebhook;
import com.locationhook.ingest.normalizer.NormalizationResult;
import com.locationhook.ingest.normalizer.PayloadNormalizer;
import com.locationhook.ingest.normalizer.ValidationError;
import com.locationhook.ingest.repository.RejectedWebhookRepository;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Ingest path: normalize, append to the durability log, then hand off to the sink dispatcher.
 * The webhook is acknowledged once the append commits; sink delivery runs in the background.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookIngestionService {

    private final PayloadNormalizer payloadNormalizer;
    private final DurabilityLog durabilityLog;
    private final DeliveryLedger deliveryLedger;
    private final SinkDispatcher sinkDispatcher;
    private final RejectedWebhookRepository rejectedWebhookRepository;
    private final IngestProperties properties;
    private final MeterRegistry meterRegistry;

    public record IngestResult(LogHandle handle, ValidationError error) {

        public static IngestResult accepted(LogHandle handle) {
            return new IngestResult(handle, null);
        }

        public static IngestResult rejected(ValidationError error) {
            return new IngestResult(null, error);
        }

        public boolean isAccepted() {
            return handle != null;
        }
    }

    public record WebhookStatus(
            String idempotencyKey,
            Instant receivedAt,
            NormalizedRecord record,
            Map<String, DeliveryStatus> deliveries) {
    }

    /**
     * @throws DurabilityException if the webhook could not be durably stored
     */
    public IngestResult ingest(byte[] payload) {
        RawEvent raw = RawEvent.received(payload);
        NormalizationResult normalized = payloadNormalizer.normalize(raw);

        if (!normalized.isValid()) {
            return reject(raw, normalized.getError());
        }

        LogHandle handle;
        try {
            handle = durabilityLog.append(raw, normalized.getRecord());
        } catch (UnstorableRecordException e) {
            return reject(raw, new ValidationError(ValidationError.Reason.OUT_OF_RANGE, null,
                    "Record exceeds storage limits"));
        }
        if (handle.created()) {
            log.info("Accepted webhook {}: userId={}, eventType={}", handle.idempotencyKey(),
                    handle.record().userId(), handle.record().eventType().wireName());
            Counter.builder("webhook.ingest.events.accepted")
                    .tag("event_type", handle.record().eventType().wireName())
                    .register(meterRegistry)
                    .increment();
            sinkDispatcher.dispatchAsync(handle);
        } else {
            log.info("Duplicate webhook {} acknowledged without dispatch", handle.idempotencyKey());
            Counter.builder("webhook.ingest.events.duplicate")
                    .register(meterRegistry)
                    .increment();
        }
        return IngestResult.accepted(handle);
    }

    public Optional<WebhookStatus> getStatus(String idempotencyKey) {
        return durabilityLog.lookup(idempotencyKey)
                .map(handle -> new WebhookStatus(
                        handle.idempotencyKey(),
                        handle.receivedAt(),
                        handle.record(),
                        deliveryLedger.findAll(idempotencyKey)));
    }

    private IngestResult reject(RawEvent raw, ValidationError error) {
        log.warn("Rejected webhook: reason={}, field={}, message={}",
                error.reason(), error.field(), error.message());
        auditRejection(raw, error);
        Counter.builder("webhook.ingest.events.rejected")
                .tag("reason", error.reason().name())
                .register(meterRegistry)
                .increment();
        return IngestResult.rejected(error);
    }

    private void auditRejection(RawEvent raw, ValidationError error) {
        if (!properties.auditRejected()) {
            return;
        }
        try {
            rejectedWebhookRepository.save(RejectedWebhook.builder()
                    .reason(error.reason().name())
                    .field(error.field())
                    .message(error.message())
                    .payload(raw.payload())
                    .receivedAt(raw.receivedAt())
                    .build());
        } catch (DataAccessException e) {
            // The sender still gets its 400; only the audit copy is lost
            log.error("Failed to audit rejected webhook ({})", error.reason(), e);
        }
    }
}
