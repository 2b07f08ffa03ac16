package com.locationhook.ingest.service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationhook.common.model.NormalizedRecord;
import com.locationhook.ingest.model.LogHandle;
import com.locationhook.ingest.model.RawEvent;
import com.locationhook.ingest.model.WebhookEvent;
import com.locationhook.ingest.repository.WebhookEventRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * PostgreSQL-backed durability log.
 *
 * <p>Same-key appends are serialized by an in-process lock; appends racing from other
 * instances are caught by the primary key on {@code idempotency_key}. Each append commits
 * before returning.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaDurabilityLog implements DurabilityLog {

    private final WebhookEventRepository webhookEventRepository;
    private final IdempotencyKeys idempotencyKeys;
    private final ObjectMapper objectMapper;

    private final ConcurrentHashMap<String, KeyLock> keyLocks = new ConcurrentHashMap<>();

    @Override
    public LogHandle append(RawEvent raw, NormalizedRecord record) {
        String key = idempotencyKeys.derive(raw);
        KeyLock keyLock = acquire(key);
        try {
            Optional<WebhookEvent> existing = webhookEventRepository.findById(key);
            if (existing.isPresent()) {
                log.debug("Webhook already logged: key={}", key);
                return toHandle(existing.get(), false);
            }

            WebhookEvent entry = WebhookEvent.builder()
                    .idempotencyKey(key)
                    .rawPayload(raw.payload())
                    .normalizedRecord(serialize(key, record))
                    .userId(record.userId())
                    .eventType(record.eventType().wireName())
                    .receivedAt(raw.receivedAt())
                    .build();
            try {
                webhookEventRepository.saveAndFlush(entry);
            } catch (DataIntegrityViolationException e) {
                Optional<WebhookEvent> winner = webhookEventRepository.findById(key);
                if (winner.isPresent()) {
                    log.info("Webhook {} logged concurrently by another instance", key);
                    return toHandle(winner.get(), false);
                }
                log.warn("Webhook {} refused by storage: {}", key, e.getMostSpecificCause().getMessage());
                throw new UnstorableRecordException("Record for " + key + " violates storage constraints", e);
            }
            log.debug("Logged webhook: key={}, userId={}", key, record.userId());
            return new LogHandle(key, raw.receivedAt(), true, record, raw.payload());

        } catch (DataAccessException e) {
            log.error("Failed to append webhook {} to durability log", key, e);
            throw new DurabilityException("Failed to persist webhook " + key, e);
        } finally {
            release(key, keyLock);
        }
    }

    private KeyLock acquire(String key) {
        KeyLock keyLock = keyLocks.compute(key, (k, current) -> {
            KeyLock held = current != null ? current : new KeyLock();
            held.holders++;
            return held;
        });
        keyLock.lock.lock();
        return keyLock;
    }

    private void release(String key, KeyLock keyLock) {
        keyLock.lock.unlock();
        keyLocks.compute(key, (k, current) -> --current.holders == 0 ? null : current);
    }

    // holders is only touched inside ConcurrentHashMap.compute for the key
    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }

    @Override
    public Optional<LogHandle> lookup(String idempotencyKey) {
        try {
            return webhookEventRepository.findById(idempotencyKey).map(entry -> toHandle(entry, false));
        } catch (DataAccessException e) {
            throw new DurabilityException("Failed to read webhook " + idempotencyKey, e);
        }
    }

    @Override
    public void markDispatched(String idempotencyKey) {
        try {
            webhookEventRepository.markDispatched(idempotencyKey, Instant.now());
        } catch (DataAccessException e) {
            throw new DurabilityException("Failed to mark webhook " + idempotencyKey + " dispatched", e);
        }
    }

    @Override
    public List<LogHandle> findUndispatched(Instant receivedBefore, int limit) {
        try {
            return webhookEventRepository.findUndispatched(receivedBefore, PageRequest.of(0, limit)).stream()
                    .map(entry -> toHandle(entry, false))
                    .toList();
        } catch (DataAccessException e) {
            throw new DurabilityException("Failed to scan for undispatched webhooks", e);
        }
    }

    private String serialize(String key, NormalizedRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new DurabilityException("Failed to serialize record for " + key, e);
        }
    }

    private LogHandle toHandle(WebhookEvent entry, boolean created) {
        try {
            NormalizedRecord record = objectMapper.readValue(entry.getNormalizedRecord(), NormalizedRecord.class);
            return new LogHandle(entry.getIdempotencyKey(), entry.getReceivedAt(), created, record,
                    entry.getRawPayload());
        } catch (JsonProcessingException e) {
            throw new DurabilityException("Corrupt log entry " + entry.getIdempotencyKey(), e);
        }
    }
}
