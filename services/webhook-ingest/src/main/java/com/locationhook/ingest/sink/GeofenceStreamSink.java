package com.locationhook.ingest.sink;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.ExecutionException;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationhook.common.kafka.StreamTopics;
import com.locationhook.common.model.NormalizedRecord;
import com.locationhook.ingest.config.IngestProperties;
import com.locationhook.ingest.model.LogHandle;

import lombok.extern.slf4j.Slf4j;

/**
 * Publishes geofence enter/exit events to Kafka, keyed by user id so a user's events stay
 * on one partition. Other event types are not streamed.
 */
@Component
@ConditionalOnProperty(prefix = "webhook.ingest.sinks.stream", name = "enabled", havingValue = "true",
        matchIfMissing = true)
@Slf4j
public class GeofenceStreamSink implements EventSink {

    public static final String NAME = "stream";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;

    public GeofenceStreamSink(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper,
            IngestProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = properties.sinks().stream().topic();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean accepts(LogHandle handle) {
        return handle.record().eventType().isGeofence();
    }

    @Override
    public void deliver(LogHandle handle) throws SinkDeliveryException {
        NormalizedRecord record = handle.record();
        String payload;
        try {
            payload = objectMapper.writeValueAsString(
                    new GeofenceEvent(handle.idempotencyKey(), handle.receivedAt(), record));
        } catch (JsonProcessingException e) {
            throw new SinkDeliveryException("Failed to serialize geofence event", e);
        }

        ProducerRecord<String, String> message = new ProducerRecord<>(topic, record.userId(), payload);
        message.headers().add(StreamTopics.IDEMPOTENCY_KEY_HEADER,
                handle.idempotencyKey().getBytes(StandardCharsets.UTF_8));
        message.headers().add(StreamTopics.EVENT_TYPE_HEADER,
                record.eventType().wireName().getBytes(StandardCharsets.UTF_8));

        try {
            var result = kafkaTemplate.send(message).get();
            log.debug("Published geofence event {} to {}-{}@{}", handle.idempotencyKey(),
                    result.getRecordMetadata().topic(), result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());
        } catch (ExecutionException e) {
            throw new SinkDeliveryException("Kafka publish to " + topic + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SinkDeliveryException("Interrupted while publishing to " + topic, e);
        }
    }

    /** Stream message body; consumers dedupe on {@code idempotencyKey}. */
    record GeofenceEvent(String idempotencyKey, Instant receivedAt, NormalizedRecord record) {
    }
}
