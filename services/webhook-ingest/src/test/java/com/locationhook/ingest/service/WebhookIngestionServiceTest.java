package com.locationhook.ingest.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationhook.common.model.EventType;
import com.locationhook.common.model.LocationRecord;
import com.locationhook.common.model.NormalizedRecord;
import com.locationhook.ingest.config.IngestProperties;
import com.locationhook.ingest.model.DeliveryStatus;
import com.locationhook.ingest.model.LogHandle;
import com.locationhook.ingest.model.RawEvent;
import com.locationhook.ingest.model.RejectedWebhook;
import com.locationhook.ingest.normalizer.LegacyPayloadAdapter;
import com.locationhook.ingest.normalizer.PayloadNormalizer;
import com.locationhook.ingest.normalizer.ValidationError;
import com.locationhook.ingest.repository.RejectedWebhookRepository;
import com.locationhook.ingest.service.WebhookIngestionService.IngestResult;
import com.locationhook.ingest.service.WebhookIngestionService.WebhookStatus;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@ExtendWith(MockitoExtension.class)
class WebhookIngestionServiceTest {

    private static final String VALID = """
            {"id": "evt-1",
             "location": {"user_id": "u-1", "latitude": 37.77, "longitude": -122.42,
                          "timestamp": "2024-05-01T10:00:00Z", "event_type": "geofence_enter"}}
            """;

    @Mock
    private DurabilityLog durabilityLog;
    @Mock
    private DeliveryLedger deliveryLedger;
    @Mock
    private SinkDispatcher sinkDispatcher;
    @Mock
    private RejectedWebhookRepository rejectedWebhookRepository;

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private WebhookIngestionService service;

    @BeforeEach
    void setUp() {
        service = serviceWithAudit(true);
    }

    private WebhookIngestionService serviceWithAudit(boolean auditRejected) {
        IngestProperties properties = new IngestProperties(auditRejected, null, null, null, null);
        return new WebhookIngestionService(
                new PayloadNormalizer(new ObjectMapper(), new LegacyPayloadAdapter()),
                durabilityLog, deliveryLedger, sinkDispatcher, rejectedWebhookRepository, properties, meterRegistry);
    }

    private static LogHandle handle(boolean created) {
        NormalizedRecord record = new NormalizedRecord(
                new LocationRecord("u-1", null, 37.77, -122.42, Instant.parse("2024-05-01T10:00:00Z"),
                        EventType.GEOFENCE_ENTER),
                null, null);
        return new LogHandle("key-1", Instant.parse("2024-05-01T10:00:01Z"), created, record,
                VALID.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void newWebhookIsLoggedThenDispatched() {
        LogHandle logged = handle(true);
        when(durabilityLog.append(any(RawEvent.class), any(NormalizedRecord.class))).thenReturn(logged);

        IngestResult result = service.ingest(bytes(VALID));

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.handle().created()).isTrue();
        verify(sinkDispatcher).dispatchAsync(logged);
        assertThat(meterRegistry.get("webhook.ingest.events.accepted").tag("event_type", "geofence_enter")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void duplicateIsAcknowledgedWithoutDispatch() {
        when(durabilityLog.append(any(RawEvent.class), any(NormalizedRecord.class))).thenReturn(handle(false));

        IngestResult result = service.ingest(bytes(VALID));

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.handle().created()).isFalse();
        verify(sinkDispatcher, never()).dispatchAsync(any());
        assertThat(meterRegistry.get("webhook.ingest.events.duplicate").counter().count()).isEqualTo(1.0);
    }

    @Test
    void invalidWebhookIsAuditedAndNeverLogged() {
        IngestResult result = service.ingest(bytes("""
                {"location": {"latitude": 1, "longitude": 2, "event_type": "location_update"}}
                """));

        assertThat(result.isAccepted()).isFalse();
        assertThat(result.error().reason()).isEqualTo(ValidationError.Reason.MISSING_FIELD);
        verifyNoInteractions(durabilityLog, sinkDispatcher);

        ArgumentCaptor<RejectedWebhook> audit = ArgumentCaptor.forClass(RejectedWebhook.class);
        verify(rejectedWebhookRepository).save(audit.capture());
        assertThat(audit.getValue().getReason()).isEqualTo("MISSING_FIELD");
        assertThat(audit.getValue().getField()).isEqualTo("location.user_id");
        assertThat(meterRegistry.get("webhook.ingest.events.rejected").tag("reason", "MISSING_FIELD")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void auditFailureStillReturnsTheRejection() {
        when(rejectedWebhookRepository.save(any())).thenThrow(new DataAccessResourceFailureException("db down"));

        IngestResult result = service.ingest(bytes("{oops"));

        assertThat(result.error().reason()).isEqualTo(ValidationError.Reason.MALFORMED_JSON);
    }

    @Test
    void auditCanBeDisabled() {
        IngestResult result = serviceWithAudit(false).ingest(bytes("[]"));

        assertThat(result.isAccepted()).isFalse();
        verifyNoInteractions(rejectedWebhookRepository);
    }

    @Test
    void durabilityFailurePropagatesAndNothingIsDispatched() {
        when(durabilityLog.append(any(RawEvent.class), any(NormalizedRecord.class)))
                .thenThrow(new DurabilityException("db down", null));

        assertThatThrownBy(() -> service.ingest(bytes(VALID))).isInstanceOf(DurabilityException.class);
        verifyNoInteractions(sinkDispatcher);
    }

    @Test
    void recordRefusedByStorageIsRejectedNotFailed() {
        when(durabilityLog.append(any(RawEvent.class), any(NormalizedRecord.class)))
                .thenThrow(new UnstorableRecordException("too long", null));

        IngestResult result = service.ingest(bytes(VALID));

        assertThat(result.isAccepted()).isFalse();
        assertThat(result.error().reason()).isEqualTo(ValidationError.Reason.OUT_OF_RANGE);
        verify(rejectedWebhookRepository).save(any());
        verifyNoInteractions(sinkDispatcher);
        assertThat(meterRegistry.get("webhook.ingest.events.rejected").tag("reason", "OUT_OF_RANGE")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void statusCombinesLogEntryAndLedger() {
        when(durabilityLog.lookup("key-1")).thenReturn(Optional.of(handle(false)));
        when(deliveryLedger.findAll("key-1")).thenReturn(Map.of(
                "lookup", DeliveryStatus.delivered(1),
                "archive", DeliveryStatus.failed("throttled", 5)));

        WebhookStatus status = service.getStatus("key-1").orElseThrow();

        assertThat(status.idempotencyKey()).isEqualTo("key-1");
        assertThat(status.record().userId()).isEqualTo("u-1");
        assertThat(status.deliveries()).containsOnlyKeys("lookup", "archive");
        assertThat(status.deliveries().get("archive").reason()).isEqualTo("throttled");
    }

    @Test
    void statusOfUnknownKeyIsEmpty() {
        when(durabilityLog.lookup("missing")).thenReturn(Optional.empty());

        assertThat(service.getStatus("missing")).isEmpty();
        verifyNoInteractions(deliveryLedger);
    }
}
