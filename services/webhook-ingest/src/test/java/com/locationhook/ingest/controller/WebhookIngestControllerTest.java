package com.locationhook.ingest.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.ByteArrayHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.locationhook.common.model.EventType;
import com.locationhook.common.model.LocationRecord;
import com.locationhook.common.model.NormalizedRecord;
import com.locationhook.ingest.model.DeliveryStatus;
import com.locationhook.ingest.model.LogHandle;
import com.locationhook.ingest.normalizer.ValidationError;
import com.locationhook.ingest.service.DurabilityException;
import com.locationhook.ingest.service.WebhookIngestionService;
import com.locationhook.ingest.service.WebhookIngestionService.IngestResult;
import com.locationhook.ingest.service.WebhookIngestionService.WebhookStatus;

@ExtendWith(MockitoExtension.class)
class WebhookIngestControllerTest {

    private static final String BODY = "{\"location\":{\"user_id\":\"u-1\"}}";

    @Mock
    private WebhookIngestionService webhookIngestionService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        JsonMapper mapper = JsonMapper.builder().findAndAddModules().build();
        mockMvc = MockMvcBuilders.standaloneSetup(new WebhookIngestController(webhookIngestionService))
                .setMessageConverters(new ByteArrayHttpMessageConverter(),
                        new MappingJackson2HttpMessageConverter(mapper))
                .build();
    }

    private static LogHandle handle(boolean created) {
        NormalizedRecord record = new NormalizedRecord(
                new LocationRecord("u-1", null, 1.0, 2.0, Instant.parse("2024-05-01T10:00:00Z"),
                        EventType.LOCATION_UPDATE),
                null, null);
        return new LogHandle("key-1", Instant.parse("2024-05-01T10:00:01Z"), created, record, BODY.getBytes());
    }

    @Test
    void newWebhookIsAccepted() throws Exception {
        when(webhookIngestionService.ingest(any())).thenReturn(IngestResult.accepted(handle(true)));

        mockMvc.perform(post("/webhook-endpoint").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.idempotencyKey").value("key-1"))
                .andExpect(jsonPath("$.created").value(true));
    }

    @Test
    void duplicateWebhookIsOk() throws Exception {
        when(webhookIngestionService.ingest(any())).thenReturn(IngestResult.accepted(handle(false)));

        mockMvc.perform(post("/webhook-endpoint").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.idempotencyKey").value("key-1"))
                .andExpect(jsonPath("$.created").value(false));
    }

    @Test
    void invalidWebhookIsBadRequestWithReason() throws Exception {
        when(webhookIngestionService.ingest(any())).thenReturn(IngestResult.rejected(
                new ValidationError(ValidationError.Reason.OUT_OF_RANGE, "location.latitude", "Value 91.0 outside")));

        mockMvc.perform(post("/webhook-endpoint").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("OUT_OF_RANGE"))
                .andExpect(jsonPath("$.field").value("location.latitude"))
                .andExpect(jsonPath("$.idempotencyKey").doesNotExist());
    }

    @Test
    void storageFailureIsServerErrorSoTheProviderRetries() throws Exception {
        when(webhookIngestionService.ingest(any())).thenThrow(new DurabilityException("db down", null));

        mockMvc.perform(post("/webhook-endpoint").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.created").value(false));
    }

    @Test
    void missingBodyIsMalformed() throws Exception {
        mockMvc.perform(post("/webhook-endpoint").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("MALFORMED_JSON"));
    }

    @Test
    void returnsStatusOfLoggedWebhook() throws Exception {
        when(webhookIngestionService.getStatus("key-1")).thenReturn(Optional.of(new WebhookStatus(
                "key-1", Instant.parse("2024-05-01T10:00:01Z"), handle(false).record(),
                Map.of("lookup", DeliveryStatus.delivered(1)))));

        mockMvc.perform(get("/webhook-endpoint/key-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.idempotencyKey").value("key-1"))
                .andExpect(jsonPath("$.record.location.eventType").value("location_update"))
                .andExpect(jsonPath("$.deliveries.lookup.state").value("DELIVERED"));
    }

    @Test
    void unknownWebhookIsNotFound() throws Exception {
        when(webhookIngestionService.getStatus("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/webhook-endpoint/nope")).andExpect(status().isNotFound());
    }
}
