package com.locationhook.ingest.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.locationhook.ingest.normalizer.ValidationError;
import com.locationhook.ingest.service.DurabilityException;
import com.locationhook.ingest.service.WebhookIngestionService;
import com.locationhook.ingest.service.WebhookIngestionService.IngestResult;
import com.locationhook.ingest.service.WebhookIngestionService.WebhookStatus;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Webhook receiver for the location provider.
 * 202 for a new event, 200 for a replay, 400 for a payload that cannot be normalized,
 * 500 when the event could not be durably stored (the provider retries).
 */
@RestController
@RequestMapping("/webhook-endpoint")
@RequiredArgsConstructor
@Slf4j
public class WebhookIngestController {

    private final WebhookIngestionService webhookIngestionService;

    @PostMapping(consumes = MediaType.ALL_VALUE)
    public ResponseEntity<WebhookResponse> receive(@RequestBody byte[] payload) {
        log.debug("Received webhook: {} bytes", payload.length);

        try {
            IngestResult result = webhookIngestionService.ingest(payload);
            if (!result.isAccepted()) {
                return ResponseEntity.badRequest().body(rejection(result.error()));
            }

            boolean created = result.handle().created();
            WebhookResponse response = WebhookResponse.builder()
                    .idempotencyKey(result.handle().idempotencyKey())
                    .created(created)
                    .message(created ? "Webhook accepted" : "Webhook already received")
                    .timestamp(System.currentTimeMillis())
                    .build();
            return ResponseEntity.status(created ? HttpStatus.ACCEPTED : HttpStatus.OK).body(response);

        } catch (DurabilityException e) {
            log.error("Webhook could not be stored", e);
            return serverError("Webhook could not be stored, retry later");
        } catch (Exception e) {
            log.error("Error processing webhook", e);
            return serverError("Internal server error");
        }
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<WebhookResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(rejection(ValidationError.malformed("Request body is missing")));
    }

    @GetMapping("/{idempotencyKey}")
    public ResponseEntity<WebhookStatus> getWebhook(@PathVariable String idempotencyKey) {
        return webhookIngestionService.getStatus(idempotencyKey)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    private static WebhookResponse rejection(ValidationError error) {
        return WebhookResponse.builder()
                .created(false)
                .reason(error.reason().name())
                .field(error.field())
                .message(error.message())
                .timestamp(System.currentTimeMillis())
                .build();
    }

    private static ResponseEntity<WebhookResponse> serverError(String message) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(WebhookResponse.builder()
                        .created(false)
                        .message(message)
                        .timestamp(System.currentTimeMillis())
                        .build());
    }

    @lombok.Data
    @lombok.Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class WebhookResponse {
        private String idempotencyKey;
        private Boolean created;
        private String reason;
        private String field;
        private String message;
        private Long timestamp;
    }
}
