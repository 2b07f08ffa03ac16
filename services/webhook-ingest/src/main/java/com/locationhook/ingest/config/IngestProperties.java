package com.locationhook.ingest.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import com.locationhook.common.kafka.StreamTopics;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Configuration properties for the webhook ingest service.
 * Bound once at start-up; components receive it through their constructors.
 */
@ConfigurationProperties(prefix = "webhook.ingest")
@Validated
public record IngestProperties(
        @DefaultValue("true") boolean auditRejected,
        @DefaultValue @Valid Retry retry,
        @DefaultValue @Valid Dispatcher dispatcher,
        @DefaultValue @Valid Recovery recovery,
        @DefaultValue @Valid Sinks sinks) {

    public record Retry(
            @DefaultValue("5") @Min(1) int maxAttempts,
            @DefaultValue("200ms") Duration baseBackoff,
            @DefaultValue("5s") Duration maxBackoff,
            @DefaultValue("3s") Duration callTimeout) {
    }

    public record Dispatcher(
            @DefaultValue("8") @Min(1) int threads,
            @DefaultValue("32") @Min(1) int callThreads) {
    }

    public record Recovery(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("100") @Min(1) int batchSize,
            @DefaultValue("2m") Duration minAge,
            @DefaultValue("PT5M") Duration interval) {
    }

    public record Sinks(
            @DefaultValue @Valid Lookup lookup,
            @DefaultValue @Valid Archive archive,
            @DefaultValue @Valid Stream stream,
            @DefaultValue @Valid Warehouse warehouse) {
    }

    public record Lookup(
            @DefaultValue("true") boolean enabled) {
    }

    /**
     * @param endpoint override for S3-compatible stores, {@code null} for AWS
     */
    public record Archive(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("location-webhook-archive") @NotBlank String bucket,
            @DefaultValue("us-east-1") @NotBlank String region,
            @DefaultValue("raw") String prefix,
            String endpoint) {
    }

    public record Stream(
            @DefaultValue("true") boolean enabled,
            @DefaultValue(StreamTopics.GEOFENCE_EVENTS) @NotBlank String topic) {
    }

    public record Warehouse(
            @DefaultValue("false") boolean enabled) {
    }
}
