package com.locationhook.ingest.sink;

import java.util.Map;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.locationhook.ingest.config.IngestProperties;
import com.locationhook.ingest.model.LogHandle;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Archives the raw webhook body to S3 as {@code <prefix>/<idempotencyKey>.json}.
 * Objects are written once; an existing object counts as delivered.
 */
@Component
@ConditionalOnProperty(prefix = "webhook.ingest.sinks.archive", name = "enabled", havingValue = "true",
        matchIfMissing = true)
@Slf4j
public class ArchiveSink implements EventSink {

    public static final String NAME = "archive";

    private final S3Client s3Client;
    private final String bucket;
    private final String prefix;

    public ArchiveSink(S3Client s3Client, IngestProperties properties) {
        this.s3Client = s3Client;
        this.bucket = properties.sinks().archive().bucket();
        this.prefix = properties.sinks().archive().prefix();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void deliver(LogHandle handle) throws SinkDeliveryException {
        String objectKey = objectKey(handle.idempotencyKey());
        try {
            if (exists(objectKey)) {
                log.debug("Raw payload {} already archived at s3://{}/{}", handle.idempotencyKey(), bucket, objectKey);
                return;
            }
            s3Client.putObject(PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(objectKey)
                    .contentType("application/json")
                    .metadata(Map.of(
                            "idempotency-key", handle.idempotencyKey(),
                            "received-at", handle.receivedAt().toString()))
                    .build(),
                    RequestBody.fromBytes(handle.rawPayload()));
            log.debug("Archived raw payload {} to s3://{}/{}", handle.idempotencyKey(), bucket, objectKey);
        } catch (SdkException e) {
            throw new SinkDeliveryException("S3 archive failed for " + objectKey, e);
        }
    }

    String objectKey(String idempotencyKey) {
        return prefix == null || prefix.isBlank()
                ? idempotencyKey + ".json"
                : prefix + "/" + idempotencyKey + ".json";
    }

    private boolean exists(String objectKey) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(objectKey).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw e;
        }
    }
}
