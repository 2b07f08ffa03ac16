package com.locationhook.ingest.config;

import java.net.URI;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

@Configuration
@ConditionalOnProperty(prefix = "webhook.ingest.sinks.archive", name = "enabled", havingValue = "true",
        matchIfMissing = true)
@Slf4j
public class S3Config {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(IngestProperties properties) {
        IngestProperties.Archive archive = properties.sinks().archive();
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(archive.region()))
                .credentialsProvider(DefaultCredentialsProvider.create())
                // Release the sink call thread no later than the dispatcher stops waiting on it
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(properties.retry().callTimeout())
                        .apiCallAttemptTimeout(properties.retry().callTimeout())
                        .build());

        if (archive.endpoint() != null && !archive.endpoint().isBlank()) {
            // S3-compatible stores (MinIO, LocalStack) need path-style addressing
            builder.endpointOverride(URI.create(archive.endpoint()))
                    .forcePathStyle(true);
            log.info("Archive sink using S3 endpoint override {}", archive.endpoint());
        }
        return builder.build();
    }
}
