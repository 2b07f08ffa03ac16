package com.locationhook.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Location webhook ingest service.
 *
 * Responsibilities:
 * - Accept provider webhooks over HTTP and normalize them
 * - Persist every accepted webhook to PostgreSQL before acknowledging
 * - Fan out to the lookup store, S3 archive, Kafka geofence stream and warehouse staging
 * - Re-dispatch logged webhooks whose fan-out never completed
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class WebhookIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebhookIngestApplication.class, args);
    }
}
