package com.locationhook.ingest.service;

import java.time.Instant;
import java.util.List;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.locationhook.ingest.config.IngestProperties;
import com.locationhook.ingest.model.LogHandle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Re-dispatches logged webhooks whose fan-out never completed, e.g. because the process
 * stopped between acknowledging the sender and finishing delivery.
 * Sinks already DELIVERED for an entry are skipped by the dispatcher.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispatchRecovery {

    private final DurabilityLog durabilityLog;
    private final SinkDispatcher sinkDispatcher;
    private final IngestProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        if (!properties.recovery().enabled()) {
            log.info("Dispatch recovery is disabled");
            return;
        }
        redispatchStale();
    }

    @Scheduled(fixedDelayString = "${webhook.ingest.recovery.interval:PT5M}",
            initialDelayString = "${webhook.ingest.recovery.interval:PT5M}")
    public void redispatchStale() {
        if (!properties.recovery().enabled()) {
            return;
        }
        Instant cutoff = Instant.now().minus(properties.recovery().minAge());
        List<LogHandle> stale;
        try {
            stale = durabilityLog.findUndispatched(cutoff, properties.recovery().batchSize());
        } catch (DurabilityException e) {
            log.error("Dispatch recovery could not read the durability log", e);
            return;
        }
        if (stale.isEmpty()) {
            return;
        }

        log.info("Re-dispatching {} logged webhooks received before {}", stale.size(), cutoff);
        for (LogHandle handle : stale) {
            sinkDispatcher.dispatchAsync(handle);
        }
    }
}
