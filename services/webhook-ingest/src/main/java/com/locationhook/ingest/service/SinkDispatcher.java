package com.locationhook.ingest.service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import com.locationhook.ingest.config.IngestProperties;
import com.locationhook.ingest.model.DeliveryStatus;
import com.locationhook.ingest.model.LogHandle;
import com.locationhook.ingest.sink.EventSink;
import com.locationhook.ingest.sink.SinkDeliveryException;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Fans a logged webhook out to every registered sink.
 *
 * <p>Each sink is delivered in its own task with bounded exponential backoff and a per-call
 * timeout, so a slow or broken sink never holds up the others. Calls run on a capped pool;
 * a call that finds it exhausted counts as a failed attempt. Outcomes go to the
 * {@link DeliveryLedger}; nothing is thrown back to the ingest path. A sink already
 * {@code DELIVERED} for the key is skipped, and the same key is never dispatched twice at once.
 */
@Service
@Slf4j
public class SinkDispatcher {

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final List<EventSink> sinks;
    private final DeliveryLedger deliveryLedger;
    private final DurabilityLog durabilityLog;
    private final RetryPolicy retryPolicy;
    private final MeterRegistry meterRegistry;
    private final ExecutorService dispatchExecutor;
    private final ExecutorService callExecutor;
    private final Sleeper sleeper;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    @Autowired
    public SinkDispatcher(ObjectProvider<EventSink> sinks, DeliveryLedger deliveryLedger,
            DurabilityLog durabilityLog, IngestProperties properties, MeterRegistry meterRegistry) {
        this(sinks.orderedStream().toList(), deliveryLedger, durabilityLog, RetryPolicy.from(properties.retry()),
                meterRegistry,
                Executors.newFixedThreadPool(properties.dispatcher().threads(),
                        new CustomizableThreadFactory("sink-dispatch-")),
                callPool(properties.dispatcher().callThreads()),
                duration -> Thread.sleep(duration.toMillis()));
    }

    SinkDispatcher(List<EventSink> sinks, DeliveryLedger deliveryLedger, DurabilityLog durabilityLog,
            RetryPolicy retryPolicy, MeterRegistry meterRegistry, ExecutorService dispatchExecutor,
            ExecutorService callExecutor, Sleeper sleeper) {
        this.sinks = List.copyOf(sinks);
        this.deliveryLedger = deliveryLedger;
        this.durabilityLog = durabilityLog;
        this.retryPolicy = retryPolicy;
        this.meterRegistry = meterRegistry;
        this.dispatchExecutor = dispatchExecutor;
        this.callExecutor = callExecutor;
        this.sleeper = sleeper;
        log.info("Sink dispatcher registered sinks: {}", this.sinks.stream().map(EventSink::name).toList());
    }

    // Calls abandoned on timeout keep their thread until the client gives up, so the pool is capped
    static ExecutorService callPool(int maxThreads) {
        return new ThreadPoolExecutor(0, maxThreads, 60L, TimeUnit.SECONDS, new SynchronousQueue<>(),
                new CustomizableThreadFactory("sink-call-"));
    }

    public List<EventSink> sinks() {
        return sinks;
    }

    /**
     * Starts delivery to every registered sink and returns immediately.
     */
    public CompletableFuture<Map<String, DeliveryStatus>> dispatchAsync(LogHandle handle) {
        return start(handle, sinks);
    }

    /**
     * Delivers to the given sinks and waits for every one of them to reach a terminal state.
     * Sinks that decline the record are absent from the result. Returns an empty map if the
     * key is already being dispatched.
     */
    public Map<String, DeliveryStatus> dispatch(LogHandle handle, List<EventSink> targets) {
        return start(handle, targets).join();
    }

    private CompletableFuture<Map<String, DeliveryStatus>> start(LogHandle handle, List<EventSink> targets) {
        String key = handle.idempotencyKey();
        if (!inFlight.add(key)) {
            log.debug("Dispatch already running for {}", key);
            return CompletableFuture.completedFuture(Map.of());
        }

        Map<String, CompletableFuture<DeliveryStatus>> deliveries = new LinkedHashMap<>();
        try {
            for (EventSink sink : targets) {
                if (!sink.accepts(handle)) {
                    log.debug("Sink {} declined {} ({})", sink.name(), key, handle.record().eventType());
                    continue;
                }
                deliveries.put(sink.name(),
                        CompletableFuture.supplyAsync(() -> deliver(handle, sink), dispatchExecutor));
            }
        } catch (RejectedExecutionException e) {
            log.error("Dispatcher is shutting down, {} left for recovery", key, e);
            inFlight.remove(key);
            return CompletableFuture.completedFuture(Map.of());
        }

        return CompletableFuture.allOf(deliveries.values().toArray(CompletableFuture[]::new))
                .handle((ignored, error) -> {
                    inFlight.remove(key);
                    Map<String, DeliveryStatus> statuses = new LinkedHashMap<>();
                    deliveries.forEach((sinkName, delivery) -> {
                        if (!delivery.isCompletedExceptionally()) {
                            statuses.put(sinkName, delivery.join());
                        }
                    });
                    if (error != null) {
                        log.error("Dispatch of {} incomplete, left for recovery", key, error);
                    } else {
                        completeDispatch(key);
                    }
                    return statuses;
                });
    }

    private DeliveryStatus deliver(LogHandle handle, EventSink sink) {
        String key = handle.idempotencyKey();
        String sinkName = sink.name();

        Optional<DeliveryStatus> previous = deliveryLedger.find(key, sinkName);
        if (previous.isPresent() && previous.get().isDelivered()) {
            log.debug("Skipping {} for {}: already delivered", sinkName, key);
            return previous.get();
        }
        deliveryLedger.record(key, sinkName, DeliveryStatus.pending());

        String lastError = null;
        int maxAttempts = retryPolicy.maxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                invokeWithTimeout(sink, handle);
                DeliveryStatus delivered = DeliveryStatus.delivered(attempt);
                deliveryLedger.record(key, sinkName, delivered);
                increment("webhook.sink.delivered", sinkName);
                log.info("Delivered {} to {} (attempt {})", key, sinkName, attempt);
                return delivered;
            } catch (SinkDeliveryException | TimeoutException e) {
                lastError = describe(e);
                increment("webhook.sink.attempt.failed", sinkName);
                log.warn("Attempt {}/{} delivering {} to {} failed: {}", attempt, maxAttempts, key, sinkName,
                        lastError);
            }
            if (attempt < maxAttempts) {
                pause(retryPolicy.backoffAfter(attempt));
            }
        }

        DeliveryStatus failed = DeliveryStatus.failed(lastError, maxAttempts);
        deliveryLedger.record(key, sinkName, failed);
        increment("webhook.sink.failed", sinkName);
        log.error("Giving up delivering {} to {} after {} attempts: {}", key, sinkName, maxAttempts, lastError);
        return failed;
    }

    private void invokeWithTimeout(EventSink sink, LogHandle handle) throws SinkDeliveryException, TimeoutException {
        Future<Void> call;
        try {
            call = callExecutor.submit(() -> {
                sink.deliver(handle);
                return null;
            });
        } catch (RejectedExecutionException e) {
            throw new SinkDeliveryException("No sink call thread available", e);
        }
        try {
            call.get(retryPolicy.callTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new TimeoutException("Timed out after " + retryPolicy.callTimeout().toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SinkDeliveryException sinkFailure) {
                throw sinkFailure;
            }
            throw new SinkDeliveryException("Unexpected sink error: " + cause, cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new DispatchInterruptedException(e);
        }
    }

    private void pause(Duration backoff) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchInterruptedException(e);
        }
    }

    private void completeDispatch(String key) {
        try {
            durabilityLog.markDispatched(key);
        } catch (DurabilityException e) {
            log.warn("Could not mark {} dispatched; recovery will revisit it", key, e);
        }
    }

    private void increment(String name, String sinkName) {
        Counter.builder(name)
                .tag("sink", sinkName)
                .register(meterRegistry)
                .increment();
    }

    private static String describe(Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        Throwable cause = e.getCause();
        if (cause != null && cause.getMessage() != null && !message.contains(cause.getMessage())) {
            return message + ": " + cause.getMessage();
        }
        return message;
    }

    @PreDestroy
    public void shutdown() {
        dispatchExecutor.shutdown();
        try {
            if (!dispatchExecutor.awaitTermination(retryPolicy.callTimeout().toMillis() * 2, TimeUnit.MILLISECONDS)) {
                log.warn("Sink dispatch still running at shutdown; unfinished events are left for recovery");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            dispatchExecutor.shutdownNow();
            callExecutor.shutdownNow();
        }
    }

    /** Dispatch thread interrupted mid-delivery; the ledger row stays PENDING. */
    private static class DispatchInterruptedException extends RuntimeException {
        DispatchInterruptedException(InterruptedException cause) {
            super("Sink dispatch interrupted", cause);
        }
    }
}
