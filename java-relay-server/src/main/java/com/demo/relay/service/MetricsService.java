package com.demo.relay.service;

import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Log-backed counters and gauges for the relay.
 *
 * Tagged counters are kept under {@code name{key=value,...}} so each dimension can be read
 * back separately.
 */
@Service
@Slf4j
public class MetricsService {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> gauges = new ConcurrentHashMap<>();

    // ===== Counters =====

    public void incrementCounter(String name) {
        long count = counters.computeIfAbsent(name, k -> new AtomicLong()).incrementAndGet();
        log.debug("[METRIC] Counter: {} = {}", name, count);
    }

    public void incrementCounter(String name, Tags tags) {
        incrementCounter(name + tags.stream()
                .map(tag -> tag.getKey() + "=" + tag.getValue())
                .collect(Collectors.joining(",", "{", "}")));
    }

    public void addToCounter(String name, long delta) {
        long count = counters.computeIfAbsent(name, k -> new AtomicLong()).addAndGet(delta);
        log.debug("[METRIC] Counter: {} = {}", name, count);
    }

    // ===== Gauges =====

    public void setGaugeValue(String name, int value) {
        gauges.computeIfAbsent(name, k -> new AtomicInteger()).set(value);
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    // ===== Relay metrics =====

    public void recordStreamOpened(String sessionId) {
        incrementCounter("relay.streams.opened");
        log.debug("Stream opened: sessionId={}", sessionId);
    }

    public void recordStreamClosed(String sessionId, Duration connected) {
        incrementCounter("relay.streams.closed");
        log.debug("Stream closed: sessionId={}, connected={}s", sessionId, connected.getSeconds());
    }

    public void recordBroadcast(int recipients) {
        incrementCounter("relay.messages.broadcast");
        addToCounter("relay.deliveries.queued", recipients);
    }

    public void recordUnicast(boolean queued) {
        incrementCounter("relay.messages.unicast", Tags.of("queued", Boolean.toString(queued)));
        if (queued) {
            addToCounter("relay.deliveries.queued", 1);
        }
    }

    public void recordDeliveryDropped(String sessionId) {
        incrementCounter("relay.deliveries.dropped", Tags.of("reason", "queue_full"));
    }

    public void recordThrottled(String sessionId) {
        incrementCounter("relay.messages.throttled");
        log.debug("Submission throttled: sessionId={}", sessionId);
    }

    public void recordBlobStored(int sizeBytes) {
        incrementCounter("relay.blobs.stored");
        addToCounter("relay.blobs.bytes", sizeBytes);
    }

    public void recordBlobsSwept(int count) {
        addToCounter("relay.blobs.swept", count);
    }

    public void recordError(String errorType, String component) {
        incrementCounter("relay.errors", Tags.of("type", errorType, "component", component));
        log.warn("Error recorded: type={}, component={}", errorType, component);
    }

    // ===== Read back =====

    public long getCounterValue(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    public int getGaugeValue(String name) {
        AtomicInteger gauge = gauges.get(name);
        return gauge != null ? gauge.get() : 0;
    }
}
