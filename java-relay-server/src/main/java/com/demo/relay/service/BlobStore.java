package com.demo.relay.service;

import com.demo.relay.domain.BlobRecord;
import com.demo.relay.infrastructure.IdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Short-lived uploads. Expiry is enforced only by the periodic sweep; reads do not check it.
 */
@Slf4j
@Service
public class BlobStore {

    private final ConcurrentHashMap<String, BlobRecord> blobs = new ConcurrentHashMap<>();
    private final IdGenerator idGenerator;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Duration ttl;
    private final ScheduledExecutorService sweepExecutor;

    public BlobStore(IdGenerator idGenerator,
                     MetricsService metricsService,
                     Clock clock,
                     @Value("${relay.blob.ttl:1m}") Duration ttl,
                     @Value("${relay.blob.sweep-interval:30s}") Duration sweepInterval) {
        this.idGenerator = idGenerator;
        this.metricsService = metricsService;
        this.clock = clock;
        this.ttl = ttl;
        this.sweepExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "relay-blob-sweeper");
            thread.setDaemon(true);
            return thread;
        });

        long periodMillis = sweepInterval.toMillis();
        sweepExecutor.scheduleAtFixedRate(this::scheduledSweep, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Stores {@code bytes} until now + ttl.
     *
     * @return the generated blob id
     */
    public String put(byte[] bytes) {
        Instant expiresAt = clock.instant().plus(ttl);
        String id = idGenerator.blobId();
        blobs.put(id, new BlobRecord(id, bytes.clone(), expiresAt));
        metricsService.recordBlobStored(bytes.length);
        log.debug("Blob stored: id={}, size={}, expiresAt={}", id, bytes.length, expiresAt);
        return id;
    }

    /**
     * @return a copy of the stored bytes
     */
    public Optional<byte[]> get(String id) {
        BlobRecord record = blobs.get(id);
        return record == null ? Optional.empty() : Optional.of(record.getBytes().clone());
    }

    /**
     * Removes every blob whose expiry is at or before {@code now}.
     *
     * @return number of blobs removed
     */
    public int sweep(Instant now) {
        int removed = 0;
        for (Map.Entry<String, BlobRecord> entry : blobs.entrySet()) {
            if (entry.getValue().isExpiredAt(now) && blobs.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            metricsService.recordBlobsSwept(removed);
            log.info("Blob sweep removed {} expired blobs, {} remaining", removed, blobs.size());
        }
        return removed;
    }

    public int size() {
        return blobs.size();
    }

    private void scheduledSweep() {
        try {
            sweep(clock.instant());
        } catch (Exception e) {
            log.error("Error during blob sweep", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down BlobStore sweeper...");
        sweepExecutor.shutdown();
        try {
            if (!sweepExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                sweepExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweepExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
