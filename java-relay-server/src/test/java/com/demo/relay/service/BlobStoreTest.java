package com.demo.relay.service;

import com.demo.relay.MutableClock;
import com.demo.relay.infrastructure.IdGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class BlobStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final MetricsService metrics = new MetricsService();
    private final BlobStore store = new BlobStore(new IdGenerator(clock), metrics, clock,
            Duration.ofMinutes(1), Duration.ofHours(1));

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    @Test
    void putThenGetReturnsSameBytes() {
        byte[] bytes = {1, 2, 3};
        String id = store.put(bytes);

        assertArrayEquals(bytes, store.get(id).orElseThrow());
        assertEquals(1, metrics.getCounterValue("relay.blobs.stored"));
    }

    @Test
    void storedBytesCannotBeChangedByCallers() {
        byte[] bytes = {1, 2, 3};
        String id = store.put(bytes);
        bytes[0] = 9;
        store.get(id).orElseThrow()[1] = 9;

        assertArrayEquals(new byte[]{1, 2, 3}, store.get(id).orElseThrow());
    }

    @Test
    void unknownIdIsEmpty() {
        assertTrue(store.get("nope").isEmpty());
    }

    @Test
    void readsDoNotCheckExpiry() {
        String id = store.put(new byte[]{7});
        clock.advance(Duration.ofMinutes(5));

        assertTrue(store.get(id).isPresent());
    }

    @Test
    void sweepRemovesOnlyExpiredBlobs() {
        String old = store.put(new byte[]{1});
        clock.advance(Duration.ofSeconds(30));
        String fresh = store.put(new byte[]{2});
        clock.advance(Duration.ofSeconds(30));

        // old expires exactly now
        assertEquals(1, store.sweep(clock.instant()));

        assertTrue(store.get(old).isEmpty());
        assertTrue(store.get(fresh).isPresent());
        assertEquals(1, metrics.getCounterValue("relay.blobs.swept"));
    }

    @Test
    void sweepWithNothingExpiredRemovesNothing() {
        store.put(new byte[]{1});
        assertEquals(0, store.sweep(clock.instant()));
        assertEquals(1, store.size());
    }
}
