package com.demo.relay.infrastructure;

import com.demo.relay.MutableClock;
import com.demo.relay.domain.ChatMessage;
import com.demo.relay.service.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionRegistryTest {

    private MetricsService metrics;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        metrics = new MetricsService();
        registry = new SessionRegistry(4, metrics, new MutableClock(Instant.EPOCH));
    }

    @Test
    void broadcastReachesEveryRegisteredSession() throws InterruptedException {
        OutboundChannel a = registry.register("a");
        OutboundChannel b = registry.register("b");

        assertEquals(2, registry.broadcast(ChatMessage.system("hello")));

        assertEquals("hello", a.next(Duration.ofMillis(10)).orElseThrow().getContent());
        assertEquals("hello", b.next(Duration.ofMillis(10)).orElseThrow().getContent());
        assertEquals(2, metrics.getGaugeValue("relay.streams.active"));
    }

    @Test
    void unicastToOfflineSessionIsNoOp() {
        OutboundChannel a = registry.register("a");

        assertFalse(registry.unicast("nobody", ChatMessage.privateNotice("psst")));
        assertEquals(0, a.pending());
    }

    @Test
    void unicastOnlyReachesTarget() throws InterruptedException {
        OutboundChannel a = registry.register("a");
        OutboundChannel b = registry.register("b");

        assertTrue(registry.unicast("b", ChatMessage.privateNotice("psst")));

        assertEquals(0, a.pending());
        assertTrue(b.next(Duration.ofMillis(10)).orElseThrow().isPrivateMessage());
        assertEquals(1, metrics.getCounterValue("relay.messages.unicast{queued=true}"));
    }

    @Test
    void reRegisterClosesPreviousChannel() {
        OutboundChannel first = registry.register("a");
        OutboundChannel second = registry.register("a");

        assertTrue(first.isClosed());
        assertFalse(second.isClosed());
        assertEquals(1, registry.activeCount());

        registry.broadcast(ChatMessage.system("hi"));
        assertEquals(1, second.pending());
    }

    @Test
    void staleChannelCannotEvictItsSuccessor() {
        OutboundChannel first = registry.register("a");
        OutboundChannel second = registry.register("a");

        assertFalse(registry.unregister("a", first));
        assertTrue(registry.isRegistered("a"));

        assertTrue(registry.unregister("a", second));
        assertFalse(registry.isRegistered("a"));
        assertTrue(second.isClosed());
    }

    @Test
    void unregisterIsIdempotent() {
        OutboundChannel a = registry.register("a");

        registry.unregister("a");
        registry.unregister("a");

        assertTrue(a.isClosed());
        assertEquals(0, registry.activeCount());
        assertEquals(1, metrics.getCounterValue("relay.streams.closed"));
    }

    @Test
    void fullQueueDropsOnlyForSlowRecipient() throws InterruptedException {
        OutboundChannel slow = registry.register("slow");
        OutboundChannel fast = registry.register("fast");

        for (int i = 0; i < 6; i++) {
            registry.broadcast(ChatMessage.system("m" + i));
            fast.next(Duration.ofMillis(10));
        }

        assertEquals(4, slow.pending());
        assertEquals(2, slow.droppedCount());
        assertEquals(0, fast.droppedCount());
        assertEquals(2, metrics.getCounterValue("relay.deliveries.dropped{reason=queue_full}"));
    }

    @Test
    void concurrentProducersKeepPerProducerOrder() throws Exception {
        registry = new SessionRegistry(1000, metrics, new MutableClock(Instant.EPOCH));
        OutboundChannel reader = registry.register("reader");
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        for (String producer : List.of("p", "q")) {
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < 200; i++) {
                    registry.broadcast(ChatMessage.system(producer + i));
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        List<Integer> fromP = new ArrayList<>();
        List<Integer> fromQ = new ArrayList<>();
        Optional<ChatMessage> next;
        while ((next = reader.next(Duration.ofMillis(10))).isPresent()) {
            String content = next.get().getContent();
            int seq = Integer.parseInt(content.substring(1));
            (content.startsWith("p") ? fromP : fromQ).add(seq);
        }

        assertEquals(200, fromP.size());
        assertEquals(200, fromQ.size());
        for (int i = 0; i < 200; i++) {
            assertEquals(i, fromP.get(i));
            assertEquals(i, fromQ.get(i));
        }
    }
}
