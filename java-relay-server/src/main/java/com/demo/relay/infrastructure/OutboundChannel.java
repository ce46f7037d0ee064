package com.demo.relay.infrastructure;

import com.demo.relay.domain.ChatMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded delivery queue for one connected session.
 *
 * Producers never block: when the queue is full the offered message is dropped for this
 * recipient only. The single consumer is the stream pump that owns the HTTP response.
 */
public class OutboundChannel {

    // Wakes a consumer blocked in next() once the channel is closed.
    private static final ChatMessage CLOSED = ChatMessage.system("");

    private final String sessionId;
    private final BlockingQueue<ChatMessage> queue;
    private final Instant openedAt;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicLong dropped = new AtomicLong();

    public OutboundChannel(String sessionId, int capacity, Instant openedAt) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be > 0");
        }
        this.sessionId = sessionId;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.openedAt = openedAt;
    }

    /**
     * @return false when the channel is closed or its queue is full
     */
    boolean offer(ChatMessage message) {
        if (closed.get()) {
            return false;
        }
        if (queue.offer(message)) {
            return true;
        }
        dropped.incrementAndGet();
        return false;
    }

    /**
     * Waits up to {@code timeout} for the next message. Empty on timeout or once closed.
     */
    public Optional<ChatMessage> next(Duration timeout) throws InterruptedException {
        if (closed.get()) {
            return Optional.empty();
        }
        ChatMessage message = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (message == null || message == CLOSED || closed.get()) {
            return Optional.empty();
        }
        return Optional.of(message);
    }

    /**
     * Idempotent. Pending messages are discarded.
     */
    public void close() {
        if (closed.compareAndSet(false, true)) {
            queue.clear();
            queue.offer(CLOSED);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public String getSessionId() {
        return sessionId;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public int pending() {
        return closed.get() ? 0 : queue.size();
    }

    public long droppedCount() {
        return dropped.get();
    }
}
