package com.demo.relay.infrastructure;

import com.demo.relay.domain.ChatMessage;
import com.demo.relay.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live registrations: at most one {@link OutboundChannel} per connected session id.
 *
 * Broadcast and unicast only enqueue, so a slow recipient never delays the caller or the
 * other recipients. Messages from one caller reach each queue in call order.
 */
@Slf4j
@Component
public class SessionRegistry {

    private final ConcurrentHashMap<String, OutboundChannel> channels = new ConcurrentHashMap<>();
    private final int queueCapacity;
    private final MetricsService metricsService;
    private final Clock clock;

    public SessionRegistry(@Value("${relay.delivery.queue-capacity:256}") int queueCapacity,
                           MetricsService metricsService,
                           Clock clock) {
        this.queueCapacity = queueCapacity;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Creates a fresh channel for {@code sessionId}, closing any channel it replaces.
     */
    public OutboundChannel register(String sessionId) {
        OutboundChannel fresh = new OutboundChannel(sessionId, queueCapacity, clock.instant());
        OutboundChannel previous = channels.put(sessionId, fresh);
        if (previous != null) {
            previous.close();
            log.info("Stream replaced: sessionId={}, previousOpenedAt={}", sessionId, previous.getOpenedAt());
        }

        metricsService.recordStreamOpened(sessionId);
        metricsService.setGaugeValue("relay.streams.active", channels.size());
        log.info("Stream registered: sessionId={}, total={}", sessionId, channels.size());
        return fresh;
    }

    /**
     * Removes and closes whatever channel is registered for {@code sessionId}. No-op if none.
     */
    public void unregister(String sessionId) {
        OutboundChannel removed = channels.remove(sessionId);
        if (removed == null) {
            return;
        }
        closeRemoved(removed);
    }

    /**
     * Removes {@code channel} only while it is still the current registration, so a stream
     * that was already replaced cannot evict its successor. The channel is closed either way.
     */
    public boolean unregister(String sessionId, OutboundChannel channel) {
        if (channels.remove(sessionId, channel)) {
            closeRemoved(channel);
            return true;
        }
        channel.close();
        return false;
    }

    /**
     * @return number of recipients the message was queued for
     */
    public int broadcast(ChatMessage message) {
        int queued = 0;
        for (OutboundChannel channel : channels.values()) {
            if (deliver(channel, message)) {
                queued++;
            }
        }
        metricsService.recordBroadcast(queued);
        log.debug("Broadcast queued: recipients={}, kind={}", queued, message.getKind());
        return queued;
    }

    /**
     * Queues {@code message} for one session. An offline target is not an error.
     *
     * @return true if the message was queued
     */
    public boolean unicast(String sessionId, ChatMessage message) {
        OutboundChannel channel = channels.get(sessionId);
        if (channel == null) {
            log.debug("Unicast skipped, session offline: sessionId={}", sessionId);
            return false;
        }
        boolean queued = deliver(channel, message);
        metricsService.recordUnicast(queued);
        return queued;
    }

    public boolean isRegistered(String sessionId) {
        return channels.containsKey(sessionId);
    }

    public int activeCount() {
        return channels.size();
    }

    private boolean deliver(OutboundChannel channel, ChatMessage message) {
        if (channel.offer(message)) {
            return true;
        }
        if (!channel.isClosed()) {
            metricsService.recordDeliveryDropped(channel.getSessionId());
            log.debug("Delivery dropped, queue full: sessionId={}, dropped={}",
                    channel.getSessionId(), channel.droppedCount());
        }
        return false;
    }

    private void closeRemoved(OutboundChannel channel) {
        channel.close();
        metricsService.recordStreamClosed(channel.getSessionId(),
                Duration.between(channel.getOpenedAt(), clock.instant()));
        metricsService.setGaugeValue("relay.streams.active", channels.size());
        log.info("Stream unregistered: sessionId={}, total={}", channel.getSessionId(), channels.size());
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing {} open streams", channels.size());
        channels.forEach((sessionId, channel) -> {
            if (channels.remove(sessionId, channel)) {
                channel.close();
            }
        });
    }
}
