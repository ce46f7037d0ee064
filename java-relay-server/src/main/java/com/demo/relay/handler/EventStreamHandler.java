package com.demo.relay.handler;

import com.demo.relay.domain.ChatMessage;
import com.demo.relay.infrastructure.OutboundChannel;
import com.demo.relay.infrastructure.SessionRegistry;
import com.demo.relay.service.MetricsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the lifecycle of one server-sent event stream per connected session.
 *
 * Opening a stream registers a channel and starts a pump task that drains it into the
 * emitter. Whichever way the stream ends (client gone, write failure, timeout, replacement
 * by a newer stream, explicit leave) the pump completes the emitter and the channel is
 * unregistered, if it is still the current one.
 */
@Slf4j
@Component
public class EventStreamHandler {

    private final SessionRegistry sessionRegistry;
    private final ObjectMapper objectMapper;
    private final ExecutorService streamExecutor;
    private final MetricsService metricsService;
    private final Duration heartbeatInterval;
    private final long timeoutMillis;

    public EventStreamHandler(SessionRegistry sessionRegistry,
                              ObjectMapper objectMapper,
                              ExecutorService streamExecutor,
                              MetricsService metricsService,
                              @Value("${relay.stream.heartbeat-interval:15s}") Duration heartbeatInterval,
                              @Value("${relay.stream.timeout:0}") Duration timeout) {
        this.sessionRegistry = sessionRegistry;
        this.objectMapper = objectMapper;
        this.streamExecutor = streamExecutor;
        this.metricsService = metricsService;
        this.heartbeatInterval = heartbeatInterval;
        this.timeoutMillis = timeout.toMillis();
    }

    public SseEmitter open(String sessionId) {
        return attach(sessionId, new SseEmitter(timeoutMillis));
    }

    SseEmitter attach(String sessionId, SseEmitter emitter) {
        OutboundChannel channel = sessionRegistry.register(sessionId);

        emitter.onCompletion(() -> sessionRegistry.unregister(sessionId, channel));
        emitter.onTimeout(() -> {
            log.debug("Stream timed out: sessionId={}", sessionId);
            sessionRegistry.unregister(sessionId, channel);
            emitter.complete();
        });
        emitter.onError(error -> {
            log.debug("Stream error: sessionId={}, error={}", sessionId, error.toString());
            sessionRegistry.unregister(sessionId, channel);
        });

        try {
            streamExecutor.execute(() -> pump(sessionId, channel, emitter));
        } catch (RejectedExecutionException e) {
            log.error("Could not start stream pump: sessionId={}", sessionId, e);
            metricsService.recordError("PUMP_REJECTED", "EventStreamHandler");
            sessionRegistry.unregister(sessionId, channel);
            emitter.completeWithError(e);
        }
        return emitter;
    }

    void pump(String sessionId, OutboundChannel channel, SseEmitter emitter) {
        try {
            while (!channel.isClosed()) {
                Optional<ChatMessage> next = channel.next(heartbeatInterval);
                if (channel.isClosed()) {
                    break;
                }
                if (next.isPresent()) {
                    emitter.send(SseEmitter.event().data(objectMapper.writeValueAsString(next.get())));
                } else {
                    emitter.send(SseEmitter.event().comment("heartbeat"));
                }
            }
        } catch (IOException | IllegalStateException e) {
            // client went away or the emitter was already completed
            log.debug("Stream write failed: sessionId={}, error={}", sessionId, e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Stream pump failed: sessionId={}", sessionId, e);
            metricsService.recordError("PUMP_FAILURE", "EventStreamHandler");
        } finally {
            sessionRegistry.unregister(sessionId, channel);
            emitter.complete();
        }
    }
}
