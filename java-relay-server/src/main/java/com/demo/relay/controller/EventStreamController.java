package com.demo.relay.controller;

import com.demo.relay.handler.EventStreamHandler;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
public class EventStreamController {

    private final EventStreamHandler eventStreamHandler;
    private final SessionCookieResolver sessionCookieResolver;

    public EventStreamController(EventStreamHandler eventStreamHandler,
                                 SessionCookieResolver sessionCookieResolver) {
        this.eventStreamHandler = eventStreamHandler;
        this.sessionCookieResolver = sessionCookieResolver;
    }

    /**
     * Live stream, one {@code data:} frame per message
     * GET /events
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(HttpServletRequest request, HttpServletResponse response) {
        String sessionId = sessionCookieResolver.resolve(request, response);
        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-cache");
        return eventStreamHandler.open(sessionId);
    }
}
