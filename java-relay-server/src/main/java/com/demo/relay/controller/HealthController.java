package com.demo.relay.controller;

import com.demo.relay.infrastructure.SessionRegistry;
import com.demo.relay.service.BlobStore;
import com.demo.relay.service.SessionStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class HealthController {

    private final SessionRegistry sessionRegistry;
    private final SessionStore sessionStore;
    private final BlobStore blobStore;

    public HealthController(SessionRegistry sessionRegistry, SessionStore sessionStore, BlobStore blobStore) {
        this.sessionRegistry = sessionRegistry;
        this.sessionStore = sessionStore;
        this.blobStore = blobStore;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "healthy");
        response.put("activeStreams", sessionRegistry.activeCount());
        response.put("knownSessions", sessionStore.size());
        response.put("storedBlobs", blobStore.size());
        return response;
    }
}
