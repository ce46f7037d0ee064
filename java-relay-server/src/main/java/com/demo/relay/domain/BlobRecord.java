package com.demo.relay.domain;

import lombok.Value;

import java.time.Instant;

/**
 * Uploaded payload and its expiry, stored and evicted as one unit.
 */
@Value
public class BlobRecord {
    String id;
    byte[] bytes;
    Instant expiresAt;

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
