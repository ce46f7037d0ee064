package com.demo.relay.infrastructure;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mints session tokens and blob ids.
 *
 * If the random source fails the generator degrades to a clock-derived id that is still
 * unique within this process, so callers never see an error.
 */
@Slf4j
@Component
public class IdGenerator {

    private static final int SESSION_ID_BYTES = 32;
    private static final int BLOB_SUFFIX_BYTES = 4;

    private final Random random;
    private final Clock clock;
    private final AtomicLong lastFallback = new AtomicLong();

    @Autowired
    public IdGenerator(Clock clock) {
        this(new SecureRandom(), clock);
    }

    public IdGenerator(Random random, Clock clock) {
        this.random = random;
        this.clock = clock;
    }

    /**
     * Unguessable, URL and cookie safe session token.
     */
    public String sessionId() {
        byte[] bytes = new byte[SESSION_ID_BYTES];
        try {
            random.nextBytes(bytes);
        } catch (RuntimeException e) {
            log.warn("Random source failed while minting session id, using clock fallback", e);
            return fallbackId();
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * {@code <epochMillis>-<8 hex digits>}; sorts roughly by creation time.
     */
    public String blobId() {
        long millis = clock.millis();
        byte[] suffix = new byte[BLOB_SUFFIX_BYTES];
        try {
            random.nextBytes(suffix);
        } catch (RuntimeException e) {
            log.warn("Random source failed while minting blob id, using clock fallback", e);
            return fallbackId();
        }
        return millis + "-" + HexFormat.of().formatHex(suffix);
    }

    // Microsecond clock reading, bumped past the previous value so concurrent callers never collide.
    private String fallbackId() {
        long now = TimeUnit.MILLISECONDS.toMicros(clock.millis());
        long id = lastFallback.updateAndGet(previous -> Math.max(previous + 1, now));
        return Long.toString(id);
    }
}
