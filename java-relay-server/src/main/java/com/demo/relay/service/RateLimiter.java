package com.demo.relay.service;

import com.demo.relay.domain.RateDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-session strike counter for message submissions.
 *
 * A submission arriving less than {@code window} after the last accepted one adds a strike.
 * Below {@code threshold} strikes it is still accepted. At the threshold it is refused and the
 * last accepted time stays put, so the session remains blocked until it pauses for a full
 * window, which clears the strikes. This is a leaky counter rather than a token bucket: a
 * sustained burst ends in a hard stop instead of a reduced rate.
 */
@Slf4j
@Service
public class RateLimiter {

    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();
    private final Duration window;
    private final int threshold;

    public RateLimiter(@Value("${relay.rate-limit.window:2s}") Duration window,
                       @Value("${relay.rate-limit.threshold:5}") int threshold) {
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Rate limit window must be positive");
        }
        if (threshold < 1) {
            throw new IllegalArgumentException("Rate limit threshold must be > 0");
        }
        this.window = window;
        this.threshold = threshold;
    }

    public RateDecision admit(String sessionId, Instant now) {
        RateDecision[] decision = new RateDecision[1];
        windows.compute(sessionId, (id, current) -> {
            if (current == null || !isInsideWindow(current.lastAcceptedAt, now)) {
                decision[0] = RateDecision.ALLOW;
                return new Window(now, 0);
            }
            int strikes = current.strikes + 1;
            if (strikes >= threshold) {
                decision[0] = RateDecision.THROTTLE;
                return new Window(current.lastAcceptedAt, strikes);
            }
            decision[0] = RateDecision.ALLOW;
            return new Window(now, strikes);
        });

        if (decision[0] == RateDecision.THROTTLE) {
            log.debug("Throttling session: sessionId={}, strikes={}", sessionId, strikes(sessionId));
        }
        return decision[0];
    }

    public int strikes(String sessionId) {
        Window current = windows.get(sessionId);
        return current != null ? current.strikes : 0;
    }

    private boolean isInsideWindow(Instant lastAcceptedAt, Instant now) {
        return Duration.between(lastAcceptedAt, now).compareTo(window) < 0;
    }

    private static final class Window {
        private final Instant lastAcceptedAt;
        private final int strikes;

        private Window(Instant lastAcceptedAt, int strikes) {
            this.lastAcceptedAt = lastAcceptedAt;
            this.strikes = strikes;
        }
    }
}
