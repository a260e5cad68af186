package com.contactsbook.backend.global.web;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Fixed-window request counter per client key (the caller's ip address). Counters live in
 * process memory, so each instance enforces its own limit.
 */
@Component
public class ClientRateLimiter {

    private final int limit;
    private final Duration window;
    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public ClientRateLimiter(
            @Value("${app.rate-limit.me.requests:10}") int limit,
            @Value("${app.rate-limit.me.window:1m}") Duration window,
            Clock clock
    ) {
        if (limit < 1) {
            throw new IllegalArgumentException("app.rate-limit.me.requests must be positive");
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("app.rate-limit.me.window must be positive");
        }
        this.limit = limit;
        this.window = window;
        this.clock = clock;
    }

    /**
     * Counts the call against {@code key} and reports whether it fits in the current window.
     */
    public boolean allow(String key) {
        Instant now = clock.instant();
        boolean[] allowed = new boolean[1];
        windows.compute(key == null ? "unknown" : key, (k, current) -> {
            Window active = (current == null || !now.isBefore(current.resetAt))
                    ? new Window(now.plus(window))
                    : current;
            if (active.count < limit) {
                active.count++;
                allowed[0] = true;
            }
            return active;
        });
        return allowed[0];
    }

    private static final class Window {
        private final Instant resetAt;
        private int count;

        private Window(Instant resetAt) {
            this.resetAt = resetAt;
        }
    }
}
