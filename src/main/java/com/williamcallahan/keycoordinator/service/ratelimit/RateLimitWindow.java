package com.williamcallahan.keycoordinator.service.ratelimit;

import java.time.Instant;

/**
 * Usage counter for one {@code (resource, identifier)} pair within its current window.
 *
 * <p>Mutated only inside {@code ConcurrentHashMap.compute} for its key.</p>
 */
final class RateLimitWindow {
    private final RateLimitRule rule;
    private Instant windowStart;
    private long count;

    RateLimitWindow(RateLimitRule rule, Instant windowStart) {
        this.rule = rule;
        this.windowStart = windowStart;
    }

    boolean isExpired(Instant now) {
        return !now.isBefore(windowEnd());
    }

    void resetIfExpired(Instant now) {
        if (isExpired(now)) {
            windowStart = now;
            count = 0;
        }
    }

    boolean fits(long cost) {
        return cost <= rule.limit() - count;
    }

    void consume(long cost) {
        count += cost;
    }

    void release(long cost) {
        count = Math.max(0, count - cost);
    }

    long remaining() {
        return Math.max(0, rule.limit() - count);
    }

    Instant windowEnd() {
        return windowStart.plus(rule.window());
    }
}
