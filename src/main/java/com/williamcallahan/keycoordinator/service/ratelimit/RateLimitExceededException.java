package com.williamcallahan.keycoordinator.service.ratelimit;

import java.time.Duration;

/**
 * Thrown when a rate-limit check would push a window past its limit. Nothing was consumed.
 */
public class RateLimitExceededException extends RuntimeException {
    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final String resource;
    private final String identifier;
    private final transient Duration retryAfter;

    public RateLimitExceededException(String resource, String identifier, Duration retryAfter) {
        super("Rate limit exceeded for " + resource + "; retry after " + ceilMillis(retryAfter) + "ms");
        this.resource = resource;
        this.identifier = identifier;
        this.retryAfter = retryAfter;
    }

    public String resource() {
        return resource;
    }

    public String identifier() {
        return identifier;
    }

    public Duration retryAfter() {
        return retryAfter;
    }

    /**
     * Returns the wait in milliseconds, rounded up so a pending window never reports zero.
     */
    public long retryAfterMs() {
        return ceilMillis(retryAfter);
    }

    /**
     * Returns the wait in whole seconds, rounded up, for a {@code Retry-After} header.
     */
    public long retryAfterSeconds() {
        return Math.max(1, (retryAfterMs() + 999) / 1000);
    }

    private static long ceilMillis(Duration duration) {
        long millis = duration.toMillis();
        if (duration.minusMillis(millis).isZero()) {
            return Math.max(1, millis);
        }
        return millis + 1;
    }
}
