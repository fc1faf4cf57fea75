package com.williamcallahan.keycoordinator.service.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * Maximum cost allowed per fixed window for one resource.
 *
 * @param limit maximum summed cost per window
 * @param window window length
 */
public record RateLimitRule(long limit, Duration window) {

    public RateLimitRule {
        Objects.requireNonNull(window, "window");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative");
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
    }
}
