package com.williamcallahan.keycoordinator.domain.failure;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of classifying one failed call.
 *
 * @param category failure category
 * @param cooldown how long the credential should be excluded; null means for the process lifetime
 * @param retryable whether another credential may be tried within the same run
 */
public record FailureClassification(ErrorCategory category, Duration cooldown, boolean retryable) {

    public FailureClassification {
        Objects.requireNonNull(category, "category");
        if (cooldown != null && cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must be non-negative");
        }
    }

    public boolean isPermanent() {
        return cooldown == null;
    }

    /**
     * Returns the cooldown in milliseconds, saturating to {@link Long#MAX_VALUE} for permanent cooldowns.
     */
    public long cooldownMs() {
        return cooldown == null ? Long.MAX_VALUE : cooldown.toMillis();
    }
}
