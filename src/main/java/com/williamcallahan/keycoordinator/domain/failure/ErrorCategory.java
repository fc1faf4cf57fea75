package com.williamcallahan.keycoordinator.domain.failure;

import java.util.Locale;

/**
 * Closed set of provider failure categories that drive cooldown and retry decisions.
 */
public enum ErrorCategory {
    /** Provider-side "too many in-flight requests"; short and self-resolving. */
    QUEUE_EXCEEDED("queue_exceeded", true, FailureNotice.HIGH_DEMAND),
    /** Generic HTTP 429. */
    RATE_LIMITED("rate_limited", true, FailureNotice.HIGH_DEMAND),
    /** Hard quota or billing limit; resolves slowly. */
    QUOTA_EXHAUSTED("quota_exhausted", true, FailureNotice.HIGH_DEMAND),
    /** HTTP 5xx, timeouts and transport failures. */
    SERVER_ERROR("server_error", false, FailureNotice.SERVICE_UNAVAILABLE),
    /** HTTP 401/403; the key itself is bad. */
    AUTH_ERROR("auth_error", true, FailureNotice.SERVICE_UNAVAILABLE),
    UNCLASSIFIED("unclassified", false, FailureNotice.SERVICE_UNAVAILABLE);

    private final String key;
    private final boolean immediateRotation;
    private final FailureNotice notice;

    ErrorCategory(String key, boolean immediateRotation, FailureNotice notice) {
        this.key = key;
        this.immediateRotation = immediateRotation;
        this.notice = notice;
    }

    /**
     * Returns the snake_case identifier used in logs and configuration overrides.
     */
    public String key() {
        return key;
    }

    /**
     * Reports whether the next attempt may rotate to another key without backing off first.
     */
    public boolean rotatesImmediately() {
        return immediateRotation;
    }

    /**
     * Returns the user-facing notice when a run is exhausted on this category.
     */
    public FailureNotice notice() {
        return notice;
    }

    /**
     * Resolves a category from a configuration key such as {@code queue-exceeded} or {@code RATE_LIMITED}.
     *
     * @throws IllegalArgumentException when the key matches no category
     */
    public static ErrorCategory fromKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            throw new IllegalArgumentException("Error category key is required");
        }
        String normalized = rawKey.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ErrorCategory category : values()) {
            if (category.key.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown error category: " + rawKey);
    }
}
