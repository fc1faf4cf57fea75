package com.williamcallahan.keycoordinator.service.retry;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import java.time.Duration;
import java.util.Objects;

/**
 * Per-run settings for {@link RetryCoordinator#executeWithRetry}.
 *
 * @param provider provider whose pool supplies credentials
 * @param maxAttempts maximum unit-of-work invocations; 0 means one per pooled credential
 * @param maxTotalDuration wall-clock budget checked before each further attempt, or null for none
 * @param operation short label used in logs
 */
public record RetryOptions(ApiProvider provider, int maxAttempts, Duration maxTotalDuration, String operation) {

    public RetryOptions {
        Objects.requireNonNull(provider, "provider");
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be non-negative");
        }
        if (maxTotalDuration != null && (maxTotalDuration.isNegative() || maxTotalDuration.isZero())) {
            throw new IllegalArgumentException("maxTotalDuration must be positive");
        }
        operation = operation == null || operation.isBlank() ? "call" : operation;
    }

    public static RetryOptions forProvider(ApiProvider provider) {
        return new RetryOptions(provider, 0, null, null);
    }

    public RetryOptions withMaxAttempts(int attempts) {
        return new RetryOptions(provider, attempts, maxTotalDuration, operation);
    }

    public RetryOptions withMaxTotalDuration(Duration budget) {
        return new RetryOptions(provider, maxAttempts, budget, operation);
    }

    public RetryOptions withOperation(String label) {
        return new RetryOptions(provider, maxAttempts, maxTotalDuration, label);
    }
}
