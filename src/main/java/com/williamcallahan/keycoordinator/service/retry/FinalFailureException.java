package com.williamcallahan.keycoordinator.service.retry;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.domain.failure.FailureClassification;
import com.williamcallahan.keycoordinator.domain.failure.FailureNotice;
import com.williamcallahan.keycoordinator.domain.failure.RetryAttempt;
import java.util.List;

/**
 * Thrown when a coordinated run ends without a successful attempt.
 */
public class FinalFailureException extends RuntimeException {
    private final transient ApiProvider provider;
    private final transient FailureClassification lastClassification;
    private final int attemptsMade;
    private final transient List<RetryAttempt> attempts;

    public FinalFailureException(
            ApiProvider provider,
            FailureClassification lastClassification,
            List<RetryAttempt> attempts,
            Throwable lastError) {
        super(buildMessage(provider, lastClassification, attempts.size()), lastError);
        this.provider = provider;
        this.lastClassification = lastClassification;
        this.attemptsMade = attempts.size();
        this.attempts = List.copyOf(attempts);
    }

    public ApiProvider provider() {
        return provider;
    }

    /**
     * Returns the classification of the last failed attempt, or null when no attempt ran.
     */
    public FailureClassification lastClassification() {
        return lastClassification;
    }

    public int attemptsMade() {
        return attemptsMade;
    }

    public List<RetryAttempt> attempts() {
        return attempts;
    }

    /**
     * Returns the user-facing condition for this failure.
     */
    public FailureNotice notice() {
        return lastClassification == null
                ? FailureNotice.SERVICE_UNAVAILABLE
                : lastClassification.category().notice();
    }

    private static String buildMessage(ApiProvider provider, FailureClassification classification, int attempts) {
        String last = classification == null ? "none" : classification.category().key();
        return "[" + provider.getName() + "] Gave up after " + attempts + " attempt(s), last failure: " + last;
    }
}
