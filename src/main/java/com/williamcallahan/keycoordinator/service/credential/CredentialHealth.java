package com.williamcallahan.keycoordinator.service.credential;

import com.williamcallahan.keycoordinator.domain.credential.CredentialSnapshot;
import com.williamcallahan.keycoordinator.domain.failure.ErrorCategory;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/**
 * Tracks request, error and cooldown state for one credential.
 *
 * <p>Not thread-safe on its own; every access happens under the owning pool's lock.</p>
 */
final class CredentialHealth {
    private long requestCount;
    private long errorCount;
    private Instant disabledUntil;
    private Instant lastUsedAt;
    private long lastUsedSequence;
    private ErrorCategory lastFailureCategory;

    boolean isCoolingDown(Instant now) {
        return disabledUntil != null && now.isBefore(disabledUntil);
    }

    boolean isPermanentlyDisabled() {
        return Instant.MAX.equals(disabledUntil);
    }

    ErrorCategory lastFailureCategory() {
        return lastFailureCategory;
    }

    Instant lastUsedAt() {
        return lastUsedAt;
    }

    long lastUsedSequence() {
        return lastUsedSequence;
    }

    Instant disabledUntil() {
        return disabledUntil;
    }

    long requestCount() {
        return requestCount;
    }

    long errorCount() {
        return errorCount;
    }

    /**
     * Drops a disablement whose window has already passed. Idempotent.
     */
    void clearIfElapsed(Instant now) {
        if (disabledUntil != null && !now.isBefore(disabledUntil)) {
            disabledUntil = null;
        }
    }

    void clearDisablement() {
        disabledUntil = null;
    }

    void markUsed(Instant now, long sequence) {
        lastUsedAt = now;
        lastUsedSequence = sequence;
    }

    void recordSuccess(Instant now, long sequence) {
        requestCount++;
        clearIfElapsed(now);
        markUsed(now, sequence);
    }

    /**
     * Extends the cooldown to {@code now + cooldown}; an earlier deadline never replaces a later one.
     *
     * @param cooldown cooldown length, or null for a permanent disablement
     * @return the effective disabled-until instant after the update
     */
    Instant disable(Instant now, Duration cooldown, ErrorCategory category) {
        errorCount++;
        if (category != null) {
            lastFailureCategory = category;
        }
        Instant candidate = cooldown == null ? Instant.MAX : saturatingPlus(now, cooldown);
        if (disabledUntil == null || candidate.isAfter(disabledUntil)) {
            disabledUntil = candidate;
        }
        return disabledUntil;
    }

    CredentialSnapshot snapshot(String maskedId, Instant now) {
        boolean coolingDown = isCoolingDown(now);
        return new CredentialSnapshot(
                maskedId,
                requestCount,
                errorCount,
                coolingDown,
                coolingDown ? disabledUntil : null,
                isPermanentlyDisabled(),
                lastUsedAt,
                lastFailureCategory);
    }

    private static Instant saturatingPlus(Instant now, Duration cooldown) {
        try {
            return now.plus(cooldown);
        } catch (DateTimeException | ArithmeticException overflow) {
            return Instant.MAX;
        }
    }
}
