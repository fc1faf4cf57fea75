package com.williamcallahan.keycoordinator.domain.credential;

import com.williamcallahan.keycoordinator.domain.failure.ErrorCategory;
import java.time.Instant;

/**
 * Point-in-time view of one pooled credential, safe to expose on diagnostics endpoints.
 *
 * @param maskedId masked credential prefix, never the full secret
 * @param requestCount successful requests recorded for the credential
 * @param errorCount failures recorded for the credential
 * @param disabled whether the credential is cooling down at snapshot time
 * @param disabledUntil end of the cooldown, or null when never disabled or already cleared
 * @param permanentlyDisabled whether the cooldown never expires (authentication failures)
 * @param lastUsedAt last selection or success time, or null when never used
 * @param lastFailureCategory category of the most recent failure, or null
 */
public record CredentialSnapshot(
        String maskedId,
        long requestCount,
        long errorCount,
        boolean disabled,
        Instant disabledUntil,
        boolean permanentlyDisabled,
        Instant lastUsedAt,
        ErrorCategory lastFailureCategory) {}
