package com.williamcallahan.keycoordinator.domain.failure;

import java.time.Duration;

/**
 * Record of a single attempt made during one coordinated run. Never persisted.
 *
 * @param attemptNumber one-based attempt index
 * @param credentialId masked id of the credential used
 * @param forcedReuse whether the credential was handed out while every key was cooling down
 * @param outcome attempt outcome
 * @param category failure category, or null on success
 * @param elapsed time spent inside the unit of work
 */
public record RetryAttempt(
        int attemptNumber,
        String credentialId,
        boolean forcedReuse,
        AttemptOutcome outcome,
        ErrorCategory category,
        Duration elapsed) {}
