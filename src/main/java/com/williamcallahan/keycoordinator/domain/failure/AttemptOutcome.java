package com.williamcallahan.keycoordinator.domain.failure;

/**
 * Result of one attempt inside a coordinated run.
 */
public enum AttemptOutcome {
    SUCCESS,
    CLASSIFIED_FAILURE,
    UNCLASSIFIED_FAILURE
}
