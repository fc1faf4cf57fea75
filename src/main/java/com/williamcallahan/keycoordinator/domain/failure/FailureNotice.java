package com.williamcallahan.keycoordinator.domain.failure;

/**
 * User-facing condition reported when every attempt of a coordinated call failed.
 */
public enum FailureNotice {
    HIGH_DEMAND("We're experiencing high demand right now. Please try again in a few moments."),
    SERVICE_UNAVAILABLE("This service is temporarily unavailable. Please try again later.");

    private final String message;

    FailureNotice(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
