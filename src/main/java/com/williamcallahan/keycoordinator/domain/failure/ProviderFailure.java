package com.williamcallahan.keycoordinator.domain.failure;

import java.time.Duration;

/**
 * Provider-neutral description of a failed call, produced by normalizing SDK and HTTP exceptions.
 *
 * <p>Classification decisions read only this shape, so provider-specific parsing stays in the
 * normalizer.</p>
 *
 * @param httpStatus HTTP status code, or {@link #NO_STATUS} when the call never got a response
 * @param providerCode provider error code such as {@code queue_exceeded}, or null
 * @param message failure message for logs, never null
 * @param timeout whether the call timed out or failed at the transport layer
 * @param retryAfter provider-supplied wait hint, or null when absent
 */
public record ProviderFailure(int httpStatus, String providerCode, String message, boolean timeout, Duration retryAfter) {

    /** Marker for failures that carry no HTTP status. */
    public static final int NO_STATUS = 0;

    public ProviderFailure {
        message = message == null ? "" : message;
        if (retryAfter != null && retryAfter.isNegative()) {
            retryAfter = Duration.ZERO;
        }
    }

    /**
     * Creates a failure for a transport timeout or I/O error.
     */
    public static ProviderFailure timeout(String message) {
        return new ProviderFailure(NO_STATUS, null, message, true, null);
    }

    /**
     * Creates a failure with an HTTP status and optional provider code.
     */
    public static ProviderFailure ofStatus(int httpStatus, String providerCode, String message) {
        return new ProviderFailure(httpStatus, providerCode, message, false, null);
    }

    public boolean hasStatus() {
        return httpStatus != NO_STATUS;
    }

    /**
     * Returns a copy carrying the given retry hint.
     */
    public ProviderFailure withRetryAfter(Duration hint) {
        return new ProviderFailure(httpStatus, providerCode, message, timeout, hint);
    }
}
