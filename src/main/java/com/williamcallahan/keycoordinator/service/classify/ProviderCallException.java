package com.williamcallahan.keycoordinator.service.classify;

import com.williamcallahan.keycoordinator.domain.failure.ProviderFailure;
import java.time.Duration;

/**
 * Raised by units of work that detect a provider failure themselves, for example an error payload
 * delivered with a successful HTTP status.
 */
public class ProviderCallException extends RuntimeException {
    private final int httpStatus;
    private final String providerCode;
    private final transient Duration retryAfter;

    /**
     * Creates an exception carrying the provider's status and error code.
     *
     * @param httpStatus HTTP status, or {@link ProviderFailure#NO_STATUS}
     * @param providerCode provider error code, may be null
     * @param message failure description
     */
    public ProviderCallException(int httpStatus, String providerCode, String message) {
        this(httpStatus, providerCode, message, null, null);
    }

    /**
     * Creates an exception with a retry hint and an underlying cause.
     */
    public ProviderCallException(
            int httpStatus, String providerCode, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
        this.providerCode = providerCode;
        this.retryAfter = retryAfter;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String providerCode() {
        return providerCode;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
