package com.williamcallahan.keycoordinator.web;

import java.util.Objects;

/**
 * Error payload for rejected, unconfigured or exhausted coordinator calls.
 *
 * @param status always {@code "error"}
 * @param message user-facing error message
 * @param details diagnostics such as the remaining wait, when available
 */
public record ApiErrorResponse(String status, String message, String details) implements ApiResponse {
    private static final String STATUS_ERROR = "error";

    public ApiErrorResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(message, "Error message is required");
    }

    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse(STATUS_ERROR, message, null);
    }

    /**
     * Creates an error payload that carries diagnostics.
     *
     * @param message user-facing error message
     * @param details diagnostics suitable for clients
     * @return error payload
     */
    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse(STATUS_ERROR, message, details);
    }
}
