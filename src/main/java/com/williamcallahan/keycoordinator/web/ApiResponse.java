package com.williamcallahan.keycoordinator.web;

/**
 * Common contract for JSON payloads returned by the coordinator's API endpoints.
 *
 * <p>Every payload carries a status indicator so clients can branch on success and error uniformly.
 */
public sealed interface ApiResponse
        permits ApiErrorResponse, CompletionResponse, CredentialStatsResponse, ProviderCredentialsResponse {

    String STATUS_SUCCESS = "success";

    /**
     * Returns the status indicator for this response.
     *
     * @return response status, {@code "success"} or {@code "error"}
     */
    String status();
}
