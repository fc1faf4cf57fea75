package com.williamcallahan.keycoordinator.web;

import com.williamcallahan.keycoordinator.domain.credential.CredentialSnapshot;
import java.util.List;
import java.util.Map;

/**
 * Masked credential statistics for every configured provider.
 *
 * @param status always {@code "success"}
 * @param providers snapshots keyed by provider name
 * @param unavailable reasons keyed by provider name for providers without a pool
 */
public record CredentialStatsResponse(
        String status, Map<String, List<CredentialSnapshot>> providers, Map<String, String> unavailable)
        implements ApiResponse {

    public static CredentialStatsResponse success(
            Map<String, List<CredentialSnapshot>> providers, Map<String, String> unavailable) {
        return new CredentialStatsResponse(STATUS_SUCCESS, providers, unavailable);
    }
}
