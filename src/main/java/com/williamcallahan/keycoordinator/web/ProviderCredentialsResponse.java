package com.williamcallahan.keycoordinator.web;

import com.williamcallahan.keycoordinator.domain.credential.CredentialSnapshot;
import java.util.List;

/**
 * Masked credential statistics for one provider.
 *
 * @param status always {@code "success"}
 * @param provider provider name
 * @param totalKeys pooled key count
 * @param availableKeys keys not cooling down
 * @param keys per-key snapshots in rotation order
 */
public record ProviderCredentialsResponse(
        String status, String provider, int totalKeys, long availableKeys, List<CredentialSnapshot> keys)
        implements ApiResponse {

    public static ProviderCredentialsResponse success(
            String provider, int totalKeys, long availableKeys, List<CredentialSnapshot> keys) {
        return new ProviderCredentialsResponse(STATUS_SUCCESS, provider, totalKeys, availableKeys, keys);
    }
}
