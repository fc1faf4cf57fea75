package com.williamcallahan.keycoordinator.service.credential;

import java.util.Objects;

/**
 * Credential handed to one attempt, with whether it was obtained by forced reuse.
 *
 * @param credential selected credential
 * @param forcedReuse true when every credential was cooling down and the longest-idle one was reused
 */
public record CredentialSelection(Credential credential, boolean forcedReuse) {

    public CredentialSelection {
        Objects.requireNonNull(credential, "credential");
    }
}
