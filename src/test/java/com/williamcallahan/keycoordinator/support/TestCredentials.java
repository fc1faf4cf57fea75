package com.williamcallahan.keycoordinator.support;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.service.credential.Credential;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds distinct credentials with readable secrets for tests.
 */
public final class TestCredentials {

    private TestCredentials() {}

    public static Credential credential(ApiProvider provider, String label) {
        return new Credential(provider, provider.getDefaultEnvPrefix() + "_" + label, "sk-" + label + "-0123456789abcdef");
    }

    public static List<Credential> credentials(ApiProvider provider, String... labels) {
        List<Credential> credentials = new ArrayList<>();
        for (String label : labels) {
            credentials.add(credential(provider, label));
        }
        return credentials;
    }
}
