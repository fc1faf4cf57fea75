package com.williamcallahan.keycoordinator.service.credential;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import java.util.Objects;

/**
 * One interchangeable API key for a provider.
 *
 * <p>Instances are immutable handles; health state lives in the owning {@link CredentialPool}.
 * Equality is identity: a pool holds exactly one handle per secret.</p>
 */
public final class Credential {
    private static final int VISIBLE_PREFIX_CHARS = 4;
    private static final String MASK = "***";

    private final ApiProvider provider;
    private final String id;
    private final String secret;

    /**
     * Creates a credential handle.
     *
     * @param provider provider the key authenticates against
     * @param id configuration source name, for example {@code CEREBRAS_API_KEY_2}
     * @param secret raw key value
     */
    public Credential(ApiProvider provider, String id, String secret) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.id = Objects.requireNonNull(id, "id");
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Credential secret must not be blank (id=" + id + ")");
        }
        this.secret = secret.trim();
    }

    public ApiProvider provider() {
        return provider;
    }

    /**
     * Returns the configuration source name. Not secret, but still keep it out of user-facing payloads.
     */
    public String id() {
        return id;
    }

    /**
     * Returns the raw key value for building an authenticated client. Never log this.
     */
    public String secret() {
        return secret;
    }

    /**
     * Returns a masked prefix of the secret suitable for logs and diagnostics.
     */
    public String maskedId() {
        if (secret.length() <= VISIBLE_PREFIX_CHARS * 2) {
            return MASK;
        }
        return secret.substring(0, VISIBLE_PREFIX_CHARS) + MASK;
    }

    @Override
    public String toString() {
        return "Credential[" + provider.getName() + ", " + maskedId() + "]";
    }
}
