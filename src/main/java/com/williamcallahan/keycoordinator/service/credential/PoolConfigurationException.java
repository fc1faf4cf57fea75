package com.williamcallahan.keycoordinator.service.credential;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;

/**
 * Signals that a provider cannot be served because its credential pool is misconfigured.
 *
 * <p>Raised at startup for required providers and on first use for optional ones.</p>
 */
public final class PoolConfigurationException extends RuntimeException {
    private final transient ApiProvider provider;

    /**
     * Creates an exception for the given provider with a descriptive message.
     */
    public PoolConfigurationException(ApiProvider provider, String message) {
        super(message);
        this.provider = provider;
    }

    public ApiProvider provider() {
        return provider;
    }
}
