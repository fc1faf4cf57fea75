package com.williamcallahan.keycoordinator.service.credential;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.domain.credential.CredentialSnapshot;
import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide holder of one {@link CredentialPool} per provider.
 *
 * <p>Pools are built once at startup and live until shutdown. Providers without usable keys are
 * remembered with the reason so that lookups fail with a clear message.</p>
 */
public class CredentialPoolRegistry {
    private static final Logger log = LoggerFactory.getLogger(CredentialPoolRegistry.class);

    private final Map<ApiProvider, CredentialPool> pools;
    private final Map<ApiProvider, String> unavailableReasons;

    /**
     * Creates a registry over already built pools.
     *
     * @param pools pools keyed by provider
     * @param unavailableReasons reasons for providers that have no pool, may be empty
     */
    public CredentialPoolRegistry(Map<ApiProvider, CredentialPool> pools, Map<ApiProvider, String> unavailableReasons) {
        Objects.requireNonNull(pools, "pools");
        this.pools = new EnumMap<>(ApiProvider.class);
        pools.forEach((provider, pool) -> {
            if (pool.provider() != provider) {
                throw new IllegalArgumentException("Pool for " + pool.provider().getName()
                        + " registered under " + provider.getName());
            }
            this.pools.put(provider, pool);
        });
        this.unavailableReasons = new EnumMap<>(ApiProvider.class);
        if (unavailableReasons != null) {
            this.unavailableReasons.putAll(unavailableReasons);
        }
    }

    /**
     * Builds pools for every enabled provider.
     *
     * @param settings provider settings lookup
     * @param loader credential discovery
     * @param clock clock shared by all pools
     * @return the registry
     * @throws PoolConfigurationException when a required provider has no usable keys
     */
    public static CredentialPoolRegistry create(
            Function<ApiProvider, ProviderPoolSettings> settings, CredentialSecretLoader loader, Clock clock) {
        Map<ApiProvider, CredentialPool> pools = new EnumMap<>(ApiProvider.class);
        Map<ApiProvider, String> unavailable = new EnumMap<>(ApiProvider.class);
        for (ApiProvider provider : ApiProvider.values()) {
            ProviderPoolSettings providerSettings = settings.apply(provider);
            if (!providerSettings.enabled()) {
                unavailable.put(provider, "Provider " + provider.getName() + " is disabled");
                continue;
            }
            List<Credential> credentials =
                    loader.load(provider, providerSettings.envPrefix(), providerSettings.explicitKeys());
            try {
                pools.put(provider, new CredentialPool(provider, credentials, clock));
            } catch (PoolConfigurationException configurationFailure) {
                if (providerSettings.required()) {
                    throw configurationFailure;
                }
                unavailable.put(provider, configurationFailure.getMessage()
                        + " (set " + providerSettings.envPrefix() + " or " + providerSettings.envPrefix() + "_1)");
            }
        }
        CredentialPoolRegistry registry = new CredentialPoolRegistry(pools, unavailable);
        registry.logStatus();
        return registry;
    }

    /**
     * Returns the pool for a provider.
     *
     * @throws PoolConfigurationException when the provider has no usable keys or is disabled
     */
    public CredentialPool poolFor(ApiProvider provider) {
        Objects.requireNonNull(provider, "provider");
        CredentialPool pool = pools.get(provider);
        if (pool == null) {
            String reason = unavailableReasons.getOrDefault(
                    provider, "No credentials configured for provider " + provider.getName());
            throw new PoolConfigurationException(provider, reason);
        }
        return pool;
    }

    public boolean isAvailable(ApiProvider provider) {
        return pools.containsKey(provider);
    }

    /**
     * Returns snapshots of every configured pool, in provider order.
     */
    public Map<ApiProvider, List<CredentialSnapshot>> snapshots() {
        Map<ApiProvider, List<CredentialSnapshot>> snapshots = new LinkedHashMap<>();
        pools.forEach((provider, pool) -> snapshots.put(provider, pool.snapshot()));
        return Collections.unmodifiableMap(snapshots);
    }

    public Map<ApiProvider, String> unavailableReasons() {
        return Collections.unmodifiableMap(unavailableReasons);
    }

    void logStatus() {
        log.info("=== Credential Pool Status ===");
        for (ApiProvider provider : ApiProvider.values()) {
            CredentialPool pool = pools.get(provider);
            if (pool != null) {
                log.info("{}: {} key(s) configured", provider.getName(), pool.size());
            } else {
                log.warn("{}: unavailable - {}", provider.getName(), unavailableReasons.get(provider));
            }
        }
        log.info("==============================");
    }

    /**
     * Pool-building settings for one provider.
     *
     * @param enabled whether a pool should be built at all
     * @param required whether a missing pool aborts startup
     * @param envPrefix environment variable prefix scanned for keys
     * @param explicitKeys keys configured directly
     */
    public record ProviderPoolSettings(boolean enabled, boolean required, String envPrefix, List<String> explicitKeys) {}
}
