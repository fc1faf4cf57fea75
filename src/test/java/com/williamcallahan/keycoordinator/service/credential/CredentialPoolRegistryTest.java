package com.williamcallahan.keycoordinator.service.credential;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.support.MutableClock;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

/**
 * Verifies startup pool construction and lookup failures for unconfigured providers.
 */
class CredentialPoolRegistryTest {

    private final MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");

    @Test
    void buildsPoolsForConfiguredProvidersAndRemembersMissingOnes() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("CEREBRAS_API_KEY_1", "csk-one-000000000")
                .withProperty("CEREBRAS_API_KEY_2", "csk-two-000000000");
        Function<ApiProvider, CredentialPoolRegistry.ProviderPoolSettings> settings = provider ->
                new CredentialPoolRegistry.ProviderPoolSettings(
                        provider != ApiProvider.TAVILY, provider == ApiProvider.CEREBRAS,
                        provider.getDefaultEnvPrefix(), List.of());

        CredentialPoolRegistry registry =
                CredentialPoolRegistry.create(settings, new CredentialSecretLoader(environment), clock);

        assertEquals(2, registry.poolFor(ApiProvider.CEREBRAS).size());
        assertTrue(registry.isAvailable(ApiProvider.CEREBRAS));
        assertFalse(registry.isAvailable(ApiProvider.GEMINI));
        PoolConfigurationException missing =
                assertThrows(PoolConfigurationException.class, () -> registry.poolFor(ApiProvider.GEMINI));
        assertSame(ApiProvider.GEMINI, missing.provider());
        assertTrue(registry.unavailableReasons().get(ApiProvider.TAVILY).contains("disabled"));
        assertEquals(1, registry.snapshots().size());
    }

    @Test
    void requiredProviderWithoutKeysFailsFast() {
        Function<ApiProvider, CredentialPoolRegistry.ProviderPoolSettings> settings = provider ->
                new CredentialPoolRegistry.ProviderPoolSettings(true, true, provider.getDefaultEnvPrefix(), List.of());

        PoolConfigurationException thrown = assertThrows(PoolConfigurationException.class,
                () -> CredentialPoolRegistry.create(settings, new CredentialSecretLoader(new MockEnvironment()), clock));
        assertTrue(thrown.getMessage().contains("No credentials configured"));
    }

    @Test
    void rejectsPoolRegisteredUnderTheWrongProvider() {
        CredentialPool geminiPool = new CredentialPool(ApiProvider.GEMINI,
                List.of(new Credential(ApiProvider.GEMINI, "GOOGLE_GENERATIVE_AI_API_KEY", "gem-key-000000000")), clock);

        assertThrows(IllegalArgumentException.class,
                () -> new CredentialPoolRegistry(Map.of(ApiProvider.CEREBRAS, geminiPool), Map.of()));
    }
}
