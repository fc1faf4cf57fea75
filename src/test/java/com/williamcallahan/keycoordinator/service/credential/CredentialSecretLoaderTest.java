package com.williamcallahan.keycoordinator.service.credential;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

/**
 * Covers key discovery from numbered environment variables and explicit configuration.
 */
class CredentialSecretLoaderTest {

    @Test
    void loadsBarePrefixThenNumberedVariantsInNumericOrder() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("CEREBRAS_API_KEY_2", "csk-second-000000")
                .withProperty("CEREBRAS_API_KEY_10", "csk-tenth-0000000")
                .withProperty("CEREBRAS_API_KEY", "csk-bare-00000000")
                .withProperty("CEREBRAS_API_KEY_1", "csk-first-0000000")
                .withProperty("CEREBRAS_API_KEY_37", "csk-far-000000000")
                .withProperty("CEREBRAS_API_KEY_BACKUP", "csk-ignored-00000");
        CredentialSecretLoader loader = new CredentialSecretLoader(environment);

        List<Credential> loaded = loader.load(ApiProvider.CEREBRAS, "CEREBRAS_API_KEY", List.of());

        assertEquals(
                List.of("CEREBRAS_API_KEY", "CEREBRAS_API_KEY_1", "CEREBRAS_API_KEY_2", "CEREBRAS_API_KEY_10",
                        "CEREBRAS_API_KEY_37"),
                loaded.stream().map(Credential::id).toList());
        assertEquals("csk-bare-00000000", loaded.get(0).secret());
    }

    @Test
    void explicitKeysComeFirstAndDuplicatesAreDropped() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("TAVILY_API_KEY_1", "tvly-shared-000000")
                .withProperty("TAVILY_API_KEY_2", "tvly-env-only-0000");
        CredentialSecretLoader loader = new CredentialSecretLoader(environment);

        List<Credential> loaded = loader.load(
                ApiProvider.TAVILY, "TAVILY_API_KEY", List.of("tvly-shared-000000", " ", "tvly-shared-000000 "));

        assertEquals(List.of("tvly-shared-000000", "tvly-env-only-0000"),
                loaded.stream().map(Credential::secret).toList());
        assertEquals("app.providers.tavily.keys[0]", loaded.get(0).id());
    }

    @Test
    void blankValuesAndMissingPrefixYieldNoCredentials() {
        MockEnvironment environment = new MockEnvironment().withProperty("GOOGLE_GENERATIVE_AI_API_KEY", "   ");
        CredentialSecretLoader loader = new CredentialSecretLoader(environment);

        assertTrue(loader.load(ApiProvider.GEMINI, "GOOGLE_GENERATIVE_AI_API_KEY", null).isEmpty());
        assertTrue(loader.load(ApiProvider.GEMINI, null, null).isEmpty());
    }
}
