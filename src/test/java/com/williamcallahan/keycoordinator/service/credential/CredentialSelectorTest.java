package com.williamcallahan.keycoordinator.service.credential;

import static com.williamcallahan.keycoordinator.support.TestCredentials.credentials;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.domain.failure.ErrorCategory;
import com.williamcallahan.keycoordinator.support.MutableClock;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies that selection degrades to forced reuse instead of failing.
 */
class CredentialSelectorTest {

    private final MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
    private final CredentialSelector selector = new CredentialSelector();

    @Test
    void returnsHealthyCredentialWithoutForcedReuse() {
        List<Credential> keys = credentials(ApiProvider.GEMINI, "a", "b");
        CredentialPool pool = new CredentialPool(ApiProvider.GEMINI, keys, clock);

        CredentialSelection selection = selector.next(pool);

        assertSame(keys.get(0), selection.credential());
        assertFalse(selection.forcedReuse());
    }

    @Test
    void exhaustedPoolStillYieldsOldestUsedCredential() {
        List<Credential> keys = credentials(ApiProvider.GEMINI, "a", "b", "c");
        CredentialPool pool = new CredentialPool(ApiProvider.GEMINI, keys, clock);
        for (Credential key : List.of(keys.get(2), keys.get(0), keys.get(1))) {
            pool.recordSuccess(key);
            clock.advance(Duration.ofSeconds(1));
        }
        keys.forEach(key -> pool.disable(key, Duration.ofSeconds(60), ErrorCategory.RATE_LIMITED));

        CredentialSelection selection = selector.next(pool);

        assertSame(keys.get(2), selection.credential());
        assertTrue(selection.forcedReuse());
    }
}
