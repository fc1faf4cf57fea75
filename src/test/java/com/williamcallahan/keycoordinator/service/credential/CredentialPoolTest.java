package com.williamcallahan.keycoordinator.service.credential;

import static com.williamcallahan.keycoordinator.support.TestCredentials.credential;
import static com.williamcallahan.keycoordinator.support.TestCredentials.credentials;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.domain.credential.CredentialSnapshot;
import com.williamcallahan.keycoordinator.domain.failure.ErrorCategory;
import com.williamcallahan.keycoordinator.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

/**
 * Verifies rotation, cooldown and forced-reuse behavior of a single provider pool.
 */
class CredentialPoolTest {
    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(START);

    @Test
    void selectNextCoversEveryHealthyCredentialOnceInInsertionOrder() {
        List<Credential> keys = credentials(ApiProvider.CEREBRAS, "a", "b", "c", "d");
        CredentialPool pool = new CredentialPool(ApiProvider.CEREBRAS, keys, clock);

        List<Credential> selected = new ArrayList<>();
        for (int index = 0; index < keys.size(); index++) {
            selected.add(pool.selectNext().orElseThrow());
        }

        assertEquals(keys, selected);
    }

    @Test
    void selectNextSkipsCoolingCredentialsAndReturnsThemAfterExpiry() {
        List<Credential> keys = credentials(ApiProvider.CEREBRAS, "a", "b", "c");
        CredentialPool pool = new CredentialPool(ApiProvider.CEREBRAS, keys, clock);
        pool.disable(keys.get(1), Duration.ofSeconds(30), ErrorCategory.RATE_LIMITED);

        assertSame(keys.get(0), pool.selectNext().orElseThrow());
        assertSame(keys.get(2), pool.selectNext().orElseThrow());
        assertSame(keys.get(2), pool.selectNext().orElseThrow());

        clock.advance(Duration.ofSeconds(30));
        assertSame(keys.get(0), pool.selectNext().orElseThrow());
        assertSame(keys.get(1), pool.selectNext().orElseThrow());
    }

    @Test
    void cursorAdvancesOncePerCallEvenWhenNothingIsAvailable() {
        List<Credential> keys = credentials(ApiProvider.GEMINI, "a", "b");
        CredentialPool pool = new CredentialPool(ApiProvider.GEMINI, keys, clock);
        pool.disable(keys.get(0), Duration.ofSeconds(10));
        pool.disable(keys.get(1), Duration.ofSeconds(10));

        assertTrue(pool.selectNext().isEmpty());

        clock.advance(Duration.ofSeconds(10));
        assertSame(keys.get(1), pool.selectNext().orElseThrow());
    }

    @Test
    void shorterDisableNeverShrinksAnActiveCooldown() {
        Credential key = credential(ApiProvider.CEREBRAS, "a");
        CredentialPool pool = new CredentialPool(ApiProvider.CEREBRAS, List.of(key), clock);

        Instant first = pool.disable(key, Duration.ofSeconds(60), ErrorCategory.QUOTA_EXHAUSTED);
        clock.advance(Duration.ofSeconds(5));
        Instant second = pool.disable(key, Duration.ofSeconds(15), ErrorCategory.QUEUE_EXCEEDED);

        assertEquals(START.plusSeconds(60), first);
        assertEquals(first, second);
        CredentialSnapshot snapshot = pool.snapshotOf(key);
        assertEquals(first, snapshot.disabledUntil());
        assertEquals(2, snapshot.errorCount());
        assertEquals(ErrorCategory.QUEUE_EXCEEDED, snapshot.lastFailureCategory());
    }

    @Test
    void longerDisableExtendsTheCooldown() {
        Credential key = credential(ApiProvider.CEREBRAS, "a");
        CredentialPool pool = new CredentialPool(ApiProvider.CEREBRAS, List.of(key), clock);

        pool.disable(key, Duration.ofSeconds(15));
        Instant extended = pool.disable(key, Duration.ofSeconds(60));

        assertEquals(START.plusSeconds(60), extended);
    }

    @Test
    void permanentDisableSurvivesAnyAmountOfTime() {
        Credential key = credential(ApiProvider.TAVILY, "a");
        CredentialPool pool = new CredentialPool(ApiProvider.TAVILY, List.of(key), clock);

        pool.disable(key, null, ErrorCategory.AUTH_ERROR);
        clock.advance(Duration.ofDays(3650));

        assertTrue(pool.selectNext().isEmpty());
        assertTrue(pool.allDisabled());
        assertFalse(pool.hasRecoverableCredential());
        assertTrue(pool.snapshotOf(key).permanentlyDisabled());
    }

    @Test
    void recordSuccessCountsRequestsAndClearsElapsedCooldown() {
        Credential key = credential(ApiProvider.CEREBRAS, "a");
        CredentialPool pool = new CredentialPool(ApiProvider.CEREBRAS, List.of(key), clock);
        pool.disable(key, Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));

        pool.recordSuccess(key);

        CredentialSnapshot snapshot = pool.snapshotOf(key);
        assertEquals(1, snapshot.requestCount());
        assertFalse(snapshot.disabled());
        assertNull(snapshot.disabledUntil());
        assertEquals(START.plusSeconds(2), snapshot.lastUsedAt());
    }

    @Test
    void forceOldestUsedPicksLongestIdleCredentialAndClearsItsCooldown() {
        List<Credential> keys = credentials(ApiProvider.CEREBRAS, "a", "b", "c");
        CredentialPool pool = new CredentialPool(ApiProvider.CEREBRAS, keys, clock);
        pool.selectNext();
        clock.advance(Duration.ofSeconds(1));
        pool.selectNext();
        clock.advance(Duration.ofSeconds(1));
        pool.selectNext();
        keys.forEach(key -> pool.disable(key, Duration.ofMinutes(5), ErrorCategory.RATE_LIMITED));
        assertTrue(pool.allDisabled());

        Credential forced = pool.forceOldestUsed();

        assertSame(keys.get(0), forced);
        assertFalse(pool.snapshotOf(forced).disabled());
        assertFalse(pool.allDisabled());
    }

    @Test
    void forceOldestUsedPrefersNeverUsedCredentials() {
        List<Credential> keys = credentials(ApiProvider.GEMINI, "a", "b");
        CredentialPool pool = new CredentialPool(ApiProvider.GEMINI, keys, clock);
        pool.selectNext();
        keys.forEach(key -> pool.disable(key, Duration.ofSeconds(30)));

        assertSame(keys.get(1), pool.forceOldestUsed());
    }

    @Test
    void forceOldestUsedSkipsPermanentlyDisabledAndDeprioritizesQuotaExhausted() {
        List<Credential> keys = credentials(ApiProvider.CEREBRAS, "a", "b", "c");
        CredentialPool pool = new CredentialPool(ApiProvider.CEREBRAS, keys, clock);
        pool.selectNext();
        clock.advance(Duration.ofSeconds(1));
        pool.selectNext();
        clock.advance(Duration.ofSeconds(1));
        pool.selectNext();
        pool.disable(keys.get(0), null, ErrorCategory.AUTH_ERROR);
        pool.disable(keys.get(1), Duration.ofSeconds(60), ErrorCategory.QUOTA_EXHAUSTED);
        pool.disable(keys.get(2), Duration.ofSeconds(15), ErrorCategory.QUEUE_EXCEEDED);

        assertSame(keys.get(2), pool.forceOldestUsed());
    }

    @Test
    void forceOldestUsedFallsBackToPermanentCredentialWhenNothingElseExists() {
        Credential key = credential(ApiProvider.CEREBRAS, "a");
        CredentialPool pool = new CredentialPool(ApiProvider.CEREBRAS, List.of(key), clock);
        pool.disable(key, null, ErrorCategory.AUTH_ERROR);

        assertSame(key, pool.forceOldestUsed());
    }

    @Test
    void constructorRejectsEmptyDuplicateAndForeignCredentials() {
        assertThrows(PoolConfigurationException.class,
                () -> new CredentialPool(ApiProvider.CEREBRAS, List.of(), clock));

        Credential original = new Credential(ApiProvider.CEREBRAS, "CEREBRAS_API_KEY", "csk-same-secret-1234");
        Credential copy = new Credential(ApiProvider.CEREBRAS, "CEREBRAS_API_KEY_1", " csk-same-secret-1234 ");
        assertThrows(PoolConfigurationException.class,
                () -> new CredentialPool(ApiProvider.CEREBRAS, List.of(original, copy), clock));

        Credential foreign = credential(ApiProvider.GEMINI, "a");
        assertThrows(PoolConfigurationException.class,
                () -> new CredentialPool(ApiProvider.CEREBRAS, List.of(foreign), clock));
    }

    @Test
    void operationsRejectCredentialsFromAnotherPool() {
        CredentialPool pool = new CredentialPool(ApiProvider.CEREBRAS, credentials(ApiProvider.CEREBRAS, "a"), clock);
        Credential outsider = credential(ApiProvider.CEREBRAS, "a");

        assertThrows(IllegalArgumentException.class, () -> pool.recordSuccess(outsider));
        assertThrows(IllegalArgumentException.class, () -> pool.disable(outsider, Duration.ofSeconds(1)));
    }

    @Test
    void snapshotNeverExposesTheSecret() {
        Credential key = new Credential(ApiProvider.TAVILY, "TAVILY_API_KEY_1", "tvly-abcdefghijklmnop");
        CredentialPool pool = new CredentialPool(ApiProvider.TAVILY, List.of(key), clock);

        CredentialSnapshot snapshot = pool.snapshot().get(0);

        assertEquals("tvly***", snapshot.maskedId());
        assertFalse(snapshot.toString().contains("abcdefghijklmnop"));
    }

    @Test
    void concurrentSelectionAndDisablementKeepCountersConsistent() throws Exception {
        List<Credential> keys = credentials(ApiProvider.CEREBRAS, "a", "b", "c", "d");
        CredentialPool pool = new CredentialPool(ApiProvider.CEREBRAS, keys, clock);
        int threads = 8;
        int iterations = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int thread = 0; thread < threads; thread++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int iteration = 0; iteration < iterations; iteration++) {
                        Credential selected = pool.selectNext().orElseGet(pool::forceOldestUsed);
                        if (iteration % 2 == 0) {
                            pool.recordSuccess(selected);
                        } else {
                            pool.disable(selected, Duration.ofMillis(1), ErrorCategory.QUEUE_EXCEEDED);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        long requests = pool.snapshot().stream().mapToLong(CredentialSnapshot::requestCount).sum();
        long errors = pool.snapshot().stream().mapToLong(CredentialSnapshot::errorCount).sum();
        assertEquals((long) threads * iterations / 2, requests);
        assertEquals((long) threads * iterations / 2, errors);
    }
}
