package com.williamcallahan.keycoordinator.service.classify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.domain.failure.ErrorCategory;
import com.williamcallahan.keycoordinator.domain.failure.FailureClassification;
import com.williamcallahan.keycoordinator.domain.failure.ProviderFailure;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Covers the category table, precedence rules and cooldown resolution.
 */
class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier(CooldownPolicy.defaults());

    @ParameterizedTest
    @CsvSource({
        "429, queue_exceeded, QUEUE_EXCEEDED, 15",
        "500, queue_exceeded, QUEUE_EXCEEDED, 15",
        "429, , RATE_LIMITED, 30",
        "400, too_many_requests_error, RATE_LIMITED, 30",
        "429, RESOURCE_EXHAUSTED, QUOTA_EXHAUSTED, 60",
        "429, insufficient_quota, QUOTA_EXHAUSTED, 60",
        "402, , QUOTA_EXHAUSTED, 60",
        "432, , QUOTA_EXHAUSTED, 60",
        "503, , SERVER_ERROR, 30",
        "500, , SERVER_ERROR, 30",
        "400, , UNCLASSIFIED, 30",
        "404, , UNCLASSIFIED, 30"
    })
    void mapsStatusAndCodeToCategoryAndDefaultCooldown(int status, String code, ErrorCategory expected, long seconds) {
        FailureClassification classification = classifier.classify(ProviderFailure.ofStatus(status, code, "failure"));

        assertEquals(expected, classification.category());
        assertEquals(Duration.ofSeconds(seconds), classification.cooldown());
        assertTrue(classification.retryable());
    }

    @Test
    void authFailuresArePermanentAndNotRetryable() {
        for (int status : new int[] {401, 403}) {
            FailureClassification classification = classifier.classify(ProviderFailure.ofStatus(status, null, "denied"));

            assertEquals(ErrorCategory.AUTH_ERROR, classification.category());
            assertTrue(classification.isPermanent());
            assertNull(classification.cooldown());
            assertFalse(classification.retryable());
        }
    }

    @Test
    void timeoutsWinOverEveryOtherSignal() {
        ProviderFailure failure = new ProviderFailure(429, "queue_exceeded", "timed out", true, null);

        assertEquals(ErrorCategory.SERVER_ERROR, classifier.classify(failure).category());
    }

    @Test
    void retryHintExtendsCooldownButIsCapped() {
        ProviderFailure longHint = ProviderFailure.ofStatus(429, null, "slow down").withRetryAfter(Duration.ofMinutes(2));
        ProviderFailure shortHint = ProviderFailure.ofStatus(429, null, "slow down").withRetryAfter(Duration.ofSeconds(5));
        ProviderFailure hugeHint = ProviderFailure.ofStatus(429, null, "slow down").withRetryAfter(Duration.ofDays(2));

        assertEquals(Duration.ofMinutes(2), classifier.classify(longHint).cooldown());
        assertEquals(Duration.ofSeconds(30), classifier.classify(shortHint).cooldown());
        assertEquals(Duration.ofHours(1), classifier.classify(hugeHint).cooldown());
    }

    @Test
    void retryHintNeverAppliesToAuthFailures() {
        ProviderFailure failure = ProviderFailure.ofStatus(401, null, "bad key").withRetryAfter(Duration.ofSeconds(10));

        assertTrue(classifier.classify(failure).isPermanent());
    }

    @Test
    void providerOverridesReplaceGlobalCooldowns() {
        Map<ErrorCategory, Duration> globals = CooldownPolicy.defaultCooldowns();
        globals.put(ErrorCategory.AUTH_ERROR, Duration.ofHours(24));
        CooldownPolicy policy = new CooldownPolicy(
                globals,
                Map.of(ApiProvider.TAVILY, Map.of(ErrorCategory.RATE_LIMITED, Duration.ofHours(1))),
                Duration.ofHours(1));
        ErrorClassifier configured = new ErrorClassifier(policy);
        ProviderFailure rateLimited = ProviderFailure.ofStatus(429, null, "limit");

        assertEquals(Duration.ofHours(1), configured.classify(ApiProvider.TAVILY, rateLimited).cooldown());
        assertEquals(Duration.ofSeconds(30), configured.classify(ApiProvider.GEMINI, rateLimited).cooldown());
        FailureClassification auth = configured.classify(ApiProvider.CEREBRAS, ProviderFailure.ofStatus(403, null, "x"));
        assertEquals(Duration.ofHours(24), auth.cooldown());
        assertFalse(auth.retryable());
    }
}
