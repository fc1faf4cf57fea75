package com.williamcallahan.keycoordinator.service.classify;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.domain.failure.ErrorCategory;
import com.williamcallahan.keycoordinator.domain.failure.FailureClassification;
import com.williamcallahan.keycoordinator.domain.failure.ProviderFailure;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Maps normalized provider failures to a category, cooldown and retry decision.
 *
 * <p>Precedence: transport failures, queue overflow, quota exhaustion, rate limiting,
 * authentication, server errors, then everything else.</p>
 */
public class ErrorClassifier {

    private static final int HTTP_PAYMENT_REQUIRED = 402;
    private static final int HTTP_UNAUTHORIZED = 401;
    private static final int HTTP_FORBIDDEN = 403;
    private static final int HTTP_REQUEST_TIMEOUT = 408;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_TAVILY_PLAN_LIMIT = 432;
    private static final int HTTP_TAVILY_KEY_LIMIT = 433;
    private static final int HTTP_INTERNAL_SERVER_ERROR = 500;

    private static final Set<String> QUEUE_CODES = Set.of("queue_exceeded");
    private static final Set<String> QUOTA_CODES =
            Set.of("insufficient_quota", "quota_exceeded", "resource_exhausted", "billing_hard_limit_reached");
    private static final Set<String> RATE_CODES =
            Set.of("too_many_requests_error", "rate_limit_exceeded", "rate_limit_error", "too_many_requests");
    private static final Set<Integer> QUOTA_STATUSES =
            Set.of(HTTP_PAYMENT_REQUIRED, HTTP_TAVILY_PLAN_LIMIT, HTTP_TAVILY_KEY_LIMIT);

    private final CooldownPolicy cooldownPolicy;

    public ErrorClassifier(CooldownPolicy cooldownPolicy) {
        this.cooldownPolicy = Objects.requireNonNull(cooldownPolicy, "cooldownPolicy");
    }

    /**
     * Classifies a failure using the global cooldowns.
     */
    public FailureClassification classify(ProviderFailure failure) {
        return classify(null, failure);
    }

    /**
     * Classifies a failure using the cooldowns configured for the provider.
     *
     * <p>A provider retry hint lengthens the cooldown up to the configured cap; it never shortens
     * the policy value and never applies to authentication failures.</p>
     *
     * @param provider provider the failure came from, or null for global cooldowns
     * @param failure normalized failure
     * @return classification, never null
     */
    public FailureClassification classify(ApiProvider provider, ProviderFailure failure) {
        Objects.requireNonNull(failure, "failure");
        ErrorCategory category = categorize(failure);
        Duration cooldown = cooldownPolicy.cooldownFor(provider, category);
        if (cooldown != null && category != ErrorCategory.AUTH_ERROR && failure.retryAfter() != null) {
            Duration hint = min(failure.retryAfter(), cooldownPolicy.maxHintCooldown());
            if (hint.compareTo(cooldown) > 0) {
                cooldown = hint;
            }
        }
        return new FailureClassification(category, cooldown, category != ErrorCategory.AUTH_ERROR);
    }

    /**
     * Determines the category alone, without cooldown resolution.
     */
    public ErrorCategory categorize(ProviderFailure failure) {
        if (failure.timeout()) {
            return ErrorCategory.SERVER_ERROR;
        }
        String code = normalizeCode(failure.providerCode());
        if (code != null && QUEUE_CODES.contains(code)) {
            return ErrorCategory.QUEUE_EXCEEDED;
        }
        int status = failure.httpStatus();
        if ((code != null && QUOTA_CODES.contains(code)) || QUOTA_STATUSES.contains(status)) {
            return ErrorCategory.QUOTA_EXHAUSTED;
        }
        if (status == HTTP_TOO_MANY_REQUESTS || (code != null && RATE_CODES.contains(code))) {
            return ErrorCategory.RATE_LIMITED;
        }
        if (status == HTTP_UNAUTHORIZED || status == HTTP_FORBIDDEN) {
            return ErrorCategory.AUTH_ERROR;
        }
        if (status >= HTTP_INTERNAL_SERVER_ERROR || status == HTTP_REQUEST_TIMEOUT) {
            return ErrorCategory.SERVER_ERROR;
        }
        return ErrorCategory.UNCLASSIFIED;
    }

    private static String normalizeCode(String providerCode) {
        if (providerCode == null || providerCode.isBlank()) {
            return null;
        }
        return providerCode.trim().toLowerCase(Locale.ROOT);
    }

    private static Duration min(Duration first, Duration second) {
        return first.compareTo(second) <= 0 ? first : second;
    }
}
