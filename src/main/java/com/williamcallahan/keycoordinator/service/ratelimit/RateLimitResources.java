package com.williamcallahan.keycoordinator.service.ratelimit;

/**
 * Resource names used for provider budgets.
 */
public final class RateLimitResources {

    public static final String TOKENS_PER_MINUTE = "tokens-minute";
    public static final String TOKENS_PER_DAY = "tokens-day";
    public static final String REQUESTS_PER_MINUTE = "requests-minute";

    private RateLimitResources() {}

    /**
     * Builds a provider-scoped resource name such as {@code cerebras-tokens-minute}.
     */
    public static String forProvider(String providerName, String budget) {
        return providerName + "-" + budget;
    }
}
