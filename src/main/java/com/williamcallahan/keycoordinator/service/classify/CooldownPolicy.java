package com.williamcallahan.keycoordinator.service.classify;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.domain.failure.ErrorCategory;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Cooldown durations per failure category, with optional per-provider overrides.
 *
 * <p>A category mapped to null disables the credential for the process lifetime.</p>
 */
public final class CooldownPolicy {

    public static final Duration DEFAULT_QUEUE_EXCEEDED = Duration.ofSeconds(15);
    public static final Duration DEFAULT_RATE_LIMITED = Duration.ofSeconds(30);
    public static final Duration DEFAULT_QUOTA_EXHAUSTED = Duration.ofSeconds(60);
    public static final Duration DEFAULT_SERVER_ERROR = Duration.ofSeconds(30);
    public static final Duration DEFAULT_UNCLASSIFIED = Duration.ofSeconds(30);
    public static final Duration DEFAULT_MAX_HINT_COOLDOWN = Duration.ofHours(1);

    private final Map<ErrorCategory, Duration> globalCooldowns;
    private final Map<ApiProvider, Map<ErrorCategory, Duration>> providerOverrides;
    private final Duration maxHintCooldown;

    /**
     * Creates a policy.
     *
     * @param globalCooldowns cooldown per category; every category must be present, null values mean permanent
     * @param providerOverrides per-provider cooldowns that replace the global value for that provider
     * @param maxHintCooldown cap applied to provider-supplied retry hints
     */
    public CooldownPolicy(
            Map<ErrorCategory, Duration> globalCooldowns,
            Map<ApiProvider, Map<ErrorCategory, Duration>> providerOverrides,
            Duration maxHintCooldown) {
        Objects.requireNonNull(globalCooldowns, "globalCooldowns");
        for (ErrorCategory category : ErrorCategory.values()) {
            if (!globalCooldowns.containsKey(category)) {
                throw new IllegalArgumentException("Missing cooldown for " + category.key());
            }
            requireNonNegative(globalCooldowns.get(category), category);
        }
        this.globalCooldowns = new EnumMap<>(ErrorCategory.class);
        this.globalCooldowns.putAll(globalCooldowns);
        this.providerOverrides = new EnumMap<>(ApiProvider.class);
        if (providerOverrides != null) {
            providerOverrides.forEach((provider, overrides) -> {
                Map<ErrorCategory, Duration> copy = new EnumMap<>(ErrorCategory.class);
                overrides.forEach((category, cooldown) -> {
                    requireNonNegative(cooldown, category);
                    copy.put(category, cooldown);
                });
                this.providerOverrides.put(provider, copy);
            });
        }
        this.maxHintCooldown = maxHintCooldown == null ? DEFAULT_MAX_HINT_COOLDOWN : maxHintCooldown;
    }

    /**
     * Returns the built-in cooldowns with authentication failures treated as permanent.
     */
    public static CooldownPolicy defaults() {
        return new CooldownPolicy(defaultCooldowns(), Map.of(), DEFAULT_MAX_HINT_COOLDOWN);
    }

    /**
     * Returns a mutable copy of the built-in cooldown table.
     */
    public static Map<ErrorCategory, Duration> defaultCooldowns() {
        Map<ErrorCategory, Duration> cooldowns = new EnumMap<>(ErrorCategory.class);
        cooldowns.put(ErrorCategory.QUEUE_EXCEEDED, DEFAULT_QUEUE_EXCEEDED);
        cooldowns.put(ErrorCategory.RATE_LIMITED, DEFAULT_RATE_LIMITED);
        cooldowns.put(ErrorCategory.QUOTA_EXHAUSTED, DEFAULT_QUOTA_EXHAUSTED);
        cooldowns.put(ErrorCategory.SERVER_ERROR, DEFAULT_SERVER_ERROR);
        cooldowns.put(ErrorCategory.AUTH_ERROR, null);
        cooldowns.put(ErrorCategory.UNCLASSIFIED, DEFAULT_UNCLASSIFIED);
        return cooldowns;
    }

    /**
     * Returns the cooldown for a category, or null when the credential should stay disabled.
     */
    public Duration cooldownFor(ApiProvider provider, ErrorCategory category) {
        Objects.requireNonNull(category, "category");
        if (provider != null) {
            Map<ErrorCategory, Duration> overrides = providerOverrides.get(provider);
            if (overrides != null && overrides.containsKey(category)) {
                return overrides.get(category);
            }
        }
        return globalCooldowns.get(category);
    }

    public Duration maxHintCooldown() {
        return maxHintCooldown;
    }

    private static void requireNonNegative(Duration cooldown, ErrorCategory category) {
        if (cooldown != null && cooldown.isNegative()) {
            throw new IllegalArgumentException("Cooldown for " + category.key() + " must be non-negative");
        }
    }
}
