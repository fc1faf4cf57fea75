package com.williamcallahan.keycoordinator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.domain.failure.ErrorCategory;
import com.williamcallahan.keycoordinator.service.classify.CooldownPolicy;
import com.williamcallahan.keycoordinator.service.classify.ErrorClassifier;
import com.williamcallahan.keycoordinator.service.classify.ProviderErrorNormalizer;
import com.williamcallahan.keycoordinator.service.classify.RateLimitHeaderParser;
import com.williamcallahan.keycoordinator.service.credential.CredentialPoolRegistry;
import com.williamcallahan.keycoordinator.service.credential.CredentialSecretLoader;
import com.williamcallahan.keycoordinator.service.credential.CredentialSelector;
import com.williamcallahan.keycoordinator.service.ratelimit.ProviderBudgetGate;
import com.williamcallahan.keycoordinator.service.ratelimit.RateLimitRule;
import com.williamcallahan.keycoordinator.service.ratelimit.WindowRateLimiter;
import com.williamcallahan.keycoordinator.service.retry.BackoffPolicy;
import com.williamcallahan.keycoordinator.service.retry.RetryCoordinator;
import com.williamcallahan.keycoordinator.service.retry.Sleeper;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Wires the credential pools, classifier, retry coordinator and rate limiter from {@link AppProperties}.
 */
@Configuration
@EnableScheduling
public class CoordinatorConfig {

    @Bean
    public Clock coordinatorClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper coordinatorSleeper() {
        return Sleeper.threadSleeper();
    }

    @Bean
    public CredentialSecretLoader credentialSecretLoader(Environment environment) {
        return new CredentialSecretLoader(environment);
    }

    /**
     * Builds one pool per enabled provider; a required provider without keys aborts startup.
     */
    @Bean
    public CredentialPoolRegistry credentialPoolRegistry(
            AppProperties appProperties, CredentialSecretLoader credentialSecretLoader, Clock coordinatorClock) {
        AppProperties.Providers providers = appProperties.getProviders();
        return CredentialPoolRegistry.create(
                provider -> {
                    AppProperties.Provider settings = providers.forProvider(provider);
                    return new CredentialPoolRegistry.ProviderPoolSettings(
                            settings.isEnabled(),
                            settings.isRequired(),
                            settings.resolveEnvPrefix(provider),
                            settings.getKeys());
                },
                credentialSecretLoader,
                coordinatorClock);
    }

    @Bean
    public CooldownPolicy cooldownPolicy(AppProperties appProperties) {
        AppProperties.Cooldowns cooldowns = appProperties.getCoordinator().getCooldowns();
        Map<ErrorCategory, Duration> globals = new EnumMap<>(ErrorCategory.class);
        globals.put(ErrorCategory.QUEUE_EXCEEDED, cooldowns.getQueueExceeded());
        globals.put(ErrorCategory.RATE_LIMITED, cooldowns.getRateLimited());
        globals.put(ErrorCategory.QUOTA_EXHAUSTED, cooldowns.getQuotaExhausted());
        globals.put(ErrorCategory.SERVER_ERROR, cooldowns.getServerError());
        globals.put(ErrorCategory.AUTH_ERROR, cooldowns.getAuthError());
        globals.put(ErrorCategory.UNCLASSIFIED, cooldowns.getUnclassified());

        Map<ApiProvider, Map<ErrorCategory, Duration>> overrides = new EnumMap<>(ApiProvider.class);
        for (ApiProvider provider : ApiProvider.values()) {
            Map<String, Duration> configured = appProperties.getProviders().forProvider(provider).getCooldowns();
            if (configured == null || configured.isEmpty()) {
                continue;
            }
            Map<ErrorCategory, Duration> providerCooldowns = new EnumMap<>(ErrorCategory.class);
            configured.forEach((key, cooldown) -> providerCooldowns.put(ErrorCategory.fromKey(key), cooldown));
            overrides.put(provider, providerCooldowns);
        }
        return new CooldownPolicy(globals, overrides, cooldowns.getMaxHintCooldown());
    }

    @Bean
    public ErrorClassifier errorClassifier(CooldownPolicy cooldownPolicy) {
        return new ErrorClassifier(cooldownPolicy);
    }

    @Bean
    public ProviderErrorNormalizer providerErrorNormalizer(ObjectMapper objectMapper, Clock coordinatorClock) {
        return new ProviderErrorNormalizer(objectMapper, new RateLimitHeaderParser(coordinatorClock));
    }

    @Bean
    public BackoffPolicy backoffPolicy(AppProperties appProperties) {
        AppProperties.Retry retry = appProperties.getCoordinator().getRetry();
        return new BackoffPolicy(
                retry.getInitialBackoff(),
                retry.getBackoffMultiplier(),
                retry.getMaxBackoff(),
                retry.getJitter(),
                new SecureRandom());
    }

    @Bean
    public RetryCoordinator retryCoordinator(
            CredentialPoolRegistry credentialPoolRegistry,
            CredentialSelector credentialSelector,
            ProviderErrorNormalizer providerErrorNormalizer,
            ErrorClassifier errorClassifier,
            BackoffPolicy backoffPolicy,
            Sleeper coordinatorSleeper,
            Clock coordinatorClock,
            AppProperties appProperties) {
        AppProperties.Retry retry = appProperties.getCoordinator().getRetry();
        return new RetryCoordinator(
                credentialPoolRegistry,
                credentialSelector,
                providerErrorNormalizer,
                errorClassifier,
                backoffPolicy,
                coordinatorSleeper,
                coordinatorClock,
                retry.getMaxUnclassifiedAttempts(),
                retry.getMaxTotalDuration());
    }

    @Bean
    public WindowRateLimiter windowRateLimiter(AppProperties appProperties, Clock coordinatorClock) {
        AppProperties.RateLimits rateLimits = appProperties.getRateLimits();
        Map<String, RateLimitRule> rules = new LinkedHashMap<>();
        rateLimits.getRules().forEach((resource, rule) ->
                rules.put(resource, new RateLimitRule(rule.getLimit(), rule.getWindow())));
        return new WindowRateLimiter(rules, coordinatorClock, rateLimits.isEnabled());
    }

    @Bean
    public ProviderBudgetGate providerBudgetGate(WindowRateLimiter windowRateLimiter, Clock coordinatorClock) {
        return new ProviderBudgetGate(windowRateLimiter, coordinatorClock);
    }
}
