package com.williamcallahan.keycoordinator.config;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Coordinator coordinator = new Coordinator();
    private Providers providers = new Providers();
    private RateLimits rateLimits = new RateLimits();

    public Coordinator getCoordinator() {
        return coordinator;
    }

    public void setCoordinator(Coordinator coordinator) {
        this.coordinator = coordinator;
    }

    public Providers getProviders() {
        return providers;
    }

    public void setProviders(Providers providers) {
        this.providers = providers;
    }

    public RateLimits getRateLimits() {
        return rateLimits;
    }

    public void setRateLimits(RateLimits rateLimits) {
        this.rateLimits = rateLimits;
    }

    public static class Coordinator {
        private Retry retry = new Retry();
        private Cooldowns cooldowns = new Cooldowns();

        public Retry getRetry() { return retry; }
        public void setRetry(Retry retry) { this.retry = retry; }

        public Cooldowns getCooldowns() { return cooldowns; }
        public void setCooldowns(Cooldowns cooldowns) { this.cooldowns = cooldowns; }
    }

    public static class Retry {
        private Duration initialBackoff = Duration.ofSeconds(2);
        private double backoffMultiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(15);
        private Duration jitter = Duration.ofSeconds(1);
        private int maxUnclassifiedAttempts = 2;
        private Duration maxTotalDuration;

        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }

        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }

        public Duration getJitter() { return jitter; }
        public void setJitter(Duration jitter) { this.jitter = jitter; }

        public int getMaxUnclassifiedAttempts() { return maxUnclassifiedAttempts; }
        public void setMaxUnclassifiedAttempts(int maxUnclassifiedAttempts) {
            this.maxUnclassifiedAttempts = maxUnclassifiedAttempts;
        }

        public Duration getMaxTotalDuration() { return maxTotalDuration; }
        public void setMaxTotalDuration(Duration maxTotalDuration) { this.maxTotalDuration = maxTotalDuration; }
    }

    /**
     * Global cooldowns per failure category. An unset {@code authError} keeps rejected keys out for
     * the process lifetime.
     */
    public static class Cooldowns {
        private Duration queueExceeded = Duration.ofSeconds(15);
        private Duration rateLimited = Duration.ofSeconds(30);
        private Duration quotaExhausted = Duration.ofSeconds(60);
        private Duration serverError = Duration.ofSeconds(30);
        private Duration unclassified = Duration.ofSeconds(30);
        private Duration authError;
        private Duration maxHintCooldown = Duration.ofHours(1);

        public Duration getQueueExceeded() { return queueExceeded; }
        public void setQueueExceeded(Duration queueExceeded) { this.queueExceeded = queueExceeded; }

        public Duration getRateLimited() { return rateLimited; }
        public void setRateLimited(Duration rateLimited) { this.rateLimited = rateLimited; }

        public Duration getQuotaExhausted() { return quotaExhausted; }
        public void setQuotaExhausted(Duration quotaExhausted) { this.quotaExhausted = quotaExhausted; }

        public Duration getServerError() { return serverError; }
        public void setServerError(Duration serverError) { this.serverError = serverError; }

        public Duration getUnclassified() { return unclassified; }
        public void setUnclassified(Duration unclassified) { this.unclassified = unclassified; }

        public Duration getAuthError() { return authError; }
        public void setAuthError(Duration authError) { this.authError = authError; }

        public Duration getMaxHintCooldown() { return maxHintCooldown; }
        public void setMaxHintCooldown(Duration maxHintCooldown) { this.maxHintCooldown = maxHintCooldown; }
    }

    public static class Providers {
        private Provider cerebras = new Provider();
        private Provider gemini = new Provider();
        private Provider tavily = new Provider();

        public Provider getCerebras() { return cerebras; }
        public void setCerebras(Provider cerebras) { this.cerebras = cerebras; }

        public Provider getGemini() { return gemini; }
        public void setGemini(Provider gemini) { this.gemini = gemini; }

        public Provider getTavily() { return tavily; }
        public void setTavily(Provider tavily) { this.tavily = tavily; }

        /**
         * Returns the settings block for the given provider.
         */
        public Provider forProvider(ApiProvider provider) {
            return switch (provider) {
                case CEREBRAS -> cerebras;
                case GEMINI -> gemini;
                case TAVILY -> tavily;
            };
        }
    }

    /**
     * Settings for one provider. Unset {@code envPrefix}, {@code baseUrl} and {@code model} fall back
     * to the provider's built-in defaults.
     */
    public static class Provider {
        private boolean enabled = true;
        private boolean required = false;
        private String envPrefix;
        private List<String> keys = new ArrayList<>();
        private String baseUrl;
        private String model;
        private Duration timeout = Duration.ofSeconds(60);
        private int maxAttempts = 0;
        private Map<String, Duration> cooldowns = new LinkedHashMap<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isRequired() { return required; }
        public void setRequired(boolean required) { this.required = required; }

        public String getEnvPrefix() { return envPrefix; }
        public void setEnvPrefix(String envPrefix) { this.envPrefix = envPrefix; }

        public List<String> getKeys() { return keys; }
        public void setKeys(List<String> keys) { this.keys = keys; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Map<String, Duration> getCooldowns() { return cooldowns; }
        public void setCooldowns(Map<String, Duration> cooldowns) { this.cooldowns = cooldowns; }

        public String resolveEnvPrefix(ApiProvider provider) {
            return hasText(envPrefix) ? envPrefix.trim() : provider.getDefaultEnvPrefix();
        }

        public String resolveBaseUrl(ApiProvider provider) {
            return hasText(baseUrl) ? baseUrl.trim() : provider.getDefaultBaseUrl();
        }

        public String resolveModel(ApiProvider provider) {
            return hasText(model) ? model.trim() : provider.getDefaultModel();
        }

        private static boolean hasText(String value) {
            return value != null && !value.isBlank();
        }
    }

    public static class RateLimits {
        private boolean enabled = true;
        private Duration evictionInterval = Duration.ofMinutes(5);
        private Map<String, Rule> rules = defaultRules();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getEvictionInterval() { return evictionInterval; }
        public void setEvictionInterval(Duration evictionInterval) { this.evictionInterval = evictionInterval; }

        public Map<String, Rule> getRules() { return rules; }
        public void setRules(Map<String, Rule> rules) { this.rules = rules; }

        private static Map<String, Rule> defaultRules() {
            Map<String, Rule> defaults = new LinkedHashMap<>();
            defaults.put("cerebras-tokens-minute", new Rule(48_000, Duration.ofMinutes(1)));
            defaults.put("cerebras-tokens-day", new Rule(800_000, Duration.ofDays(1)));
            defaults.put("cerebras-requests-minute", new Rule(24, Duration.ofMinutes(1)));
            defaults.put("tavily-requests-minute", new Rule(80, Duration.ofMinutes(1)));
            return defaults;
        }
    }

    public static class Rule {
        private long limit;
        private Duration window = Duration.ofMinutes(1);

        public Rule() {
        }

        public Rule(long limit, Duration window) {
            this.limit = limit;
            this.window = window;
        }

        public long getLimit() { return limit; }
        public void setLimit(long limit) { this.limit = limit; }

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
    }
}
