package com.williamcallahan.keycoordinator.domain.credential;

import java.util.Locale;

/**
 * Describes the external providers whose interchangeable API keys are pooled.
 */
public enum ApiProvider {
    /** Cerebras inference, OpenAI-compatible chat completions. */
    CEREBRAS("cerebras", "CEREBRAS_API_KEY", "https://api.cerebras.ai/v1", "gpt-oss-120b", true),
    /** Google Gemini through its OpenAI-compatible endpoint. */
    GEMINI(
            "gemini",
            "GOOGLE_GENERATIVE_AI_API_KEY",
            "https://generativelanguage.googleapis.com/v1beta/openai/",
            "gemini-2.5-flash",
            true),
    /** Tavily web search REST API. */
    TAVILY("tavily", "TAVILY_API_KEY", "https://api.tavily.com", null, false);

    private final String name;
    private final String defaultEnvPrefix;
    private final String defaultBaseUrl;
    private final String defaultModel;
    private final boolean openAiCompatible;

    ApiProvider(
            String name,
            String defaultEnvPrefix,
            String defaultBaseUrl,
            String defaultModel,
            boolean openAiCompatible) {
        this.name = name;
        this.defaultEnvPrefix = defaultEnvPrefix;
        this.defaultBaseUrl = defaultBaseUrl;
        this.defaultModel = defaultModel;
        this.openAiCompatible = openAiCompatible;
    }

    /**
     * Returns the provider identifier used in configuration keys, logs and API paths.
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the environment variable prefix scanned for this provider's keys.
     */
    public String getDefaultEnvPrefix() {
        return defaultEnvPrefix;
    }

    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    /**
     * Reports whether calls go through the OpenAI Java SDK rather than a plain REST client.
     */
    public boolean isOpenAiCompatible() {
        return openAiCompatible;
    }

    /**
     * Resolves a provider from its identifier, ignoring case and surrounding whitespace.
     *
     * @param rawName provider identifier such as {@code "cerebras"}
     * @return matching provider
     * @throws IllegalArgumentException when no provider matches
     */
    public static ApiProvider fromName(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            throw new IllegalArgumentException("Provider name is required");
        }
        String normalized = rawName.trim().toLowerCase(Locale.ROOT);
        for (ApiProvider provider : values()) {
            if (provider.name.equals(normalized)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + rawName);
    }
}
