package com.williamcallahan.keycoordinator.service;

import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.williamcallahan.keycoordinator.config.AppProperties;
import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.service.classify.ProviderCallException;
import com.williamcallahan.keycoordinator.service.ratelimit.ProviderBudgetGate;
import com.williamcallahan.keycoordinator.service.retry.RetryCoordinator;
import com.williamcallahan.keycoordinator.service.retry.RetryOptions;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs budget-checked chat completions through the credential coordinator.
 */
@Service
public class CoordinatedCompletionService {
    private static final Logger log = LoggerFactory.getLogger(CoordinatedCompletionService.class);

    static final long MAX_COMPLETION_TOKENS = 2000;

    private final RetryCoordinator retryCoordinator;
    private final ProviderClientFactory clientFactory;
    private final ProviderBudgetGate budgetGate;
    private final AppProperties appProperties;

    public CoordinatedCompletionService(
            RetryCoordinator retryCoordinator,
            ProviderClientFactory clientFactory,
            ProviderBudgetGate budgetGate,
            AppProperties appProperties) {
        this.retryCoordinator = Objects.requireNonNull(retryCoordinator, "retryCoordinator");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.budgetGate = Objects.requireNonNull(budgetGate, "budgetGate");
        this.appProperties = Objects.requireNonNull(appProperties, "appProperties");
    }

    /**
     * Completes a prompt with the given provider.
     *
     * @param provider OpenAI-compatible LLM provider
     * @param prompt user prompt
     * @param clientId caller key for budget accounting
     * @return completion text, empty when the model returned no content
     * @throws IllegalArgumentException for a blank prompt or a provider without a chat API
     */
    public CompletionResult complete(ApiProvider provider, String prompt, String clientId) {
        Objects.requireNonNull(provider, "provider");
        if (!provider.isOpenAiCompatible()) {
            throw new IllegalArgumentException(provider.getName() + " does not support chat completions");
        }
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt must not be blank");
        }
        budgetGate.checkLlmBudget(provider, clientId, TokenEstimator.estimate(prompt) + MAX_COMPLETION_TOKENS);

        AppProperties.Provider settings = appProperties.getProviders().forProvider(provider);
        String model = settings.resolveModel(provider);
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .addUserMessage(prompt)
                .model(model)
                .maxCompletionTokens(MAX_COMPLETION_TOKENS)
                .build();
        RetryOptions options = RetryOptions.forProvider(provider)
                .withMaxAttempts(settings.getMaxAttempts())
                .withOperation("completion");

        String text = retryCoordinator.executeWithRetry(credential -> {
            OpenAIClient client = clientFactory.openAiClient(credential);
            ChatCompletion completion = client.chat().completions().create(params);
            if (completion.choices().isEmpty()) {
                throw new ProviderCallException(502, null, "Completion returned no choices");
            }
            return completion.choices().get(0).message().content().orElse("");
        }, options);
        log.debug("[{}] Completion returned {} chars", provider.getName(), text.length());
        return new CompletionResult(provider.getName(), model, text);
    }

    /**
     * Completion text with the provider and model that produced it.
     */
    public record CompletionResult(String provider, String model, String text) {}
}
