package com.williamcallahan.keycoordinator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.keycoordinator.config.AppProperties;
import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.domain.failure.ProviderFailure;
import com.williamcallahan.keycoordinator.service.classify.ProviderCallException;
import com.williamcallahan.keycoordinator.service.ratelimit.ProviderBudgetGate;
import com.williamcallahan.keycoordinator.service.retry.RetryCoordinator;
import com.williamcallahan.keycoordinator.service.retry.RetryOptions;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

/**
 * Runs budget-checked web searches through the credential coordinator.
 */
@Service
public class CoordinatedSearchService {

    static final int DEFAULT_MAX_RESULTS = 5;
    static final int MAX_RESULTS_CAP = 20;
    private static final String SEARCH_PATH = "/search";

    private final RetryCoordinator retryCoordinator;
    private final ProviderClientFactory clientFactory;
    private final ProviderBudgetGate budgetGate;
    private final AppProperties appProperties;

    public CoordinatedSearchService(
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
     * Searches the web and returns the provider's JSON response.
     *
     * @param query search query
     * @param maxResults requested result count; null or non-positive uses the default
     * @param clientId caller key for budget accounting
     * @throws IllegalArgumentException for a blank query
     */
    public JsonNode search(String query, Integer maxResults, String clientId) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        int resultCount = maxResults == null || maxResults <= 0
                ? DEFAULT_MAX_RESULTS
                : Math.min(maxResults, MAX_RESULTS_CAP);
        budgetGate.checkSearchBudget(ApiProvider.TAVILY, clientId);

        AppProperties.Provider settings = appProperties.getProviders().getTavily();
        Duration timeout = settings.getTimeout();
        RetryOptions options = RetryOptions.forProvider(ApiProvider.TAVILY)
                .withMaxAttempts(settings.getMaxAttempts())
                .withOperation("search");

        return retryCoordinator.executeWithRetry(credential -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("api_key", credential.secret());
            body.put("query", query.trim());
            body.put("max_results", resultCount);
            JsonNode response = clientFactory.searchClient()
                    .post()
                    .uri(SEARCH_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(timeout);
            if (response == null) {
                throw new ProviderCallException(502, null, "Search returned an empty body");
            }
            if (response.hasNonNull("error") || (response.has("detail") && !response.has("results"))) {
                JsonNode error = response.hasNonNull("error") ? response.get("error") : response.get("detail");
                throw new ProviderCallException(ProviderFailure.NO_STATUS, null,
                        "Search returned an error payload: " + error);
            }
            return response;
        }, options);
    }
}
