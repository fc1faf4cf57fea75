package com.williamcallahan.keycoordinator.service;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.williamcallahan.keycoordinator.config.AppProperties;
import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import com.williamcallahan.keycoordinator.service.credential.Credential;
import jakarta.annotation.PreDestroy;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Builds provider clients bound to a single credential.
 *
 * <p>OpenAI SDK clients are created with {@code maxRetries(0)}; retries belong to the coordinator
 * alone. One client is cached per credential handle.</p>
 */
@Component
public class ProviderClientFactory {
    private static final Logger log = LoggerFactory.getLogger(ProviderClientFactory.class);

    private final AppProperties appProperties;
    private final WebClient searchWebClient;
    private final Map<Credential, OpenAIClient> openAiClients = new ConcurrentHashMap<>();

    public ProviderClientFactory(AppProperties appProperties, WebClient.Builder webClientBuilder) {
        this.appProperties = Objects.requireNonNull(appProperties, "appProperties");
        String searchBaseUrl = appProperties.getProviders().getTavily().resolveBaseUrl(ApiProvider.TAVILY);
        this.searchWebClient = Objects.requireNonNull(webClientBuilder, "webClientBuilder")
                .baseUrl(searchBaseUrl)
                .build();
    }

    /**
     * Returns the OpenAI-compatible client for a credential, creating it on first use.
     *
     * @throws IllegalArgumentException when the credential's provider has no OpenAI-compatible API
     */
    public OpenAIClient openAiClient(Credential credential) {
        Objects.requireNonNull(credential, "credential");
        ApiProvider provider = credential.provider();
        if (!provider.isOpenAiCompatible()) {
            throw new IllegalArgumentException(provider.getName() + " does not expose an OpenAI-compatible API");
        }
        return openAiClients.computeIfAbsent(credential, key -> {
            AppProperties.Provider settings = appProperties.getProviders().forProvider(provider);
            log.debug("[{}] Creating client for key {}", provider.getName(), key.maskedId());
            return OpenAIOkHttpClient.builder()
                    .apiKey(key.secret())
                    .baseUrl(settings.resolveBaseUrl(provider))
                    .timeout(settings.getTimeout())
                    .maxRetries(0)
                    .build();
        });
    }

    /**
     * Returns the shared WebClient for the search API. Authentication travels in each request.
     */
    public WebClient searchClient() {
        return searchWebClient;
    }

    @PreDestroy
    void closeClients() {
        openAiClients.values().forEach(client -> {
            try {
                client.close();
            } catch (RuntimeException closeFailure) {
                log.debug("Ignoring client close failure: {}", closeFailure.getMessage());
            }
        });
        openAiClients.clear();
    }
}
