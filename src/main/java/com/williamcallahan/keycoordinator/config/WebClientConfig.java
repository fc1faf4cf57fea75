package com.williamcallahan.keycoordinator.config;

import com.williamcallahan.keycoordinator.domain.credential.ApiProvider;
import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class WebClientConfig {

    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;

    @Bean
    public WebClient.Builder webClientBuilder(AppProperties appProperties) {
        // Response timeout follows the search provider; LLM calls go through the OpenAI SDK client instead
        HttpClient httpClient = HttpClient.create()
            .responseTimeout(appProperties.getProviders().getTavily().getTimeout())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS);

        return WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
