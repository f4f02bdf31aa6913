package com.supportdesk.assistant.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient crmWebClient(AssistantProperties properties) {
        return authorizedClient(properties.getCrm().getBaseUrl(), properties.getCrm().getApiToken(), 0);
    }

    @Bean
    public WebClient platformWebClient(AssistantProperties properties) {
        return authorizedClient(properties.getPlatform().getBaseUrl(), properties.getPlatform().getBotToken(), 0);
    }

    @Bean
    public WebClient llmWebClient(@Value("${assistant.llm.base-url:http://localhost:1234}") String baseUrl,
                                  @Value("${assistant.llm.api-key:}") String apiKey,
                                  @Value("${assistant.llm.timeout-seconds:60}") long timeoutSeconds) {
        return authorizedClient(baseUrl, apiKey, timeoutSeconds);
    }

    private WebClient authorizedClient(String baseUrl, String token, long timeoutSeconds) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(baseUrl)
                .exchangeStrategies(exchangeStrategies());
        if (timeoutSeconds > 0) {
            HttpClient httpClient = HttpClient.create()
                    .responseTimeout(Duration.ofSeconds(timeoutSeconds));
            builder.clientConnector(new ReactorClientHttpConnector(httpClient));
        }
        if (token != null && !token.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        }
        builder.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        builder.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        return builder.build();
    }

    private ExchangeStrategies exchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
    }
}
