package com.supportdesk.assistant.service.crm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Component
public class WebClientCrmClient implements CrmClient {

    private static final Logger log = LoggerFactory.getLogger(WebClientCrmClient.class);

    private final WebClient apiClient;
    private final Duration timeout;

    public WebClientCrmClient(@Qualifier("crmWebClient") WebClient apiClient,
                              @Value("${assistant.crm.timeout-seconds:20}") long timeoutSeconds) {
        this.apiClient = apiClient;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    @Override
    public List<CrmConversation> search(String query) {
        try {
            SearchResponse response = apiClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/conversations/search/{query}").build(query))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(SearchResponse.class)
                    .block(timeout);
            return response == null || response.results() == null ? List.of() : response.results();
        } catch (Exception ex) {
            throw wrap("search", query, ex);
        }
    }

    @Override
    public void archive(String conversationId) {
        send("archive", conversationId, apiClient.patch()
                .uri("/conversations/{id}", conversationId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "archived")));
    }

    @Override
    public void assign(String conversationId, String assigneeId) {
        send("assign", conversationId, apiClient.put()
                .uri("/conversations/{id}/assignee", conversationId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("assignee_id", assigneeId)));
    }

    @Override
    public void addComment(String conversationId, String body) {
        send("comment", conversationId, apiClient.post()
                .uri("/conversations/{id}/comments", conversationId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("body", body)));
    }

    @Override
    public void postMessage(String conversationId, String body) {
        send("message", conversationId, apiClient.post()
                .uri("/conversations/{id}/messages", conversationId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("body", body)));
    }

    private void send(String operation, String conversationId, WebClient.RequestHeadersSpec<?> request) {
        try {
            request.retrieve()
                    .bodyToMono(Void.class)
                    .block(timeout);
        } catch (Exception ex) {
            throw wrap(operation, conversationId, ex);
        }
    }

    private CrmException wrap(String operation, String target, Exception ex) {
        if (ex instanceof WebClientResponseException responseException) {
            log.warn("CRM {} for {} returned {}: {}", operation, target,
                    responseException.getStatusCode(), responseException.getResponseBodyAsString());
            return new CrmException("CRM " + operation + " returned " + responseException.getStatusCode().value(), ex);
        }
        log.warn("CRM {} for {} failed: {}", operation, target, ex.getMessage());
        return new CrmException("CRM " + operation + " failed", ex);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SearchResponse(@JsonProperty("_results") List<CrmConversation> results) {
    }
}
