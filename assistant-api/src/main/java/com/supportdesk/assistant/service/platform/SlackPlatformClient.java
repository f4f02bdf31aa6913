package com.supportdesk.assistant.service.platform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Slack Web API adapter. Slack answers most errors with HTTP 200 and {@code "ok": false}, so the body is
 * checked as well as the status.
 */
@Component
public class SlackPlatformClient implements ChatPlatformClient {

    private static final Logger log = LoggerFactory.getLogger(SlackPlatformClient.class);

    private final WebClient apiClient;
    private final Duration timeout;

    public SlackPlatformClient(@Qualifier("platformWebClient") WebClient apiClient,
                               @Value("${assistant.platform.timeout-seconds:10}") long timeoutSeconds) {
        this.apiClient = apiClient;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    @Override
    public void postMessage(String channel, String text, String threadTs) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", channel);
        payload.put("text", text);
        if (threadTs != null) {
            payload.put("thread_ts", threadTs);
        }
        call("chat.postMessage", payload);
    }

    @Override
    public void addReaction(String channel, String messageTs, String emoji) {
        call("reactions.add", Map.of("channel", channel, "timestamp", messageTs, "name", emoji));
    }

    @Override
    public void removeReaction(String channel, String messageTs, String emoji) {
        call("reactions.remove", Map.of("channel", channel, "timestamp", messageTs, "name", emoji));
    }

    private void call(String method, Map<String, Object> payload) {
        SlackResponse response;
        try {
            response = apiClient.post()
                    .uri("/" + method)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(SlackResponse.class)
                    .block(timeout);
        } catch (WebClientResponseException ex) {
            log.warn("Slack {} returned {}: {}", method, ex.getStatusCode(), ex.getResponseBodyAsString());
            throw new ChatPlatformException("Slack " + method + " returned " + ex.getStatusCode().value(), ex);
        } catch (Exception ex) {
            throw new ChatPlatformException("Slack " + method + " failed", ex);
        }
        if (response == null || !response.ok()) {
            String error = response == null ? "empty response" : response.error();
            throw new ChatPlatformException("Slack " + method + " rejected the call: " + error);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SlackResponse(boolean ok, String error) {
    }
}
