package com.supportdesk.assistant.service.llm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Blocking client for an OpenAI-compatible chat-completions endpoint. Only the first choice is read.
 */
@Component
public class OpenAiChatClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);
    private static final String COMPLETIONS_PATH = "/v1/chat/completions";

    private final WebClient webClient;
    private final Duration timeout;

    public OpenAiChatClient(@Qualifier("llmWebClient") WebClient webClient,
                            @Value("${assistant.llm.timeout-seconds:60}") long timeoutSeconds) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    public Completion complete(CompletionRequest request) {
        ChatCompletionResponse response;
        try {
            response = webClient.post()
                    .uri(COMPLETIONS_PATH)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(ChatCompletionResponse.class)
                    .timeout(timeout)
                    .onErrorResume(WebClientResponseException.class, this::logAndWrap)
                    .block(timeout);
        } catch (LlmException ex) {
            throw ex;
        } catch (Exception ex) {
            log.warn("Chat completion for model {} failed: {}", request.model(), ex.getMessage(), ex);
            throw new LlmException("Failed to invoke chat completion", ex);
        }
        return Completion.from(response);
    }

    private Mono<ChatCompletionResponse> logAndWrap(WebClientResponseException exception) {
        HttpStatusCode status = exception.getStatusCode();
        log.warn("Chat completion returned {}: {}", status, exception.getResponseBodyAsString());
        return Mono.error(new LlmException("Chat completion returned " + status.value(), exception));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CompletionRequest(String model,
                                    List<Message> messages,
                                    Double temperature,
                                    @JsonProperty("max_tokens") Integer maxTokens,
                                    @JsonProperty("response_format") ResponseFormat responseFormat) {

        public static CompletionRequest of(String model, String systemPrompt, String userPrompt,
                                           double temperature, int maxTokens, boolean jsonObject) {
            List<Message> messages = List.of(
                    new Message("system", systemPrompt),
                    new Message("user", userPrompt == null ? "" : userPrompt));
            return new CompletionRequest(model, messages, temperature, maxTokens,
                    jsonObject ? ResponseFormat.JSON_OBJECT : null);
        }
    }

    public record ResponseFormat(String type) {
        static final ResponseFormat JSON_OBJECT = new ResponseFormat("json_object");
    }

    public record Message(String role, String content) {
    }

    /**
     * First choice of a completion. {@code content} is null when the endpoint returned no choices.
     */
    public record Completion(String content, String finishReason) {

        static Completion from(ChatCompletionResponse response) {
            if (response == null || response.choices() == null || response.choices().isEmpty()) {
                return new Completion(null, null);
            }
            Choice choice = response.choices().get(0);
            String content = choice.message() == null ? null : choice.message().content();
            return new Completion(content, choice.finishReason());
        }

        public boolean truncated() {
            return "length".equals(finishReason);
        }
    }

    public record ChatCompletionResponse(List<Choice> choices) {
    }

    public record Choice(Message message, @JsonProperty("finish_reason") String finishReason) {
    }
}
