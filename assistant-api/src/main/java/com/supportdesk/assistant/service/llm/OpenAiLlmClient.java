package com.supportdesk.assistant.service.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Objects;

@Component
public class OpenAiLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiLlmClient.class);
    private static final String DEFAULT_MODEL = "gpt-4o-mini";

    private final OpenAiChatClient chatClient;
    private final String model;
    private final double temperature;
    private final int maxOutputTokens;

    public OpenAiLlmClient(OpenAiChatClient chatClient,
                           @Value("${assistant.llm.model:" + DEFAULT_MODEL + "}") String model,
                           @Value("${assistant.llm.temperature:0.2}") double temperature,
                           @Value("${assistant.llm.max-output-tokens:1024}") int maxOutputTokens) {
        this.chatClient = chatClient;
        this.model = Objects.requireNonNullElse(model, DEFAULT_MODEL);
        this.temperature = temperature;
        this.maxOutputTokens = Math.max(128, maxOutputTokens);
    }

    @Override
    public LlmResponse generate(LlmRequest request) {
        OpenAiChatClient.Completion completion = chatClient.complete(OpenAiChatClient.CompletionRequest.of(
                model, request.systemPrompt(), request.userPrompt(), temperature, maxOutputTokens, request.jsonOutput()));
        if (completion.content() == null) {
            log.warn("LLM returned no content for model {}", model);
            return new LlmResponse("", model);
        }
        if (completion.truncated()) {
            log.warn("LLM output for model {} stopped at the {} token limit", model, maxOutputTokens);
        }
        return new LlmResponse(completion.content(), model);
    }
}
