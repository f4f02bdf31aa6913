package com.supportdesk.assistant.service.llm;

public record LlmRequest(String systemPrompt,
                         String userPrompt,
                         boolean jsonOutput) {

    public static LlmRequest text(String systemPrompt, String userPrompt) {
        return new LlmRequest(systemPrompt, userPrompt, false);
    }

    public static LlmRequest json(String systemPrompt, String userPrompt) {
        return new LlmRequest(systemPrompt, userPrompt, true);
    }
}
