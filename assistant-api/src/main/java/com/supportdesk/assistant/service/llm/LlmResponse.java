package com.supportdesk.assistant.service.llm;

public record LlmResponse(String text, String model) {

    public String trimmedText() {
        return text == null ? "" : text.trim();
    }
}
