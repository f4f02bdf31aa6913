package com.supportdesk.assistant.model;

import java.util.Map;

public record ParsedIntent(
        IntentCategory category,
        double confidence,
        Map<String, String> entities,
        String rawText
) {

    public ParsedIntent {
        entities = entities == null ? Map.of() : Map.copyOf(entities);
    }

    public static ParsedIntent of(IntentCategory category, double confidence, String rawText) {
        return new ParsedIntent(category, confidence, Map.of(), rawText);
    }

    public String entity(String name) {
        return entities.get(name);
    }
}
