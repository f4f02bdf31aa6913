package com.supportdesk.assistant.service.intent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supportdesk.assistant.model.IntentCategory;
import com.supportdesk.assistant.service.llm.LlmClient;
import com.supportdesk.assistant.service.llm.LlmException;
import com.supportdesk.assistant.service.llm.LlmRequest;
import com.supportdesk.assistant.service.llm.LlmResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class LlmIntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(LlmIntentClassifier.class);

    private static final List<String> ENTITY_KEYS = List.of("email", "name", "query", "product");

    static final String SYSTEM_PROMPT = "You classify messages sent to a customer support assistant in a team chat."
            + " Return a strict JSON object with keys category, confidence and entities."
            + " The category MUST be one of: status_query, draft_action, context_lookup, escalation, general_query, unknown."
            + " Use general_query for questions that should be answered by searching support conversations,"
            + " and unknown when the request is unclear."
            + " Confidence must be between 0.0 and 1.0."
            + " entities is an object that may contain the string keys email, name, query and product; omit keys you cannot extract.";

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;

    public LlmIntentClassifier(LlmClient llmClient, ObjectMapper objectMapper) {
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
    }

    public Optional<Classification> classify(String text) {
        try {
            LlmResponse response = llmClient.generate(LlmRequest.json(SYSTEM_PROMPT, "Message: " + text));
            String content = sanitize(response.trimmedText());
            if (content.isEmpty()) {
                return Optional.empty();
            }
            JsonNode node = objectMapper.readTree(content);
            Optional<IntentCategory> category = IntentCategory.fromLabel(node.path("category").asText(null));
            if (category.isEmpty()) {
                log.debug("LLM returned unsupported category {}", node.path("category").asText(null));
                return Optional.empty();
            }
            double confidence = node.path("confidence").asDouble(0.0);
            return Optional.of(new Classification(category.get(), confidence, entities(node.path("entities"))));
        } catch (LlmException ex) {
            log.warn("LLM intent classification failed with API error: {}", ex.getMessage());
            return Optional.empty();
        } catch (Exception ex) {
            log.warn("LLM intent classification parsing failed: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    private Map<String, String> entities(JsonNode node) {
        Map<String, String> entities = new LinkedHashMap<>();
        if (!node.isObject()) {
            return entities;
        }
        for (String key : ENTITY_KEYS) {
            JsonNode value = node.get(key);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                entities.put(key, value.asText().trim());
            }
        }
        return entities;
    }

    private String sanitize(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("```") && trimmed.endsWith("```")) {
            trimmed = trimmed.replaceAll("^```(json)?\\s*", "");
            trimmed = trimmed.substring(0, trimmed.length() - 3).trim();
        }
        return trimmed;
    }

    public record Classification(IntentCategory category, double confidence, Map<String, String> entities) {
    }
}
