package com.supportdesk.assistant.service.intent;

import com.supportdesk.assistant.model.IntentCategory;
import com.supportdesk.assistant.model.ParsedIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-first intent parser. Keyword rules run in a fixed priority order and only text that no rule
 * recognises is sent to the LLM classifier.
 */
@Component
public class DefaultIntentParser implements IntentParser {

    private static final Logger log = LoggerFactory.getLogger(DefaultIntentParser.class);

    static final double EMPTY_CONFIDENCE = 0.1;
    static final double STATUS_CONFIDENCE = 0.85;
    static final double DRAFT_CONFIDENCE = 0.8;
    static final double ESCALATION_CONFIDENCE = 0.8;
    static final double CONTEXT_CONFIDENCE = 0.78;

    private static final Pattern STATUS = Pattern.compile("(?i)\\b(status|urgent|pending|health)\\b");
    private static final Pattern DRAFT = Pattern.compile("(?i)\\b(approve|send|simplify|rewrite|shorten)\\b");
    private static final Pattern ESCALATE = Pattern.compile("(?i)\\bescalate\\b");
    private static final Pattern ESCALATE_TO = Pattern.compile("(?i)\\bescalate\\s+to\\s+([^?!.]+)");
    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern CONTEXT = Pattern.compile("(?i)\\b(history|who is|look ?up|context)\\b");
    private static final Pattern CONTEXT_NAME = Pattern.compile("(?i)\\b(?:history (?:of|for)|who is|look ?up|context (?:on|for))\\s+([^?!.]+)");

    private final LlmIntentClassifier llmClassifier;
    private final boolean llmEnabled;
    private final double llmThreshold;

    public DefaultIntentParser(LlmIntentClassifier llmClassifier,
                               @Value("${assistant.intent.llm.enabled:true}") boolean llmEnabled,
                               @Value("${assistant.intent.llm.threshold:0.5}") double llmThreshold) {
        this.llmClassifier = llmClassifier;
        this.llmEnabled = llmEnabled;
        this.llmThreshold = llmThreshold;
    }

    @Override
    public ParsedIntent parse(String rawText) {
        String text = MentionText.strip(rawText);
        if (text.isEmpty()) {
            return ParsedIntent.of(IntentCategory.UNKNOWN, EMPTY_CONFIDENCE, text);
        }
        return matchRules(text).orElseGet(() -> classifyWithLlm(text));
    }

    private Optional<ParsedIntent> matchRules(String text) {
        if (STATUS.matcher(text).find()) {
            return Optional.of(ParsedIntent.of(IntentCategory.STATUS_QUERY, STATUS_CONFIDENCE, text));
        }
        if (DRAFT.matcher(text).find()) {
            return Optional.of(ParsedIntent.of(IntentCategory.DRAFT_ACTION, DRAFT_CONFIDENCE, text));
        }
        if (ESCALATE.matcher(text).find()) {
            Map<String, String> entities = new LinkedHashMap<>();
            capture(ESCALATE_TO, text).ifPresent(name -> entities.put("name", name));
            return Optional.of(new ParsedIntent(IntentCategory.ESCALATION, ESCALATION_CONFIDENCE, entities, text));
        }
        Matcher email = EMAIL.matcher(text);
        if (email.find()) {
            return Optional.of(new ParsedIntent(IntentCategory.CONTEXT_LOOKUP, CONTEXT_CONFIDENCE,
                    Map.of("email", email.group()), text));
        }
        if (CONTEXT.matcher(text).find()) {
            Map<String, String> entities = new LinkedHashMap<>();
            capture(CONTEXT_NAME, text).ifPresent(name -> entities.put("name", name));
            return Optional.of(new ParsedIntent(IntentCategory.CONTEXT_LOOKUP, CONTEXT_CONFIDENCE, entities, text));
        }
        return Optional.empty();
    }

    private ParsedIntent classifyWithLlm(String text) {
        if (!llmEnabled) {
            return ParsedIntent.of(IntentCategory.UNKNOWN, 0.0, text);
        }
        Optional<LlmIntentClassifier.Classification> classification = llmClassifier.classify(text);
        if (classification.isEmpty()) {
            return ParsedIntent.of(IntentCategory.UNKNOWN, 0.0, text);
        }
        LlmIntentClassifier.Classification result = classification.get();
        if (result.category() == IntentCategory.UNKNOWN || result.confidence() < llmThreshold) {
            log.debug("LLM classification {} below threshold {}", result.category(), llmThreshold);
            return new ParsedIntent(IntentCategory.UNKNOWN, result.confidence(), result.entities(), text);
        }
        log.debug("LLM classified intent {} with confidence {}", result.category(), result.confidence());
        return new ParsedIntent(result.category(), result.confidence(), result.entities(), text);
    }

    private static Optional<String> capture(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = matcher.group(1).replaceAll("[\\s,]+$", "").trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
