package com.supportdesk.assistant.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum IntentCategory {
    STATUS_QUERY("status_query"),
    DRAFT_ACTION("draft_action"),
    CONTEXT_LOOKUP("context_lookup"),
    ESCALATION("escalation"),
    QUICK_ACTION("quick_action"),
    GENERAL_QUERY("general_query"),
    UNKNOWN("unknown");

    private final String label;

    IntentCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<IntentCategory> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(category -> category.label.equals(normalized))
                .findFirst();
    }
}
