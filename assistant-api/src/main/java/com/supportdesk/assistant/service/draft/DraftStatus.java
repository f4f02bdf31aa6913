package com.supportdesk.assistant.service.draft;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DraftStatus {
    DRAFT,
    APPROVED,
    REJECTED,
    SENT;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
