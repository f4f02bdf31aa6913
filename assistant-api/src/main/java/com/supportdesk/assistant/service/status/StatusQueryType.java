package com.supportdesk.assistant.service.status;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StatusQueryType {
    URGENT,
    PENDING,
    HEALTH;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
