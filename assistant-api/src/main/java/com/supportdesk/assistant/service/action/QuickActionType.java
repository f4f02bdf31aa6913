package com.supportdesk.assistant.service.action;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QuickActionType {
    APPROVE_SEND("approve_send", true),
    ESCALATE("escalate", false),
    ADD_CONTEXT("add_context", false),
    ARCHIVE("archive", true),
    CLOSE("close", true);

    private final String label;
    private final boolean destructive;

    QuickActionType(String label, boolean destructive) {
        this.label = label;
        this.destructive = destructive;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Destructive actions touch the customer or remove the conversation from the queue and are gated
     * behind an explicit yes/no reply.
     */
    public boolean destructive() {
        return destructive;
    }
}
