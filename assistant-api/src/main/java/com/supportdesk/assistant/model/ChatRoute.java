package com.supportdesk.assistant.model;

public enum ChatRoute {
    CONFIRMATION_REQUESTED,
    CONFIRMATION_CONFIRMED,
    CONFIRMATION_CANCELED,
    QUICK_ACTION,
    CONTEXT_RESET,
    DRAFT_REFINED,
    DRAFT_APPROVED,
    DRAFT_REJECTED,
    INTENT,
    FAILED
}
