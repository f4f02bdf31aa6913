package com.supportdesk.assistant.service.draft.statemachine;

public enum DraftEvent {
    REFINE,
    APPROVE,
    REJECT,
    SEND
}
