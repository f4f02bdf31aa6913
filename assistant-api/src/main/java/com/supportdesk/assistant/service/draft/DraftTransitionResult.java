package com.supportdesk.assistant.service.draft;

public record DraftTransitionResult(boolean ok, DraftThreadState state, String message) {

    public static DraftTransitionResult success(DraftThreadState state, String message) {
        return new DraftTransitionResult(true, state, message);
    }

    public static DraftTransitionResult failure(DraftThreadState state, String message) {
        return new DraftTransitionResult(false, state, message);
    }
}
