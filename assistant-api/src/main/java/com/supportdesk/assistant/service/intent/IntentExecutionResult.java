package com.supportdesk.assistant.service.intent;

public record IntentExecutionResult(boolean ok, String message) {

    public static IntentExecutionResult success(String message) {
        return new IntentExecutionResult(true, message);
    }

    public static IntentExecutionResult failure(String message) {
        return new IntentExecutionResult(false, message);
    }
}
