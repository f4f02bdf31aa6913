package com.supportdesk.assistant.service.context;

public record ThreadContextWriteResult(boolean ok, ThreadContext context, String message) {

    public static ThreadContextWriteResult ok(ThreadContext context) {
        return new ThreadContextWriteResult(true, context, null);
    }

    public static ThreadContextWriteResult error(String message) {
        return new ThreadContextWriteResult(false, null, message);
    }
}
