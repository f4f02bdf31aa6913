package com.supportdesk.assistant.service.context;

public record ThreadContextLookup(Status status, ThreadContext context, String message) {

    public enum Status {
        ACTIVE,
        MISSING,
        STALE,
        ERROR
    }

    public static ThreadContextLookup active(ThreadContext context) {
        return new ThreadContextLookup(Status.ACTIVE, context, null);
    }

    public static ThreadContextLookup missing() {
        return new ThreadContextLookup(Status.MISSING, null, null);
    }

    public static ThreadContextLookup stale(String message) {
        return new ThreadContextLookup(Status.STALE, null, message);
    }

    public static ThreadContextLookup error(String message) {
        return new ThreadContextLookup(Status.ERROR, null, message);
    }

    public boolean isActive() {
        return status == Status.ACTIVE;
    }
}
