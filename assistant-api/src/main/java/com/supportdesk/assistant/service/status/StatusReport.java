package com.supportdesk.assistant.service.status;

/**
 * Formatted answer to a status query. {@code count} is the number of conversations the answer is about.
 */
public record StatusReport(StatusQueryType type, boolean ok, String text, int count, boolean cacheHit) {

    public static StatusReport of(StatusQueryType type, String text, int count) {
        return new StatusReport(type, true, text, count, false);
    }

    public static StatusReport failure(StatusQueryType type, String text) {
        return new StatusReport(type, false, text, 0, false);
    }

    public StatusReport fromCache() {
        return new StatusReport(type, ok, text, count, true);
    }
}
