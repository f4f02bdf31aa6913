package com.supportdesk.assistant.service.audit;

import org.slf4j.event.Level;

import java.util.Map;

/**
 * Append-only structured event sink. Implementations must never throw: a failing
 * sink cannot fail the operation that emitted the event.
 */
public interface AssistantEventLogger {

    void log(Level level, String eventName, Map<String, ?> payload);

    default void info(String eventName, Map<String, ?> payload) {
        log(Level.INFO, eventName, payload);
    }
}
