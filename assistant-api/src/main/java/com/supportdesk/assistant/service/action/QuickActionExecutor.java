package com.supportdesk.assistant.service.action;

import com.supportdesk.assistant.service.audit.AssistantEventLogger;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Dispatches a quick action to its handler. Every attempt is counted and written to the event log,
 * including local rejections.
 */
@Component
public class QuickActionExecutor {

    static final String METRIC_NAME = "assistant.quick_actions";

    private final List<QuickActionHandler> handlers;
    private final AssistantEventLogger eventLogger;
    private final MeterRegistry meterRegistry;

    public QuickActionExecutor(List<QuickActionHandler> handlers,
                               AssistantEventLogger eventLogger,
                               MeterRegistry meterRegistry) {
        this.handlers = handlers;
        this.eventLogger = eventLogger;
        this.meterRegistry = meterRegistry;
    }

    public QuickActionResult execute(QuickAction action, QuickActionContext context) {
        Optional<QuickActionHandler> handler = handlers.stream()
                .filter(candidate -> candidate.supports(action.type()))
                .findFirst();
        QuickActionResult result = handler
                .map(found -> found.handle(action, context))
                .orElseGet(() -> QuickActionResult.rejected("I couldn't determine the requested action."));
        record(action, context, result);
        return result;
    }

    private void record(QuickAction action, QuickActionContext context, QuickActionResult result) {
        meterRegistry.counter(METRIC_NAME,
                        "action", action.type().label(),
                        "outcome", result.outcome().name().toLowerCase(Locale.ROOT))
                .increment();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("actionType", action.type().label());
        payload.put("conversationId", context.conversationId());
        payload.put("threadId", context.threadId());
        payload.put("channel", context.channel());
        payload.put("requestedBy", context.requestedBy());
        payload.put("success", result.ok());
        payload.put("partial", result.partial());
        eventLogger.log(levelFor(result), "assistant.quick_action", payload);
    }

    private static Level levelFor(QuickActionResult result) {
        return switch (result.outcome()) {
            case SUCCESS -> Level.INFO;
            case PARTIAL, REJECTED -> Level.WARN;
            case FAILED -> Level.ERROR;
        };
    }
}
