package com.supportdesk.assistant.service.confirmation;

import com.supportdesk.assistant.config.AssistantProperties;
import com.supportdesk.assistant.service.action.QuickAction;
import com.supportdesk.assistant.service.action.QuickActionContext;
import com.supportdesk.assistant.service.audit.AssistantEventLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Two-step execution for destructive quick actions: {@link #request} stores the action and returns the prompt,
 * {@link #resolve} consumes a yes/no reply. Replies outside the vocabulary leave the pending action in place.
 */
@Component
public class ActionConfirmationGate {

    private static final Logger log = LoggerFactory.getLogger(ActionConfirmationGate.class);

    static final int PREVIEW_LIMIT = 200;

    private static final Pattern AFFIRMATIVE = Pattern.compile("^(yes|yep|y|confirm|approved|approve)$");
    private static final Pattern NEGATIVE = Pattern.compile("^(no|cancel|stop|abort|nevermind)$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String REPLY_HINT = "Reply yes to confirm or cancel to abort.";

    private final ActionConfirmationStore store;
    private final AssistantEventLogger eventLogger;
    private final Clock clock;
    private final Duration ttl;

    public ActionConfirmationGate(ActionConfirmationStore store,
                                  AssistantEventLogger eventLogger,
                                  Clock clock,
                                  AssistantProperties properties) {
        this.store = store;
        this.eventLogger = eventLogger;
        this.clock = clock;
        this.ttl = properties.getConfirmation().getTtl();
    }

    public boolean requiresConfirmation(QuickAction action) {
        return action.type().destructive();
    }

    public ConfirmationRequest request(String threadId, QuickAction action, QuickActionContext context) {
        ActionConfirmationState state = new ActionConfirmationState(threadId, action, context, clock.instant());
        store.put(state);
        return new ConfirmationRequest(buildMessage(action, context), state);
    }

    /**
     * Returns the live pending confirmation for a thread. An expired one is removed and reported as absent.
     */
    public Optional<ActionConfirmationState> pending(String threadId) {
        Optional<ActionConfirmationState> state = store.find(threadId);
        if (state.isPresent() && isExpired(state.get())) {
            log.debug("Discarding expired confirmation for thread {}", threadId);
            store.delete(threadId);
            return Optional.empty();
        }
        return state;
    }

    public ConfirmationResolution resolve(String threadId, String replyText) {
        Optional<ActionConfirmationState> state = pending(threadId);
        if (state.isEmpty()) {
            return ConfirmationResolution.ignore();
        }
        String normalized = replyText == null ? "" : replyText.trim().toLowerCase(Locale.ROOT);
        ConfirmationResolution resolution;
        if (AFFIRMATIVE.matcher(normalized).matches()) {
            resolution = ConfirmationResolution.confirm(state.get().action(), state.get().context());
        } else if (NEGATIVE.matcher(normalized).matches()) {
            resolution = ConfirmationResolution.cancel();
        } else {
            return ConfirmationResolution.ignore();
        }
        store.delete(threadId);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("threadId", threadId);
        payload.put("actionType", state.get().action().type().label());
        payload.put("decision", resolution.decision().name().toLowerCase(Locale.ROOT));
        eventLogger.info("assistant.confirmation_resolved", payload);
        return resolution;
    }

    String buildMessage(QuickAction action, QuickActionContext context) {
        switch (action.type()) {
            case APPROVE_SEND: {
                String recipient = context.recipientEmail() == null || context.recipientEmail().isBlank()
                        ? "the customer"
                        : context.recipientEmail();
                String preview = context.hasDraftText() ? preview(context.draftText()) : "No draft text available.";
                return "Ready to send this response to " + recipient + ":\n> " + preview + "\n" + REPLY_HINT;
            }
            case ARCHIVE:
            case CLOSE:
                return "You're about to archive this conversation. " + REPLY_HINT;
            case ESCALATE: {
                String assignee = action instanceof QuickAction.Escalate escalate ? escalate.assignee() : "a teammate";
                return "You're about to escalate this conversation to " + assignee + ". " + REPLY_HINT;
            }
            case ADD_CONTEXT:
                return "You're about to add an internal context note. " + REPLY_HINT;
            default:
                return REPLY_HINT;
        }
    }

    static String preview(String text) {
        String normalized = WHITESPACE.matcher(text).replaceAll(" ").trim();
        if (normalized.length() <= PREVIEW_LIMIT) {
            return normalized;
        }
        return normalized.substring(0, PREVIEW_LIMIT) + "...";
    }

    private boolean isExpired(ActionConfirmationState state) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        Instant expiresAt = state.createdAt().plus(ttl);
        return clock.instant().isAfter(expiresAt);
    }

    public record ConfirmationRequest(String message, ActionConfirmationState state) {
    }
}
