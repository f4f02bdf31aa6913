package com.supportdesk.assistant.service.draft;

import com.supportdesk.assistant.service.audit.AssistantEventLogger;
import com.supportdesk.assistant.service.draft.statemachine.DraftEvent;
import com.supportdesk.assistant.service.draft.statemachine.DraftStatusMachine;
import com.supportdesk.assistant.service.llm.LlmClient;
import com.supportdesk.assistant.service.llm.LlmException;
import com.supportdesk.assistant.service.llm.LlmRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the version history of reply drafts, one per chat thread.
 */
@Component
public class DraftRefinementEngine {

    private static final Logger log = LoggerFactory.getLogger(DraftRefinementEngine.class);

    static final String SYSTEM_PROMPT = "You are refining a customer support draft. Return only the revised draft text.";

    private final DraftStore draftStore;
    private final DraftStatusMachine statusMachine;
    private final LlmClient llmClient;
    private final AssistantEventLogger eventLogger;
    private final Clock clock;

    public DraftRefinementEngine(DraftStore draftStore,
                                 DraftStatusMachine statusMachine,
                                 LlmClient llmClient,
                                 AssistantEventLogger eventLogger,
                                 Clock clock) {
        this.draftStore = draftStore;
        this.statusMachine = statusMachine;
        this.llmClient = llmClient;
        this.eventLogger = eventLogger;
        this.clock = clock;
    }

    /**
     * Starts a fresh history for the thread with {@code text} as {@code v0}, replacing any earlier draft.
     */
    public DraftThreadState register(String threadId, String text, String conversationId, String recipientEmail) {
        DraftThreadState state = DraftThreadState.seed(threadId, text, clock.instant(), conversationId, recipientEmail);
        draftStore.save(state);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("threadId", threadId);
        payload.put("conversationId", conversationId);
        payload.put("length", text.length());
        eventLogger.info("assistant.draft_registered", payload);
        return state;
    }

    public Optional<DraftThreadState> find(String threadId) {
        return draftStore.find(threadId);
    }

    public DraftRefinementResult refine(String threadId, RefinementIntent intent, String userId) {
        if (!intent.type().producesRevision()) {
            return DraftRefinementResult.failure("That feedback changes the draft status, not its text.");
        }
        Optional<DraftThreadState> existing = draftStore.find(threadId);
        if (existing.isEmpty()) {
            return DraftRefinementResult.failure("I couldn't find a draft in this thread to refine.");
        }
        DraftThreadState state = existing.get();
        if (!statusMachine.permits(state.status(), DraftEvent.REFINE)) {
            return DraftRefinementResult.failure("This draft is already " + state.status().label() + " and can't be changed.");
        }

        DraftVersion previous = state.latest();
        String generated;
        try {
            generated = llmClient.generate(LlmRequest.text(SYSTEM_PROMPT, userPrompt(previous.text(), intent)))
                    .trimmedText();
        } catch (LlmException ex) {
            log.error("Refining draft {} for thread {} failed", previous.id(), threadId, ex);
            return DraftRefinementResult.failure("I couldn't refine the draft. Please try again.");
        }
        String revisedText = generated.isEmpty() ? previous.text() : generated;

        DraftVersion revision = new DraftVersion(state.nextVersionId(), revisedText, clock.instant(), intent);
        DraftThreadState updated = state.withVersion(revision);
        draftStore.save(updated);

        int charDelta = revisedText.length() - previous.text().length();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("threadId", threadId);
        payload.put("userId", userId);
        payload.put("intentType", intent.type().label());
        payload.put("version", revision.id());
        payload.put("charDelta", charDelta);
        eventLogger.info("assistant.draft_refined", payload);
        return DraftRefinementResult.success(updated, revision, indicator(charDelta), charDelta);
    }

    public DraftTransitionResult approve(String threadId, String userId) {
        return transition(threadId, DraftEvent.APPROVE, userId, null);
    }

    public DraftTransitionResult reject(String threadId, String reason, String userId) {
        return transition(threadId, DraftEvent.REJECT, userId, reason);
    }

    /**
     * Whether the thread's draft may still be delivered to the customer.
     */
    public boolean canSend(DraftThreadState state) {
        return statusMachine.permits(state.status(), DraftEvent.SEND);
    }

    /**
     * Records that the latest version was delivered to the customer.
     */
    public DraftTransitionResult markSent(String threadId) {
        return transition(threadId, DraftEvent.SEND, null, null);
    }

    private DraftTransitionResult transition(String threadId, DraftEvent event, String userId, String reason) {
        Optional<DraftThreadState> existing = draftStore.find(threadId);
        if (existing.isEmpty()) {
            return DraftTransitionResult.failure(null, "I couldn't find a draft in this thread.");
        }
        DraftThreadState state = existing.get();
        Optional<DraftStatus> next = statusMachine.fire(state.status(), event);
        if (next.isEmpty()) {
            return DraftTransitionResult.failure(state, "This draft is already " + state.status().label() + ".");
        }

        Instant now = clock.instant();
        DraftThreadState updated;
        String message;
        String eventName;
        switch (next.get()) {
            case APPROVED -> {
                updated = state.approved(now);
                message = "Approved. I will send this once it clears the approval flow.";
                eventName = "assistant.draft_approved";
            }
            case REJECTED -> {
                updated = state.rejected(now, reason);
                message = reason == null || reason.isBlank()
                        ? "Understood, I won't send this."
                        : "Understood, I won't send this. Reason noted: " + reason;
                eventName = "assistant.draft_rejected";
            }
            case SENT -> {
                updated = state.sent(now);
                message = "Draft marked as sent.";
                eventName = "assistant.draft_sent";
            }
            default -> {
                return DraftTransitionResult.failure(state, "This draft can't change status right now.");
            }
        }
        draftStore.save(updated);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("threadId", threadId);
        payload.put("userId", userId);
        payload.put("version", updated.latest().id());
        payload.put("reason", reason);
        eventLogger.info(eventName, payload);
        return DraftTransitionResult.success(updated, message);
    }

    static String instruction(RefinementIntent intent) {
        if (intent instanceof RefinementIntent.AddContent addContent) {
            return "Add the following content: " + addContent.content();
        }
        if (intent instanceof RefinementIntent.MentionTopic mentionTopic) {
            return "Explicitly mention the topic: " + mentionTopic.topic();
        }
        return switch (intent.type()) {
            case SIMPLIFY -> "Simplify the language while preserving meaning.";
            case FORMALIZE -> "Make the tone more formal and professional.";
            case SHORTEN -> "Shorten the draft while keeping key information.";
            default -> "Revise the draft based on the latest feedback.";
        };
    }

    static String userPrompt(String currentText, RefinementIntent intent) {
        return "Current draft:\n" + currentText + "\n\nInstruction: " + instruction(intent);
    }

    static String indicator(int charDelta) {
        if (charDelta == 0) {
            return "no length change";
        }
        return (charDelta > 0 ? "+" : "") + charDelta + " chars";
    }
}
