package com.supportdesk.assistant.service;

import com.supportdesk.assistant.config.AssistantProperties;
import com.supportdesk.assistant.model.ChatOutcome;
import com.supportdesk.assistant.model.ChatRoute;
import com.supportdesk.assistant.model.DraftView;
import com.supportdesk.assistant.model.InboundChatEvent;
import com.supportdesk.assistant.model.IntentCategory;
import com.supportdesk.assistant.model.ParsedIntent;
import com.supportdesk.assistant.model.RegisterDraftRequest;
import com.supportdesk.assistant.service.action.QuickAction;
import com.supportdesk.assistant.service.action.QuickActionContext;
import com.supportdesk.assistant.service.action.QuickActionExecutor;
import com.supportdesk.assistant.service.action.QuickActionParser;
import com.supportdesk.assistant.service.action.QuickActionResult;
import com.supportdesk.assistant.service.action.QuickActionType;
import com.supportdesk.assistant.service.audit.AssistantEventLogger;
import com.supportdesk.assistant.service.confirmation.ActionConfirmationGate;
import com.supportdesk.assistant.service.confirmation.ConfirmationResolution;
import com.supportdesk.assistant.service.context.ThreadContext;
import com.supportdesk.assistant.service.context.ThreadContextLookup;
import com.supportdesk.assistant.service.context.ThreadContextStore;
import com.supportdesk.assistant.service.context.ThreadContextWriteResult;
import com.supportdesk.assistant.service.draft.DraftRefinementEngine;
import com.supportdesk.assistant.service.draft.DraftRefinementResult;
import com.supportdesk.assistant.service.draft.DraftThreadState;
import com.supportdesk.assistant.service.draft.DraftTransitionResult;
import com.supportdesk.assistant.service.draft.RefinementIntent;
import com.supportdesk.assistant.service.draft.RefinementIntentParser;
import com.supportdesk.assistant.service.intent.IntentExecutionResult;
import com.supportdesk.assistant.service.intent.IntentExecutor;
import com.supportdesk.assistant.service.intent.IntentParser;
import com.supportdesk.assistant.service.intent.MentionText;
import com.supportdesk.assistant.service.lock.ThreadLockRegistry;
import com.supportdesk.assistant.service.platform.ChatPlatformClient;
import com.supportdesk.assistant.service.platform.ChatPlatformException;
import com.supportdesk.assistant.service.platform.ProcessingReaction;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Handles one inbound chat event end to end. Events for the same thread are serialised; every event gets
 * exactly one reply in its thread.
 * <p>
 * Order of checks: pending confirmation, topic change, draft feedback (thread replies in a draft thread), quick
 * action, then general intent routing. "approve and send" always goes to the quick action.
 */
@Service
public class DefaultChatService implements ChatService {

    private static final Logger log = LoggerFactory.getLogger(DefaultChatService.class);
    private static final String HANDLE_TIMER = "assistant.events.handled";
    private static final double QUICK_ACTION_CONFIDENCE = 0.9;

    static final String CANCELED_TEXT = "Canceled, no changes were made.";
    static final String CONTEXT_RESET_TEXT = "Got it, starting fresh. I cleared the context for this thread.";

    private final IntentParser intentParser;
    private final IntentExecutor intentExecutor;
    private final QuickActionParser quickActionParser;
    private final QuickActionExecutor quickActionExecutor;
    private final ActionConfirmationGate confirmationGate;
    private final DraftRefinementEngine draftEngine;
    private final RefinementIntentParser refinementIntentParser;
    private final ThreadContextStore threadContextStore;
    private final ChatPlatformClient platformClient;
    private final ThreadLockRegistry threadLocks;
    private final AssistantEventLogger eventLogger;
    private final MeterRegistry meterRegistry;
    private final String processingReaction;

    public DefaultChatService(IntentParser intentParser,
                              IntentExecutor intentExecutor,
                              QuickActionParser quickActionParser,
                              QuickActionExecutor quickActionExecutor,
                              ActionConfirmationGate confirmationGate,
                              DraftRefinementEngine draftEngine,
                              RefinementIntentParser refinementIntentParser,
                              ThreadContextStore threadContextStore,
                              ChatPlatformClient platformClient,
                              ThreadLockRegistry threadLocks,
                              AssistantEventLogger eventLogger,
                              MeterRegistry meterRegistry,
                              AssistantProperties properties) {
        this.intentParser = intentParser;
        this.intentExecutor = intentExecutor;
        this.quickActionParser = quickActionParser;
        this.quickActionExecutor = quickActionExecutor;
        this.confirmationGate = confirmationGate;
        this.draftEngine = draftEngine;
        this.refinementIntentParser = refinementIntentParser;
        this.threadContextStore = threadContextStore;
        this.platformClient = platformClient;
        this.threadLocks = threadLocks;
        this.eventLogger = eventLogger;
        this.meterRegistry = meterRegistry;
        this.processingReaction = properties.getPlatform().getProcessingReaction();
    }

    @Override
    public ChatOutcome handle(InboundChatEvent event) {
        String threadId = event.threadId();
        String text = MentionText.strip(event.text());
        Timer.Sample sample = Timer.start(meterRegistry);
        ChatOutcome outcome = threadLocks.withLock(threadId, () -> {
            try (ProcessingReaction ignored = ProcessingReaction.open(platformClient, event.channel(), event.ts(), processingReaction)) {
                ChatOutcome routed = route(event, threadId, text);
                reply(event.channel(), threadId, routed.responseText());
                return routed;
            }
        });
        sample.stop(meterRegistry.timer(HANDLE_TIMER, "route", outcome.route().name().toLowerCase(Locale.ROOT)));
        return outcome;
    }

    @Override
    public DraftView registerDraft(RegisterDraftRequest request) {
        return threadLocks.withLock(request.threadId(), () -> {
            DraftThreadState state = draftEngine.register(request.threadId(), request.text(),
                    request.conversationId(), request.recipientEmail());
            ThreadContext context = threadContextStore.create(request.threadId(), request.channelId(),
                    request.conversationId(), request.text(), 0, request.customerId());
            ThreadContextWriteResult written = threadContextStore.write(context);
            if (!written.ok()) {
                log.warn("Draft registered for thread {} without thread context: {}", request.threadId(), written.message());
            }
            return toView(state);
        });
    }

    @Override
    public Optional<DraftView> findDraft(String threadId) {
        return draftEngine.find(threadId).map(DefaultChatService::toView);
    }

    private ChatOutcome route(InboundChatEvent event, String threadId, String text) {
        ConfirmationResolution resolution = confirmationGate.resolve(threadId, text);
        switch (resolution.decision()) {
            case CONFIRM:
                return confirmed(event, threadId, text, resolution);
            case CANCEL:
                return new ChatOutcome(threadId, event.channel(), ChatRoute.CONFIRMATION_CANCELED,
                        quickActionIntent(text), CANCELED_TEXT);
            case IGNORE:
            default:
                break;
        }

        if (threadContextStore.shouldClear(text)) {
            ThreadContextWriteResult cleared = threadContextStore.clear(threadId);
            String response = cleared.ok() ? CONTEXT_RESET_TEXT : cleared.message();
            return new ChatOutcome(threadId, event.channel(), ChatRoute.CONTEXT_RESET, null, response);
        }

        Optional<QuickAction> quickAction = quickActionParser.parse(text);
        boolean approveSend = quickAction.map(action -> action.type() == QuickActionType.APPROVE_SEND).orElse(false);
        if (event.isThreadReply() && !approveSend && draftEngine.find(threadId).isPresent()) {
            Optional<RefinementIntent> refinement = refinementIntentParser.parse(text);
            if (refinement.isPresent()) {
                return draftFeedback(event, threadId, refinement.get());
            }
        }

        if (quickAction.isPresent()) {
            return quickAction(event, threadId, text, quickAction.get());
        }

        return intent(event, threadId, text);
    }

    private ChatOutcome confirmed(InboundChatEvent event, String threadId, String text, ConfirmationResolution resolution) {
        boolean approveSend = resolution.action().type() == QuickActionType.APPROVE_SEND;
        if (approveSend) {
            Optional<String> refusal = sendRefusal(threadId);
            if (refusal.isPresent()) {
                return new ChatOutcome(threadId, event.channel(), ChatRoute.FAILED, quickActionIntent(text), refusal.get());
            }
        }
        QuickActionResult result = quickActionExecutor.execute(resolution.action(), resolution.context());
        if (approveSend && result.ok()) {
            DraftTransitionResult sent = draftEngine.markSent(threadId);
            if (!sent.ok()) {
                log.warn("Draft for thread {} was delivered but not marked sent: {}", threadId, sent.message());
            }
        }
        return new ChatOutcome(threadId, event.channel(), ChatRoute.CONFIRMATION_CONFIRMED,
                quickActionIntent(text), result.message());
    }

    private Optional<String> sendRefusal(String threadId) {
        return draftEngine.find(threadId)
                .filter(state -> !draftEngine.canSend(state))
                .map(state -> "This draft is " + state.status().label() + " and can't be sent.");
    }

    private ChatOutcome quickAction(InboundChatEvent event, String threadId, String text, QuickAction action) {
        if (action.type() == QuickActionType.APPROVE_SEND) {
            Optional<String> refusal = sendRefusal(threadId);
            if (refusal.isPresent()) {
                return new ChatOutcome(threadId, event.channel(), ChatRoute.FAILED, quickActionIntent(text), refusal.get());
            }
        }
        Optional<DraftThreadState> draft = draftEngine.find(threadId);
        String conversationId = draft.map(DraftThreadState::conversationId).orElse(null);
        if (conversationId == null) {
            ThreadContextLookup lookup = threadContextStore.read(threadId);
            if (lookup.status() == ThreadContextLookup.Status.STALE) {
                return new ChatOutcome(threadId, event.channel(), ChatRoute.FAILED, quickActionIntent(text), lookup.message());
            }
            if (lookup.isActive()) {
                conversationId = lookup.context().conversationId();
            }
        }
        QuickActionContext context = new QuickActionContext(
                conversationId,
                draft.map(state -> state.latest().text()).orElse(null),
                draft.map(DraftThreadState::recipientEmail).orElse(null),
                threadId,
                event.channel(),
                event.user());

        if (confirmationGate.requiresConfirmation(action)) {
            ActionConfirmationGate.ConfirmationRequest request = confirmationGate.request(threadId, action, context);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("threadId", threadId);
            payload.put("userId", event.user());
            payload.put("actionType", action.type().label());
            eventLogger.info("assistant.quick_action_confirmation", payload);
            return new ChatOutcome(threadId, event.channel(), ChatRoute.CONFIRMATION_REQUESTED,
                    quickActionIntent(text), request.message());
        }

        QuickActionResult result = quickActionExecutor.execute(action, context);
        return new ChatOutcome(threadId, event.channel(), ChatRoute.QUICK_ACTION, quickActionIntent(text), result.message());
    }

    private ChatOutcome draftFeedback(InboundChatEvent event, String threadId, RefinementIntent intent) {
        if (intent instanceof RefinementIntent.Approve) {
            DraftTransitionResult result = draftEngine.approve(threadId, event.user());
            return new ChatOutcome(threadId, event.channel(),
                    result.ok() ? ChatRoute.DRAFT_APPROVED : ChatRoute.FAILED, null, result.message());
        }
        if (intent instanceof RefinementIntent.Reject reject) {
            DraftTransitionResult result = draftEngine.reject(threadId, reject.reason(), event.user());
            return new ChatOutcome(threadId, event.channel(),
                    result.ok() ? ChatRoute.DRAFT_REJECTED : ChatRoute.FAILED, null, result.message());
        }
        DraftRefinementResult result = draftEngine.refine(threadId, intent, event.user());
        if (!result.ok()) {
            return new ChatOutcome(threadId, event.channel(), ChatRoute.FAILED, null, result.message());
        }
        syncThreadContext(event.channel(), result.state());
        return new ChatOutcome(threadId, event.channel(), ChatRoute.DRAFT_REFINED, null, result.message());
    }

    private void syncThreadContext(String channel, DraftThreadState state) {
        int version = state.versions().size() - 1;
        String text = state.latest().text();
        ThreadContextLookup lookup = threadContextStore.read(state.threadId());
        ThreadContext context;
        if (lookup.isActive()) {
            context = lookup.context().withDraft(text, version);
        } else if (lookup.status() == ThreadContextLookup.Status.ERROR) {
            return;
        } else {
            context = threadContextStore.create(state.threadId(), channel, state.conversationId(), text, version, null);
        }
        threadContextStore.write(context);
    }

    private ChatOutcome intent(InboundChatEvent event, String threadId, String text) {
        ParsedIntent intent = intentParser.parse(text);

        Map<String, Object> detected = new LinkedHashMap<>();
        detected.put("threadId", threadId);
        detected.put("userId", event.user());
        detected.put("detectedIntent", intent.category().label());
        detected.put("confidence", intent.confidence());
        eventLogger.info("assistant.intent_detected", detected);

        if (intent.category() == IntentCategory.UNKNOWN) {
            return new ChatOutcome(threadId, event.channel(), ChatRoute.INTENT, intent, intentParser.helpText());
        }

        IntentExecutionResult result = intentExecutor.execute(intent, threadId);
        Map<String, Object> executed = new LinkedHashMap<>();
        executed.put("threadId", threadId);
        executed.put("userId", event.user());
        executed.put("detectedIntent", intent.category().label());
        executed.put("executionSuccess", result.ok());
        eventLogger.info("assistant.intent_executed", executed);

        String response = result.ok() ? result.message() : "⚠️ " + result.message();
        return new ChatOutcome(threadId, event.channel(), ChatRoute.INTENT, intent, response);
    }

    private void reply(String channel, String threadId, String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        try {
            platformClient.postMessage(channel, text, threadId);
        } catch (ChatPlatformException ex) {
            log.warn("Reply to thread {} in {} failed: {}", threadId, channel, ex.getMessage());
        }
    }

    private static ParsedIntent quickActionIntent(String text) {
        return ParsedIntent.of(IntentCategory.QUICK_ACTION, QUICK_ACTION_CONFIDENCE, text);
    }

    private static DraftView toView(DraftThreadState state) {
        return new DraftView(
                state.threadId(),
                state.status().label(),
                state.conversationId(),
                state.recipientEmail(),
                state.versions().stream()
                        .map(version -> new DraftView.Version(version.id(), version.text(), version.createdAt(),
                                version.intent() == null ? null : version.intent().type().label()))
                        .toList());
    }
}
