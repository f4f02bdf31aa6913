package com.supportdesk.assistant.service.confirmation;

import com.supportdesk.assistant.config.AssistantProperties;
import com.supportdesk.assistant.service.action.QuickAction;
import com.supportdesk.assistant.service.action.QuickActionContext;
import com.supportdesk.assistant.support.MutableClock;
import com.supportdesk.assistant.support.RecordingEventLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ActionConfirmationGateTest {

    private static final String THREAD = "1700000000.000100";

    private final InMemoryActionConfirmationStore store = new InMemoryActionConfirmationStore();
    private final RecordingEventLogger eventLogger = new RecordingEventLogger();
    private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");

    private ActionConfirmationGate gate;

    @BeforeEach
    void setUp() {
        AssistantProperties properties = new AssistantProperties();
        properties.getConfirmation().setTtl(Duration.ofMinutes(10));
        gate = new ActionConfirmationGate(store, eventLogger, clock, properties);
    }

    @Test
    void onlyDestructiveActionsNeedConfirmation() {
        assertThat(gate.requiresConfirmation(QuickAction.approveSend())).isTrue();
        assertThat(gate.requiresConfirmation(QuickAction.archive())).isTrue();
        assertThat(gate.requiresConfirmation(QuickAction.close())).isTrue();
        assertThat(gate.requiresConfirmation(QuickAction.escalate("alice"))).isFalse();
        assertThat(gate.requiresConfirmation(QuickAction.addContext("note"))).isFalse();
    }

    @Test
    void approveSendPromptPreviewsTheDraft() {
        ActionConfirmationGate.ConfirmationRequest request =
                gate.request(THREAD, QuickAction.approveSend(), context("Hello   there,\nthanks for waiting."));

        assertThat(request.message())
                .startsWith("Ready to send this response to jane@example.com:")
                .contains("> Hello there, thanks for waiting.")
                .endsWith("Reply yes to confirm or cancel to abort.");
        assertThat(gate.pending(THREAD)).isPresent();
    }

    @Test
    void previewIsTruncatedAtTwoHundredCharacters() {
        String preview = ActionConfirmationGate.preview("x".repeat(250));

        assertThat(preview).hasSize(203).endsWith("...");
    }

    @ParameterizedTest
    @ValueSource(strings = {"yes", "Y", "  Confirm ", "approved"})
    void affirmativeReplyReturnsTheStoredActionAndClearsIt(String reply) {
        QuickActionContext context = context("draft");
        gate.request(THREAD, QuickAction.archive(), context);

        ConfirmationResolution resolution = gate.resolve(THREAD, reply);

        assertThat(resolution.decision()).isEqualTo(ConfirmationResolution.Decision.CONFIRM);
        assertThat(resolution.action()).isEqualTo(QuickAction.archive());
        assertThat(resolution.context()).isEqualTo(context);
        assertThat(gate.pending(THREAD)).isEmpty();
        assertThat(eventLogger.named("assistant.confirmation_resolved")).hasSize(1);
    }

    @ParameterizedTest
    @ValueSource(strings = {"no", "cancel", "STOP", "nevermind"})
    void negativeReplyCancelsAndClears(String reply) {
        gate.request(THREAD, QuickAction.close(), context("draft"));

        ConfirmationResolution resolution = gate.resolve(THREAD, reply);

        assertThat(resolution.decision()).isEqualTo(ConfirmationResolution.Decision.CANCEL);
        assertThat(gate.pending(THREAD)).isEmpty();
    }

    @Test
    void otherRepliesLeaveThePendingActionUntouched() {
        gate.request(THREAD, QuickAction.approveSend(), context("draft"));

        ConfirmationResolution resolution = gate.resolve(THREAD, "yes please");

        assertThat(resolution.decision()).isEqualTo(ConfirmationResolution.Decision.IGNORE);
        assertThat(gate.pending(THREAD)).isPresent();
        assertThat(eventLogger.events()).isEmpty();
    }

    @Test
    void noPendingActionIsIgnored() {
        assertThat(gate.resolve(THREAD, "yes").decision()).isEqualTo(ConfirmationResolution.Decision.IGNORE);
    }

    @Test
    void expiredConfirmationIsDiscarded() {
        gate.request(THREAD, QuickAction.archive(), context("draft"));
        clock.advance(Duration.ofMinutes(10).plusSeconds(1));

        ConfirmationResolution resolution = gate.resolve(THREAD, "yes");

        assertThat(resolution.decision()).isEqualTo(ConfirmationResolution.Decision.IGNORE);
        assertThat(store.find(THREAD)).isEmpty();
    }

    @Test
    void newRequestReplacesThePreviousOne() {
        gate.request(THREAD, QuickAction.archive(), context("draft"));
        gate.request(THREAD, QuickAction.approveSend(), context("draft"));

        assertThat(gate.resolve(THREAD, "yes").action()).isEqualTo(QuickAction.approveSend());
    }

    private static QuickActionContext context(String draft) {
        return new QuickActionContext("cnv_1", draft, "jane@example.com", THREAD, "C1", "U1");
    }
}
