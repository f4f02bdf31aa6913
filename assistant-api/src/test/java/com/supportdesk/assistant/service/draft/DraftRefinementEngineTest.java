package com.supportdesk.assistant.service.draft;

import com.supportdesk.assistant.service.draft.statemachine.DraftStatusMachine;
import com.supportdesk.assistant.service.llm.LlmClient;
import com.supportdesk.assistant.service.llm.LlmException;
import com.supportdesk.assistant.service.llm.LlmRequest;
import com.supportdesk.assistant.service.llm.LlmResponse;
import com.supportdesk.assistant.support.MutableClock;
import com.supportdesk.assistant.support.RecordingEventLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DraftRefinementEngineTest {

    private static final String THREAD = "1700000000.000100";
    private static final String ORIGINAL = "Hi Jane, we have received your request and will look into it shortly.";

    private final InMemoryDraftStore store = new InMemoryDraftStore();
    private final LlmClient llmClient = mock(LlmClient.class);
    private final RecordingEventLogger eventLogger = new RecordingEventLogger();
    private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");

    private DraftRefinementEngine engine;

    @BeforeEach
    void setUp() {
        engine = new DraftRefinementEngine(store, new DraftStatusMachine(), llmClient, eventLogger, clock);
        engine.register(THREAD, ORIGINAL, "cnv_1", "jane@example.com");
    }

    @Test
    void registerSeedsVersionZero() {
        DraftThreadState state = engine.find(THREAD).orElseThrow();

        assertThat(state.status()).isEqualTo(DraftStatus.DRAFT);
        assertThat(state.versions()).singleElement()
                .satisfies(version -> {
                    assertThat(version.id()).isEqualTo("v0");
                    assertThat(version.text()).isEqualTo(ORIGINAL);
                    assertThat(version.intent()).isNull();
                });
    }

    @Test
    void eachRefinementAppendsTheNextVersion() {
        when(llmClient.generate(any()))
                .thenReturn(new LlmResponse("Hi Jane, we got your request.", "m"))
                .thenReturn(new LlmResponse("Dear Jane, we have received your request.", "m"));

        DraftRefinementResult first = engine.refine(THREAD, new RefinementIntent.Shorten(), "U1");
        clock.advance(Duration.ofMinutes(1));
        DraftRefinementResult second = engine.refine(THREAD, new RefinementIntent.Formalize(), "U1");

        assertThat(first.ok()).isTrue();
        assertThat(first.revision().id()).isEqualTo("v1");
        assertThat(first.charDelta()).isEqualTo("Hi Jane, we got your request.".length() - ORIGINAL.length());
        assertThat(first.message()).startsWith("Updated draft v1 (-").contains("Hi Jane, we got your request.");
        assertThat(second.revision().id()).isEqualTo("v2");

        DraftThreadState state = engine.find(THREAD).orElseThrow();
        assertThat(state.versions()).extracting(DraftVersion::id).containsExactly("v0", "v1", "v2");
        assertThat(state.versions().get(0).text()).isEqualTo(ORIGINAL);
        assertThat(state.versions().get(2).intent()).isEqualTo(new RefinementIntent.Formalize());
        assertThat(eventLogger.named("assistant.draft_refined")).hasSize(2);
    }

    @Test
    void promptCarriesTheCurrentTextAndInstruction() {
        when(llmClient.generate(any())).thenReturn(new LlmResponse("Revised", "m"));

        engine.refine(THREAD, new RefinementIntent.AddContent("our office is closed Friday"), "U1");

        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmClient).generate(request.capture());
        assertThat(request.getValue().jsonOutput()).isFalse();
        assertThat(request.getValue().userPrompt())
                .contains(ORIGINAL)
                .contains("Add the following content: our office is closed Friday");
    }

    @Test
    void emptyLlmOutputReusesThePreviousText() {
        when(llmClient.generate(any())).thenReturn(new LlmResponse("   ", "m"));

        DraftRefinementResult result = engine.refine(THREAD, new RefinementIntent.Simplify(), "U1");

        assertThat(result.ok()).isTrue();
        assertThat(result.revision().text()).isEqualTo(ORIGINAL);
        assertThat(result.indicator()).isEqualTo("no length change");
    }

    @Test
    void llmFailureLeavesTheDraftUnchanged() {
        when(llmClient.generate(any())).thenThrow(new LlmException("timeout"));

        DraftRefinementResult result = engine.refine(THREAD, new RefinementIntent.Simplify(), "U1");

        assertThat(result.ok()).isFalse();
        assertThat(result.message()).isEqualTo("I couldn't refine the draft. Please try again.");
        assertThat(engine.find(THREAD).orElseThrow().versions()).hasSize(1);
    }

    @Test
    void approvedDraftCannotBeRefined() {
        DraftTransitionResult approved = engine.approve(THREAD, "U1");

        DraftRefinementResult result = engine.refine(THREAD, new RefinementIntent.Simplify(), "U1");

        assertThat(approved.message()).isEqualTo("Approved. I will send this once it clears the approval flow.");
        assertThat(approved.state().approvedAt()).isEqualTo(clock.instant());
        assertThat(result.ok()).isFalse();
        assertThat(result.message()).isEqualTo("This draft is already approved and can't be changed.");
        verify(llmClient, never()).generate(any());
    }

    @Test
    void rejectionRecordsTheReason() {
        DraftTransitionResult result = engine.reject(THREAD, "too pushy", "U1");

        assertThat(result.ok()).isTrue();
        assertThat(result.message()).isEqualTo("Understood, I won't send this. Reason noted: too pushy");
        assertThat(result.state().status()).isEqualTo(DraftStatus.REJECTED);
        assertThat(result.state().rejectionReason()).isEqualTo("too pushy");
        assertThat(engine.approve(THREAD, "U1").ok()).isFalse();
    }

    @Test
    void approvedDraftCanBeMarkedSent() {
        engine.approve(THREAD, "U1");

        DraftTransitionResult sent = engine.markSent(THREAD);

        assertThat(sent.ok()).isTrue();
        assertThat(sent.state().status()).isEqualTo(DraftStatus.SENT);
        assertThat(eventLogger.named("assistant.draft_sent")).hasSize(1);
    }

    @Test
    void missingDraftIsReported() {
        assertThat(engine.refine("other", new RefinementIntent.Simplify(), "U1").ok()).isFalse();
        assertThat(engine.approve("other", "U1").ok()).isFalse();
    }

    @Test
    void approveIsNotARefinement() {
        DraftRefinementResult result = engine.refine(THREAD, new RefinementIntent.Approve(), "U1");

        assertThat(result.ok()).isFalse();
        assertThat(result.message()).isEqualTo("That feedback changes the draft status, not its text.");
        assertThat(engine.find(THREAD).orElseThrow().versions()).hasSize(1);
        verify(llmClient, never()).generate(any());
    }

    @Test
    void onlyOpenOrApprovedDraftsCanBeSent() {
        assertThat(engine.canSend(engine.find(THREAD).orElseThrow())).isTrue();

        engine.approve(THREAD, "U1");
        assertThat(engine.canSend(engine.find(THREAD).orElseThrow())).isTrue();

        engine.register("other", ORIGINAL, "cnv_2", "jane@example.com");
        engine.reject("other", "wrong customer", "U1");
        assertThat(engine.canSend(engine.find("other").orElseThrow())).isFalse();
    }

    @Test
    void versionIdsMustBeContiguous() {
        DraftVersion skipped = new DraftVersion("v2", "text", clock.instant(), null);

        assertThatThrownBy(() -> engine.find(THREAD).orElseThrow().withVersion(skipped))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
