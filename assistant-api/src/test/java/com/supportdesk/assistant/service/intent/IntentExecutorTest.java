package com.supportdesk.assistant.service.intent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supportdesk.assistant.config.AssistantProperties;
import com.supportdesk.assistant.model.IntentCategory;
import com.supportdesk.assistant.model.ParsedIntent;
import com.supportdesk.assistant.service.context.InMemoryKeyValueCache;
import com.supportdesk.assistant.service.context.ThreadContextStore;
import com.supportdesk.assistant.service.crm.ConversationFormatter;
import com.supportdesk.assistant.service.crm.CrmClient;
import com.supportdesk.assistant.service.crm.CrmConversation;
import com.supportdesk.assistant.service.crm.CrmException;
import com.supportdesk.assistant.service.status.InMemoryStatusCache;
import com.supportdesk.assistant.service.status.StatusQueryParser;
import com.supportdesk.assistant.service.status.StatusQueryService;
import com.supportdesk.assistant.support.MutableClock;
import com.supportdesk.assistant.support.RecordingEventLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class IntentExecutorTest {

    private static final String THREAD = "1700000000.000100";

    private final CrmClient crmClient = mock(CrmClient.class);
    private final MutableClock clock = MutableClock.at("2024-05-01T12:00:00Z");
    private final RecordingEventLogger eventLogger = new RecordingEventLogger();

    private ThreadContextStore threadContextStore;
    private IntentExecutor executor;

    @BeforeEach
    void setUp() {
        AssistantProperties properties = new AssistantProperties();
        ConversationFormatter formatter = new ConversationFormatter(properties);
        threadContextStore = new ThreadContextStore(new InMemoryKeyValueCache(clock),
                new ObjectMapper().findAndRegisterModules(), eventLogger, clock, properties);
        StatusQueryService statusQueryService = new StatusQueryService(crmClient, new InMemoryStatusCache(),
                formatter, eventLogger, new SimpleMeterRegistry(), clock);
        executor = new IntentExecutor(new StatusQueryParser(clock), statusQueryService, crmClient, formatter,
                threadContextStore, eventLogger);
    }

    @Test
    void statusQueryIsAnsweredFromTheCrm() {
        when(crmClient.search("status:open")).thenReturn(List.of());

        IntentExecutionResult result = executor.execute(intent(IntentCategory.STATUS_QUERY, Map.of(), "what's pending"), THREAD);

        assertThat(result.ok()).isTrue();
        assertThat(result.message()).isEqualTo("✅ No open conversations.");
    }

    @Test
    void emailLookupSearchesByContactAndLinksTheCustomer() {
        threadContextStore.write(threadContextStore.create(THREAD, "C1", "cnv_1", null, 0, null));
        when(crmClient.search("contact:jane@example.com")).thenReturn(List.of(
                new CrmConversation("cnv_7", "Refund", "archived", List.of(), null, null)));

        IntentExecutionResult result = executor.execute(
                intent(IntentCategory.CONTEXT_LOOKUP, Map.of("email", "jane@example.com"), "lookup jane@example.com"), THREAD);

        assertThat(result.ok()).isTrue();
        assertThat(result.message()).startsWith("📋 *1 conversation* found for \"jane@example.com\":");
        assertThat(threadContextStore.read(THREAD).context().customerId()).isEqualTo("jane@example.com");
        assertThat(eventLogger.named("assistant.context_lookup"))
                .singleElement()
                .satisfies(event -> assertThat(event.payload()).containsEntry("contextUpdated", true));
    }

    @Test
    void lookupWithoutEmailOrNameAsksForOne() {
        IntentExecutionResult result = executor.execute(intent(IntentCategory.CONTEXT_LOOKUP, Map.of(), "history"), THREAD);

        assertThat(result.ok()).isFalse();
        assertThat(result.message()).contains("Please specify a customer email");
        verifyNoInteractions(crmClient);
    }

    @Test
    void crmFailureIsReportedAsSearchFailure() {
        when(crmClient.search(anyString())).thenThrow(new CrmException("503"));

        IntentExecutionResult result = executor.execute(
                intent(IntentCategory.CONTEXT_LOOKUP, Map.of("name", "Jane Doe"), "who is Jane Doe"), THREAD);

        assertThat(result.ok()).isFalse();
        assertThat(result.message()).isEqualTo(IntentExecutor.SEARCH_FAILED);
    }

    @Test
    void generalQueryPrefersTheExtractedQuery() {
        when(crmClient.search("refund policy")).thenReturn(List.of());

        IntentExecutionResult result = executor.execute(
                intent(IntentCategory.GENERAL_QUERY, Map.of("query", "refund policy"), "what do we say about refunds"), THREAD);

        assertThat(result.message()).isEqualTo("No conversations found for \"refund policy\".");
        verify(crmClient).search("refund policy");
    }

    @Test
    void escalationWithoutNameAsksForOne() {
        IntentExecutionResult result = executor.execute(intent(IntentCategory.ESCALATION, Map.of(), "escalate"), THREAD);

        assertThat(result.ok()).isFalse();
        assertThat(result.message()).startsWith("Who should I escalate this to?");
    }

    @Test
    void unknownReturnsHelp() {
        IntentExecutionResult result = executor.execute(intent(IntentCategory.UNKNOWN, Map.of(), "??"), THREAD);

        assertThat(result.ok()).isFalse();
        assertThat(result.message()).isEqualTo(IntentParser.HELP_TEXT);
    }

    private static ParsedIntent intent(IntentCategory category, Map<String, String> entities, String text) {
        return new ParsedIntent(category, 0.8, entities, text);
    }
}
