package com.supportdesk.assistant.service.status;

import com.supportdesk.assistant.config.AssistantProperties;
import com.supportdesk.assistant.service.crm.ConversationFormatter;
import com.supportdesk.assistant.service.crm.CrmClient;
import com.supportdesk.assistant.service.crm.CrmConversation;
import com.supportdesk.assistant.service.crm.CrmException;
import com.supportdesk.assistant.support.MutableClock;
import com.supportdesk.assistant.support.RecordingEventLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StatusQueryServiceTest {

    private final CrmClient crmClient = mock(CrmClient.class);
    private final MutableClock clock = MutableClock.at("2024-05-01T12:00:00Z");
    private final RecordingEventLogger eventLogger = new RecordingEventLogger();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private StatusQueryService service;

    @BeforeEach
    void setUp() {
        service = new StatusQueryService(crmClient, new InMemoryStatusCache(),
                new ConversationFormatter(new AssistantProperties()), eventLogger, meterRegistry, clock);
    }

    @Test
    void repeatedQueryWithinTtlIsServedFromCache() {
        when(crmClient.search("status:open")).thenReturn(List.of(open("cnv_1", "category:Billing")));

        StatusReport first = service.pending(StatusQuery.of(StatusQueryType.PENDING));
        clock.advance(Duration.ofSeconds(29));
        StatusReport second = service.pending(StatusQuery.of(StatusQueryType.PENDING));

        assertThat(first.cacheHit()).isFalse();
        assertThat(second.cacheHit()).isTrue();
        assertThat(second.text()).isEqualTo(first.text());
        verify(crmClient, times(1)).search(anyString());
        assertThat(meterRegistry.get(StatusQueryService.METRIC_NAME).tag("cache", "hit").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void identicalUrgentQueriesHitTheCrmOncePerWindow() {
        when(crmClient.search("status:open")).thenReturn(List.of());

        service.urgent(StatusQuery.of(StatusQueryType.URGENT));
        service.urgent(StatusQuery.of(StatusQueryType.URGENT));
        verify(crmClient, times(1)).search("status:open");

        clock.advance(Duration.ofSeconds(31));
        service.urgent(StatusQuery.of(StatusQueryType.URGENT));
        verify(crmClient, times(2)).search("status:open");
    }

    @Test
    void cacheExpiresAfterThirtySeconds() {
        when(crmClient.search("status:open")).thenReturn(List.of());

        service.pending(StatusQuery.of(StatusQueryType.PENDING));
        clock.advance(StatusQueryService.CACHE_TTL);
        StatusReport refreshed = service.pending(StatusQuery.of(StatusQueryType.PENDING));

        assertThat(refreshed.cacheHit()).isFalse();
        verify(crmClient, times(2)).search("status:open");
    }

    @Test
    void differentFiltersUseDifferentCacheEntries() {
        when(crmClient.search(anyString())).thenReturn(List.of());

        service.pending(StatusQuery.of(StatusQueryType.PENDING));
        service.pending(new StatusQuery(StatusQueryType.PENDING, new StatusFilters("mobile", "alice", LocalDate.of(2024, 4, 1))));

        verify(crmClient).search("status:open");
        verify(crmClient).search("status:open tag:mobile assignee:alice updated:>=2024-04-01");
    }

    @Test
    void pendingGroupsByProductAndCategory() {
        when(crmClient.search("status:open")).thenReturn(List.of(
                open("cnv_1", "category:Billing", "product:Mobile App"),
                open("cnv_2", "category:Billing", "product:Mobile App"),
                open("cnv_3")));

        StatusReport report = service.pending(StatusQuery.of(StatusQueryType.PENDING));

        assertThat(report.count()).isEqualTo(3);
        assertThat(report.text()).isEqualTo("📬 *3 open* conversations:\n"
                + "• Mobile App · Billing: 2\n"
                + "• Uncategorized: 1");
    }

    @Test
    void urgentListsOnlyUnassignedUrgentConversations() {
        Instant waiting = clock.instant().minus(Duration.ofMinutes(90));
        when(crmClient.search("status:open")).thenReturn(List.of(
                new CrmConversation("cnv_1", "Payment failed", "unassigned",
                        List.of(new CrmConversation.Tag("t1", "Urgent"), new CrmConversation.Tag("t2", "product:Web Portal")),
                        (double) waiting.getEpochSecond(), null),
                new CrmConversation("cnv_2", "Also urgent", "assigned",
                        List.of(new CrmConversation.Tag("t1", "urgent")), (double) waiting.getEpochSecond(), null),
                open("cnv_3")));

        StatusReport report = service.urgent(StatusQuery.of(StatusQueryType.URGENT));

        assertThat(report.count()).isEqualTo(1);
        assertThat(report.text())
                .startsWith("🚨 *1 urgent* conversation need attention:")
                .contains("<https://app.frontapp.com/open/cnv_1|Payment failed> 2h ago [WP]");
    }

    @Test
    void healthReportsPendingHandledAndAverageWait() {
        long twoHoursAgo = clock.instant().minus(Duration.ofHours(2)).getEpochSecond();
        long fourHoursAgo = clock.instant().minus(Duration.ofHours(4)).getEpochSecond();
        when(crmClient.search("status:open")).thenReturn(List.of(
                new CrmConversation("cnv_1", "a", "unassigned", List.of(), (double) twoHoursAgo, null),
                new CrmConversation("cnv_2", "b", "assigned", List.of(), null, (double) fourHoursAgo)));
        when(crmClient.search("status:archived updated:>=2024-05-01")).thenReturn(List.of(open("cnv_9")));

        StatusReport report = service.health(StatusQuery.of(StatusQueryType.HEALTH));

        assertThat(report.text()).isEqualTo("📊 *Support health*\n• Pending: 2\n• Handled today: 1\n• Avg wait: 3.0h");
    }

    @Test
    void crmFailureIsReportedAndNotCached() {
        when(crmClient.search("status:open"))
                .thenThrow(new CrmException("503"))
                .thenReturn(List.of());

        StatusReport failed = service.pending(StatusQuery.of(StatusQueryType.PENDING));
        StatusReport retried = service.pending(StatusQuery.of(StatusQueryType.PENDING));

        assertThat(failed.ok()).isFalse();
        assertThat(failed.text()).isEqualTo("I couldn't load conversations from Front. Please try again.");
        assertThat(retried.ok()).isTrue();
        assertThat(retried.cacheHit()).isFalse();
        assertThat(eventLogger.named("assistant.status_query")).hasSize(2);
    }

    @Test
    void emptyResultsHaveFriendlyText() {
        when(crmClient.search("status:open")).thenReturn(List.of());

        assertThat(service.answer(StatusQuery.of(StatusQueryType.URGENT)).text())
                .isEqualTo("✅ No urgent unassigned conversations right now.");
        assertThat(service.answer(StatusQuery.of(StatusQueryType.PENDING)).text())
                .isEqualTo("✅ No open conversations.");
    }

    private CrmConversation open(String id, String... tags) {
        List<CrmConversation.Tag> tagList = java.util.Arrays.stream(tags)
                .map(name -> new CrmConversation.Tag("tag_" + name, name))
                .toList();
        return new CrmConversation(id, "Subject " + id, "unassigned", tagList,
                (double) clock.instant().minus(Duration.ofHours(1)).getEpochSecond(), null);
    }
}
