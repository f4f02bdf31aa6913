package com.supportdesk.assistant.service.status;

import com.supportdesk.assistant.service.audit.AssistantEventLogger;
import com.supportdesk.assistant.service.crm.ConversationFormatter;
import com.supportdesk.assistant.service.crm.CrmClient;
import com.supportdesk.assistant.service.crm.CrmConversation;
import com.supportdesk.assistant.service.crm.CrmException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Dashboard-style answers over open conversations. Results are cached for {@link #CACHE_TTL} per query type
 * and filter set, so bursts of the same question reach the CRM once.
 */
@Component
public class StatusQueryService {

    private static final Logger log = LoggerFactory.getLogger(StatusQueryService.class);

    public static final Duration CACHE_TTL = Duration.ofSeconds(30);
    static final String METRIC_NAME = "assistant.status.queries";

    static final Set<String> URGENT_TAGS = Set.of("urgent", "high-priority", "priority-high", "priority:high", "high priority");
    static final List<String> CATEGORY_TAG_PREFIXES = List.of("category:", "issue:", "support:");
    static final List<String> PRODUCT_TAG_PREFIXES = List.of("product:", "app:");

    private static final String FAILURE_TEXT = "I couldn't load conversations from Front. Please try again.";

    private final CrmClient crmClient;
    private final StatusCache cache;
    private final ConversationFormatter formatter;
    private final AssistantEventLogger eventLogger;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public StatusQueryService(CrmClient crmClient,
                              StatusCache cache,
                              ConversationFormatter formatter,
                              AssistantEventLogger eventLogger,
                              MeterRegistry meterRegistry,
                              Clock clock) {
        this.crmClient = crmClient;
        this.cache = cache;
        this.formatter = formatter;
        this.eventLogger = eventLogger;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public StatusReport answer(StatusQuery query) {
        return switch (query.type()) {
            case URGENT -> urgent(query);
            case PENDING -> pending(query);
            case HEALTH -> health(query);
        };
    }

    public StatusReport urgent(StatusQuery query) {
        return cached(query, now -> {
            List<CrmConversation> urgent = fetchOpen(query.filters()).stream()
                    .filter(conversation -> conversation.hasStatus("unassigned"))
                    .filter(StatusQueryService::isUrgent)
                    .toList();
            return StatusReport.of(StatusQueryType.URGENT, formatUrgent(urgent, query.filters(), now), urgent.size());
        });
    }

    public StatusReport pending(StatusQuery query) {
        return cached(query, now -> {
            List<CrmConversation> open = fetchOpen(query.filters());
            return StatusReport.of(StatusQueryType.PENDING, formatPending(open, query.filters()), open.size());
        });
    }

    public StatusReport health(StatusQuery query) {
        return cached(query, now -> {
            List<CrmConversation> open = fetchOpen(query.filters());
            LocalDate today = LocalDate.ofInstant(now, clock.getZone());
            List<CrmConversation> handledToday = crmClient.search("status:archived updated:>=" + today);
            double averageWaitHours = averageWaitHours(open, now);
            String text = "📊 *Support health*\n"
                    + "• Pending: " + open.size() + "\n"
                    + "• Handled today: " + handledToday.size() + "\n"
                    + "• Avg wait: " + averageWaitHours + "h";
            return StatusReport.of(StatusQueryType.HEALTH, text, open.size());
        });
    }

    private StatusReport cached(StatusQuery query, Function<Instant, StatusReport> compute) {
        Instant now = clock.instant();
        String key = query.cacheKey();
        Optional<StatusCacheEntry<StatusReport>> entry = cache.get(key).filter(candidate -> candidate.isLive(now));
        if (entry.isPresent()) {
            StatusReport report = entry.get().value().fromCache();
            record(query, report);
            return report;
        }

        StatusReport report;
        try {
            report = compute.apply(now);
        } catch (CrmException ex) {
            log.error("Status query {} failed", key, ex);
            report = StatusReport.failure(query.type(), FAILURE_TEXT);
            record(query, report);
            return report;
        }
        cache.put(key, new StatusCacheEntry<>(now.plus(CACHE_TTL), report));
        record(query, report);
        return report;
    }

    private List<CrmConversation> fetchOpen(StatusFilters filters) {
        return crmClient.search(filters.applyTo("status:open"));
    }

    private void record(StatusQuery query, StatusReport report) {
        meterRegistry.counter(METRIC_NAME,
                        "type", query.type().label(),
                        "cache", report.cacheHit() ? "hit" : "miss")
                .increment();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("queryType", query.type().label());
        payload.put("filters", query.filters().canonical());
        payload.put("count", report.cacheHit() ? null : report.count());
        payload.put("success", report.ok());
        payload.put("cacheHit", report.cacheHit());
        eventLogger.info("assistant.status_query", payload);
    }

    private String formatUrgent(List<CrmConversation> urgent, StatusFilters filters, Instant now) {
        if (urgent.isEmpty()) {
            return "✅ No urgent unassigned conversations right now.";
        }
        List<String> lines = new ArrayList<>();
        lines.add("🚨 *" + urgent.size() + " urgent* conversation" + (urgent.size() == 1 ? "" : "s") + " need attention:");
        for (CrmConversation conversation : urgent) {
            String subject = conversation.subject() == null || conversation.subject().isBlank()
                    ? "No subject"
                    : conversation.subject();
            StringBuilder line = new StringBuilder("• <")
                    .append(formatter.link(conversation.id()))
                    .append('|')
                    .append(ConversationFormatter.truncate(subject, 50))
                    .append("> ")
                    .append(ageLabel(conversation, now));
            productCode(conversation, filters).ifPresent(code -> line.append(" [").append(code).append(']'));
            lines.add(line.toString());
        }
        return String.join("\n", lines);
    }

    private String formatPending(List<CrmConversation> open, StatusFilters filters) {
        if (open.isEmpty()) {
            return "✅ No open conversations.";
        }
        Map<String, Long> counts = open.stream()
                .collect(Collectors.groupingBy(conversation -> pendingLabel(conversation, filters), Collectors.counting()));
        List<String> lines = new ArrayList<>();
        lines.add("📬 *" + open.size() + " open* conversation" + (open.size() == 1 ? "" : "s") + ":");
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<String, Long>comparingByKey()))
                .forEach(entry -> lines.add("• " + entry.getKey() + ": " + entry.getValue()));
        return String.join("\n", lines);
    }

    static boolean isUrgent(CrmConversation conversation) {
        return conversation.tagNames().stream().anyMatch(URGENT_TAGS::contains);
    }

    static String pendingLabel(CrmConversation conversation, StatusFilters filters) {
        String category = prefixedTag(conversation, CATEGORY_TAG_PREFIXES).orElse("Uncategorized");
        Optional<String> product = productName(conversation, filters);
        return product.map(name -> name + " · " + category).orElse(category);
    }

    static double averageWaitHours(List<CrmConversation> conversations, Instant now) {
        if (conversations.isEmpty()) {
            return 0.0;
        }
        long nowSeconds = now.getEpochSecond();
        double totalSeconds = conversations.stream()
                .mapToLong(conversation -> Math.max(0, nowSeconds - conversation.waitingSinceSeconds()))
                .sum();
        double hours = totalSeconds / conversations.size() / 3600.0;
        return Math.round(hours * 10) / 10.0;
    }

    static String ageLabel(CrmConversation conversation, Instant now) {
        long ageSeconds = Math.max(0, now.getEpochSecond() - conversation.waitingSinceSeconds());
        long ageMinutes = Math.max(1, Math.round(ageSeconds / 60.0));
        if (ageMinutes < 60) {
            return ageMinutes + "m ago";
        }
        return Math.round(ageMinutes / 60.0) + "h ago";
    }

    static Optional<String> productCode(CrmConversation conversation, StatusFilters filters) {
        return productName(conversation, filters).flatMap(name -> {
            String[] words = name.replaceAll("[^a-zA-Z0-9\\s]", " ").trim().split("\\s+");
            StringBuilder code = new StringBuilder();
            for (int i = 0; i < words.length && i < 3; i++) {
                if (!words[i].isEmpty()) {
                    code.append(Character.toUpperCase(words[i].charAt(0)));
                }
            }
            return code.length() == 0 ? Optional.empty() : Optional.of(code.toString());
        });
    }

    private static Optional<String> productName(CrmConversation conversation, StatusFilters filters) {
        Optional<String> tagged = prefixedTag(conversation, PRODUCT_TAG_PREFIXES);
        if (tagged.isPresent()) {
            return tagged;
        }
        return Optional.ofNullable(filters.product()).filter(product -> !product.isBlank());
    }

    /**
     * Value after the first colon of the first tag carrying one of the prefixes, in original case.
     */
    private static Optional<String> prefixedTag(CrmConversation conversation, List<String> prefixes) {
        return conversation.tags().stream()
                .map(CrmConversation.Tag::name)
                .filter(name -> name != null
                        && prefixes.stream().anyMatch(prefix -> name.toLowerCase(Locale.ROOT).startsWith(prefix)))
                .findFirst()
                .map(name -> {
                    String value = name.substring(name.indexOf(':') + 1).trim();
                    return value.isEmpty() ? name : value;
                });
    }
}
