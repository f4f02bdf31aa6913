package com.supportdesk.assistant.service.status;

import com.supportdesk.assistant.model.ParsedIntent;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the status query kind and filters from a status question. Urgency wins over health; anything else is
 * a pending summary.
 */
@Component
public class StatusQueryParser {

    private static final Pattern URGENT = Pattern.compile("(?i)\\b(urgent|high[- ]priority|priority)\\b");
    private static final Pattern HEALTH = Pattern.compile("(?i)\\b(health|stats|metrics)\\b");
    private static final Pattern PRODUCT = Pattern.compile("(?i)\\b(?:product|app)[:\\s]+([\\w-]+)");
    private static final Pattern ASSIGNEE = Pattern.compile("(?i)\\bassigned\\s+to\\s+@?([\\w.-]+)");
    private static final Pattern SINCE_DATE = Pattern.compile("(?i)\\bsince\\s+(\\d{4}-\\d{2}-\\d{2})\\b");
    private static final Pattern TODAY = Pattern.compile("(?i)\\btoday\\b");

    private final Clock clock;

    public StatusQueryParser(Clock clock) {
        this.clock = clock;
    }

    public StatusQuery parse(ParsedIntent intent) {
        String text = intent.rawText() == null ? "" : intent.rawText();
        StatusQueryType type;
        if (URGENT.matcher(text).find()) {
            type = StatusQueryType.URGENT;
        } else if (HEALTH.matcher(text).find()) {
            type = StatusQueryType.HEALTH;
        } else {
            type = StatusQueryType.PENDING;
        }

        String product = intent.entity("product");
        if (product == null) {
            product = group(PRODUCT, text);
        }
        String assignee = group(ASSIGNEE, text);
        return new StatusQuery(type, new StatusFilters(product, assignee, since(text)));
    }

    private LocalDate since(String text) {
        String explicit = group(SINCE_DATE, text);
        if (explicit != null) {
            try {
                return LocalDate.parse(explicit);
            } catch (DateTimeParseException ex) {
                return null;
            }
        }
        return TODAY.matcher(text).find() ? LocalDate.now(clock) : null;
    }

    private static String group(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }
}
