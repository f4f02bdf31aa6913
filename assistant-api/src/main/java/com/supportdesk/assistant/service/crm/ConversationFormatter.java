package com.supportdesk.assistant.service.crm;

import com.supportdesk.assistant.config.AssistantProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders conversations as chat lines with a status emoji, an operator link and a truncated subject.
 */
@Component
public class ConversationFormatter {

    static final int MAX_LINES = 10;
    static final int SUBJECT_LIMIT = 40;

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    private final String linkBaseUrl;

    public ConversationFormatter(AssistantProperties properties) {
        this.linkBaseUrl = properties.getCrm().getLinkBaseUrl();
    }

    public String link(String conversationId) {
        return linkBaseUrl + conversationId;
    }

    public String line(CrmConversation conversation) {
        String subject = conversation.subject() == null || conversation.subject().isBlank()
                ? "No subject"
                : conversation.subject();
        String status = conversation.status() == null ? "unknown" : conversation.status();
        String date = conversation.createdAt() == null
                ? ""
                : DATE.format(Instant.ofEpochSecond(conversation.createdAtSeconds()));
        return (statusEmoji(status) + " <" + link(conversation.id()) + "|" + truncate(subject, SUBJECT_LIMIT) + "> ("
                + status + ") " + date).trim();
    }

    /**
     * Header line plus at most ten conversation lines, with a trailing count of the rest.
     */
    public String list(List<CrmConversation> conversations, String searchLabel) {
        List<String> lines = new ArrayList<>();
        int total = conversations.size();
        lines.add("📋 *" + total + " conversation" + (total == 1 ? "" : "s") + "* found for \"" + searchLabel + "\":");
        conversations.stream().limit(MAX_LINES).map(this::line).forEach(lines::add);
        if (total > MAX_LINES) {
            lines.add("...and " + (total - MAX_LINES) + " more");
        }
        return String.join("\n", lines);
    }

    public static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }

    static String statusEmoji(String status) {
        return switch (status) {
            case "open", "unassigned" -> "📬";
            case "assigned" -> "👤";
            case "archived" -> "📦";
            case "snoozed" -> "😴";
            case "deleted" -> "🗑️";
            default -> "📧";
        };
    }
}
