package com.supportdesk.assistant.service.action;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises quick actions in chat text. Rules run in order and the first match wins, so a message yields at
 * most one action.
 */
@Component
public class QuickActionParser {

    static final String NEEDS_MORE_CONTEXT_NOTE = "Needs more context.";

    private static final Pattern APPROVE_SEND = Pattern.compile("(?i)\\bapprove\\s+and\\s+send\\b");
    private static final Pattern ESCALATE = Pattern.compile("(?i)\\bescalate\\b");
    private static final Pattern ESCALATE_TO = Pattern.compile("(?i)\\bescalate\\s+to\\s+([^?!.]+)$");
    private static final Pattern ADD_CONTEXT = Pattern.compile("(?i)\\badd\\s+context[:\\-]?\\s+(.+)");
    private static final Pattern NEEDS_CONTEXT = Pattern.compile("(?i)needs? more context");
    private static final Pattern ARCHIVE = Pattern.compile("(?i)\\barchive\\b");
    private static final Pattern CLOSE = Pattern.compile("(?i)\\bclose\\b");

    public Optional<QuickAction> parse(String rawText) {
        String text = rawText == null ? "" : rawText.trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        if (APPROVE_SEND.matcher(text).find()) {
            return Optional.of(QuickAction.approveSend());
        }
        if (ESCALATE.matcher(text).find()) {
            // an escalation without a target is left to intent routing, which asks for one
            return escalationAssignee(text).map(QuickAction::escalate);
        }
        Optional<String> note = contextNote(text);
        if (note.isPresent()) {
            return note.map(QuickAction::addContext);
        }
        if (ARCHIVE.matcher(text).find()) {
            return Optional.of(QuickAction.archive());
        }
        if (CLOSE.matcher(text).find()) {
            return Optional.of(QuickAction.close());
        }
        return Optional.empty();
    }

    private Optional<String> escalationAssignee(String text) {
        Matcher matcher = ESCALATE_TO.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String assignee = matcher.group(1).trim().replaceAll("[\\s,]+$", "");
        return assignee.isEmpty() ? Optional.empty() : Optional.of(assignee);
    }

    private Optional<String> contextNote(String text) {
        Matcher explicit = ADD_CONTEXT.matcher(text);
        if (explicit.find()) {
            String note = explicit.group(1).trim();
            if (!note.isEmpty()) {
                return Optional.of(note);
            }
        }
        if (NEEDS_CONTEXT.matcher(text).find()) {
            return Optional.of(NEEDS_MORE_CONTEXT_NOTE);
        }
        return Optional.empty();
    }
}
