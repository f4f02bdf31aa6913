package com.supportdesk.assistant.service.intent;

import java.util.regex.Pattern;

/**
 * Removes the leading bot mention (e.g. {@code <@U123ABC>}) that the chat platform prepends to app mentions.
 */
public final class MentionText {

    private static final Pattern LEADING_MENTION = Pattern.compile("^\\s*<@[^>]+>\\s*");

    private MentionText() {
    }

    public static String strip(String text) {
        if (text == null) {
            return "";
        }
        return LEADING_MENTION.matcher(text).replaceFirst("").trim();
    }
}
