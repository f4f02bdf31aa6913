package com.supportdesk.assistant.service.draft;

import java.time.Instant;

/**
 * One immutable revision of a draft. {@code intent} is null for the seed version {@code v0}.
 */
public record DraftVersion(String id, String text, Instant createdAt, RefinementIntent intent) {

    public static String idFor(int index) {
        return "v" + index;
    }
}
