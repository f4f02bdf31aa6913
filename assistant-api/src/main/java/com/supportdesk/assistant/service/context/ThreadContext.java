package com.supportdesk.assistant.service.context;

import java.time.Duration;
import java.time.Instant;

/**
 * Cross-message context for one chat thread. A record is stale once more than {@code ttlSeconds} have passed
 * since {@code lastActivityAt}; reads never move that timestamp.
 */
public record ThreadContext(
        String threadId,
        String channelId,
        String conversationId,
        String currentDraft,
        int draftVersion,
        String customerId,
        Instant createdAt,
        Instant lastActivityAt,
        long ttlSeconds
) {

    public boolean isStale(Instant now) {
        return Duration.between(lastActivityAt, now).compareTo(Duration.ofSeconds(ttlSeconds)) > 0;
    }

    public ThreadContext withDraft(String draftText, int version) {
        return new ThreadContext(threadId, channelId, conversationId, draftText, version, customerId,
                createdAt, lastActivityAt, ttlSeconds);
    }

    public ThreadContext withCustomerId(String value) {
        return new ThreadContext(threadId, channelId, conversationId, currentDraft, draftVersion, value,
                createdAt, lastActivityAt, ttlSeconds);
    }

    ThreadContext touchedAt(Instant at) {
        return new ThreadContext(threadId, channelId, conversationId, currentDraft, draftVersion, customerId,
                createdAt == null ? at : createdAt, at, ttlSeconds);
    }
}
