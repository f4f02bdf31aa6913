package com.supportdesk.assistant.service.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supportdesk.assistant.config.AssistantProperties;
import com.supportdesk.assistant.service.audit.AssistantEventLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Persists {@link ThreadContext} records as JSON in the {@link KeyValueCache}. Cache failures are logged and
 * returned as error results.
 */
@Component
public class ThreadContextStore {

    private static final Logger log = LoggerFactory.getLogger(ThreadContextStore.class);

    public static final String KEY_PREFIX = "assistant:thread-context:";
    public static final String STALE_MESSAGE = "This thread has expired. Please start a new conversation.";

    /** Entries outlive their context TTL by this much so late replies get the expired message. */
    static final Duration STALE_GRACE = Duration.ofHours(1);

    private static final Pattern TOPIC_CHANGE = Pattern.compile("\\b(new topic|different customer|new customer)\\b");

    private final KeyValueCache cache;
    private final ObjectMapper objectMapper;
    private final AssistantEventLogger eventLogger;
    private final Clock clock;
    private final long defaultTtlSeconds;

    public ThreadContextStore(KeyValueCache cache,
                              ObjectMapper objectMapper,
                              AssistantEventLogger eventLogger,
                              Clock clock,
                              AssistantProperties properties) {
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.eventLogger = eventLogger;
        this.clock = clock;
        this.defaultTtlSeconds = properties.getThreadContext().getTtlSeconds();
    }

    /**
     * Builds a new context stamped with the current time. Nothing is stored until {@link #write} is called.
     */
    public ThreadContext create(String threadId,
                                String channelId,
                                String conversationId,
                                String currentDraft,
                                int draftVersion,
                                String customerId) {
        Instant now = clock.instant();
        return new ThreadContext(threadId, channelId, conversationId, currentDraft, draftVersion, customerId,
                now, now, defaultTtlSeconds);
    }

    public ThreadContextWriteResult write(ThreadContext context) {
        ThreadContext normalized = context.touchedAt(clock.instant());
        if (normalized.ttlSeconds() <= 0) {
            normalized = new ThreadContext(normalized.threadId(), normalized.channelId(), normalized.conversationId(),
                    normalized.currentDraft(), normalized.draftVersion(), normalized.customerId(),
                    normalized.createdAt(), normalized.lastActivityAt(), defaultTtlSeconds);
        }
        try {
            cache.set(key(normalized.threadId()), objectMapper.writeValueAsString(normalized),
                    Duration.ofSeconds(normalized.ttlSeconds()).plus(STALE_GRACE));
        } catch (JsonProcessingException | KeyValueCacheException ex) {
            logError(normalized.threadId(), "set", ex);
            return ThreadContextWriteResult.error("Failed to store thread context.");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("threadId", normalized.threadId());
        payload.put("channelId", normalized.channelId());
        payload.put("conversationId", normalized.conversationId());
        payload.put("ttlSeconds", normalized.ttlSeconds());
        eventLogger.info("assistant.thread_context_set", payload);
        return ThreadContextWriteResult.ok(normalized);
    }

    public ThreadContextLookup read(String threadId) {
        String key = key(threadId);
        Optional<ThreadContext> context;
        try {
            context = cache.get(key).flatMap(this::parse);
        } catch (KeyValueCacheException ex) {
            logError(threadId, "get", ex);
            return ThreadContextLookup.error("Failed to load thread context.");
        }
        if (context.isEmpty()) {
            eventLogger.info("assistant.thread_context_get", Map.of("threadId", threadId, "status", "missing"));
            return ThreadContextLookup.missing();
        }
        if (context.get().isStale(clock.instant())) {
            try {
                cache.delete(key);
            } catch (KeyValueCacheException ex) {
                logError(threadId, "delete", ex);
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("threadId", threadId);
            payload.put("conversationId", context.get().conversationId());
            eventLogger.info("assistant.thread_context_stale", payload);
            return ThreadContextLookup.stale(STALE_MESSAGE);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("threadId", threadId);
        payload.put("status", "active");
        payload.put("conversationId", context.get().conversationId());
        eventLogger.info("assistant.thread_context_get", payload);
        return ThreadContextLookup.active(context.get());
    }

    public ThreadContextWriteResult clear(String threadId) {
        try {
            cache.delete(key(threadId));
        } catch (KeyValueCacheException ex) {
            logError(threadId, "clear", ex);
            return ThreadContextWriteResult.error("Failed to clear thread context.");
        }
        eventLogger.info("assistant.thread_context_clear", Map.of("threadId", threadId));
        return ThreadContextWriteResult.ok(null);
    }

    /**
     * True when the message signals a topic change and the thread's context should be dropped.
     */
    public boolean shouldClear(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        return TOPIC_CHANGE.matcher(text.trim().toLowerCase(Locale.ROOT)).find();
    }

    static String key(String threadId) {
        return KEY_PREFIX + threadId;
    }

    private Optional<ThreadContext> parse(String json) {
        try {
            return Optional.ofNullable(objectMapper.readValue(json, ThreadContext.class));
        } catch (JsonProcessingException ex) {
            log.warn("Discarding unreadable thread context: {}", ex.getOriginalMessage());
            return Optional.empty();
        }
    }

    private void logError(String threadId, String operation, Exception ex) {
        log.error("Thread context {} failed for thread {}", operation, threadId, ex);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("threadId", threadId);
        payload.put("operation", operation);
        payload.put("message", ex.getMessage());
        eventLogger.log(Level.ERROR, "assistant.thread_context_error", payload);
    }
}
