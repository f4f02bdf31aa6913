package com.supportdesk.assistant.service.context;

import java.time.Duration;
import java.util.Optional;

/**
 * Minimal string cache with per-key expiry. Implementations signal backend failures with
 * {@link KeyValueCacheException}.
 */
public interface KeyValueCache {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);
}
