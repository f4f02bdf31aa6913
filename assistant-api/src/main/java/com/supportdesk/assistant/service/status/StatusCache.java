package com.supportdesk.assistant.service.status;

import java.util.Optional;

/**
 * Shared across threads and channels, keyed by query type and filters.
 */
public interface StatusCache {

    Optional<StatusCacheEntry<StatusReport>> get(String key);

    void put(String key, StatusCacheEntry<StatusReport> entry);
}
