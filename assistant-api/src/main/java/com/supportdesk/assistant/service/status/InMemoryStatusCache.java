package com.supportdesk.assistant.service.status;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryStatusCache implements StatusCache {

    private final Map<String, StatusCacheEntry<StatusReport>> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<StatusCacheEntry<StatusReport>> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(String key, StatusCacheEntry<StatusReport> entry) {
        entries.put(key, entry);
    }
}
