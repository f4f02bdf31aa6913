package com.supportdesk.assistant.service.status;

import java.time.Instant;

public record StatusCacheEntry<T>(Instant expiresAt, T value) {

    public boolean isLive(Instant now) {
        return now.isBefore(expiresAt);
    }
}
