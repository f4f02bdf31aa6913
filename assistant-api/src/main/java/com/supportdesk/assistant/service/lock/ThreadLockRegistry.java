package com.supportdesk.assistant.service.lock;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-thread mutual exclusion for event handling. Locks are reference counted and removed once no caller
 * holds or waits for them, so the map only contains threads that are currently busy.
 */
@Component
public class ThreadLockRegistry {

    private final Map<String, Handle> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String threadId, Supplier<T> work) {
        Handle handle = acquire(threadId);
        handle.lock.lock();
        try {
            return work.get();
        } finally {
            handle.lock.unlock();
            release(threadId);
        }
    }

    int activeLocks() {
        return locks.size();
    }

    private Handle acquire(String threadId) {
        return locks.compute(threadId, (key, existing) -> {
            Handle handle = existing == null ? new Handle() : existing;
            handle.references++;
            return handle;
        });
    }

    private void release(String threadId) {
        locks.computeIfPresent(threadId, (key, handle) -> --handle.references == 0 ? null : handle);
    }

    private static final class Handle {
        private final ReentrantLock lock = new ReentrantLock();
        private int references;
    }
}
