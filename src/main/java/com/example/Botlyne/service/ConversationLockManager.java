package com.example.Botlyne.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes turns of the same conversation. Locks are reference counted and dropped as soon
 * as nobody holds or waits for them.
 */
@Component
public class ConversationLockManager {

    private static final class Handle {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int refs;
    }

    private final Map<UUID, Handle> locks = new ConcurrentHashMap<>();

    /**
     * Run {@code work} while holding the conversation's lock. A null id (new conversation) runs unlocked.
     */
    public <T> T withLock(UUID conversationId, Supplier<T> work) {
        if (conversationId == null) {
            return work.get();
        }
        Handle handle = locks.compute(conversationId, (id, existing) -> {
            Handle h = existing == null ? new Handle() : existing;
            h.refs++;
            return h;
        });
        handle.lock.lock();
        try {
            return work.get();
        } finally {
            handle.lock.unlock();
            locks.computeIfPresent(conversationId, (id, h) -> --h.refs == 0 ? null : h);
        }
    }

    int activeLocks() {
        return locks.size();
    }
}
