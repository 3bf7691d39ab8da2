package com.abba.agenda.infrastructure.lock;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process lock table used while the shared store is unreachable. Entries expire like their
 * shared counterparts so a crashed holder cannot block a key forever. Only guards callers inside
 * this JVM.
 */
public final class LocalLockRegistry {

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    public LocalLockRegistry(Clock clock) {
        this.clock = clock;
    }

    public boolean tryAcquire(String key, String token, Duration ttl) {
        long now = clock.millis();
        Entry candidate = new Entry(token, now + Math.max(0, ttl.toMillis()));
        Entry winner = locks.compute(key, (k, current) ->
                current == null || current.expiresAtMs() <= now ? candidate : current);
        return winner == candidate;
    }

    public boolean release(String key, String token) {
        Entry current = locks.get(key);
        if (current == null || !current.token().equals(token)) {
            return false;
        }
        return locks.remove(key, current);
    }

    public boolean isHeld(String key) {
        Entry current = locks.get(key);
        return current != null && current.expiresAtMs() > clock.millis();
    }

    private record Entry(String token, long expiresAtMs) {
    }
}
