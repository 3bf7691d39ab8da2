package com.abba.agenda.domain.service;

import java.util.function.Supplier;

public interface LockService {

    boolean acquire(String key, long ttlSeconds);

    boolean release(String key);

    /**
     * Runs {@code action} while holding {@code key}. Acquisition is retried with exponential backoff
     * up to {@code maxRetries} attempts; the lock is released even when {@code action} fails.
     */
    <T> T withLock(String key, long ttlSeconds, Supplier<T> action, int maxRetries);

    default String bookingLockKey(String slotId) {
        return "slot_booking_" + slotId;
    }
}
