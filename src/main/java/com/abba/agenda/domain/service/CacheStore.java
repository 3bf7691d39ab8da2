package com.abba.agenda.domain.service;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared key/value store backing distributed locks, listing caches and the slot event channel.
 * Implementations own an explicit connection lifecycle so callers can detect the degraded mode.
 */
public interface CacheStore {

    void connect();

    void disconnect();

    boolean isConnected();

    /**
     * Sets {@code key} only when absent. Returns {@code true} when this call created the entry.
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * Deletes {@code key} only while it still holds {@code expectedValue}.
     */
    boolean deleteIfValueMatches(String key, String expectedValue);

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);

    void publish(String channel, String message);
}
