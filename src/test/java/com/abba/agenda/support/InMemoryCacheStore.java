package com.abba.agenda.support;

import com.abba.agenda.domain.service.CacheStore;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe stand-in for Redis. Can be switched to disconnected or to failing every call.
 */
public class InMemoryCacheStore implements CacheStore {

    private final Map<String, Entry> values = new ConcurrentHashMap<>();
    private final List<String> published = Collections.synchronizedList(new ArrayList<>());
    private final Clock clock;
    private volatile boolean connected = true;
    private volatile boolean unreachable;

    public InMemoryCacheStore(Clock clock) {
        this.clock = clock;
    }

    public void setUnreachable(boolean unreachable) {
        this.unreachable = unreachable;
    }

    public List<String> published() {
        return List.copyOf(published);
    }

    public boolean contains(String key) {
        return get(key).isPresent();
    }

    @Override
    public void connect() {
        connected = true;
    }

    @Override
    public void disconnect() {
        connected = false;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        failIfUnreachable();
        long now = clock.millis();
        Entry candidate = new Entry(value, now + ttl.toMillis());
        Entry winner = values.compute(key, (k, current) ->
                current == null || current.expiresAtMs() <= now ? candidate : current);
        return winner == candidate;
    }

    @Override
    public boolean deleteIfValueMatches(String key, String expectedValue) {
        failIfUnreachable();
        Entry current = values.get(key);
        return current != null && current.value().equals(expectedValue) && values.remove(key, current);
    }

    @Override
    public Optional<String> get(String key) {
        failIfUnreachable();
        Entry entry = values.get(key);
        if (entry == null || entry.expiresAtMs() <= clock.millis()) {
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        failIfUnreachable();
        values.put(key, new Entry(value, clock.millis() + ttl.toMillis()));
    }

    @Override
    public void delete(String key) {
        failIfUnreachable();
        values.remove(key);
    }

    @Override
    public void publish(String channel, String message) {
        failIfUnreachable();
        published.add(channel + "|" + message);
    }

    private void failIfUnreachable() {
        if (unreachable) {
            throw new DataAccessResourceFailureException("redis unreachable");
        }
    }

    private record Entry(String value, long expiresAtMs) {
    }
}
