package com.abba.agenda.infrastructure.cache;

import com.abba.agenda.domain.service.CacheStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
@Slf4j
public class RedisCacheStore implements CacheStore {

    private static final RedisScript<Long> COMPARE_AND_DELETE = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public RedisCacheStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @PostConstruct
    @Override
    public void connect() {
        try (RedisConnection connection = redisTemplate.getRequiredConnectionFactory().getConnection()) {
            connection.ping();
            connected.set(true);
            log.info("Connected to Redis");
        } catch (DataAccessException e) {
            connected.set(false);
            log.warn("Redis unavailable, locks fall back to in-process mode error={}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${agenda.cache.reconnect-interval:PT30S}",
            initialDelayString = "${agenda.cache.reconnect-interval:PT30S}")
    public void reconnectIfDisconnected() {
        if (!connected.get() && !shuttingDown.get()) {
            connect();
        }
    }

    @PreDestroy
    @Override
    public void disconnect() {
        shuttingDown.set(true);
        connected.set(false);
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value, ttl));
    }

    @Override
    public boolean deleteIfValueMatches(String key, String expectedValue) {
        Long deleted = redisTemplate.execute(COMPARE_AND_DELETE, List.of(key), expectedValue);
        return deleted != null && deleted > 0;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }

    @Override
    public void publish(String channel, String message) {
        redisTemplate.convertAndSend(channel, message);
    }
}
