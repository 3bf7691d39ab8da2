package com.abba.agenda.infrastructure.lock;

import com.abba.agenda.domain.exception.CollaboratorException;
import com.abba.agenda.domain.exception.FailureClassifier;
import com.abba.agenda.domain.exception.FailureKind;
import com.abba.agenda.domain.exception.SchedulingException;
import com.abba.agenda.domain.service.CacheStore;
import com.abba.agenda.domain.service.LockService;
import com.abba.agenda.infrastructure.config.LockProperties;
import com.abba.agenda.infrastructure.retry.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lock service backed by {@code SET NX EX} on the shared {@link CacheStore}. Release deletes the key
 * only while it still holds this owner's token.
 * <p>
 * While the store is disconnected or unreachable, locks are taken from a {@link LocalLockRegistry}.
 * That mode keeps callers inside one instance mutually exclusive but offers no guarantee across
 * instances. Entering and leaving that mode is logged.
 */
@Service
@Slf4j
public class DistributedLockService implements LockService {

    private static final Set<FailureKind> STORE_DOWN =
            EnumSet.of(FailureKind.STORAGE_UNAVAILABLE, FailureKind.NETWORK, FailureKind.TIMEOUT);

    private final CacheStore cacheStore;
    private final LockProperties lockProperties;
    private final Sleeper sleeper;
    private final LocalLockRegistry localLocks;
    private final Map<String, Ownership> owned = new ConcurrentHashMap<>();
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    public DistributedLockService(CacheStore cacheStore, LockProperties lockProperties, Sleeper sleeper, Clock clock) {
        this.cacheStore = cacheStore;
        this.lockProperties = lockProperties;
        this.sleeper = sleeper;
        this.localLocks = new LocalLockRegistry(clock);
    }

    @Override
    public boolean acquire(String key, long ttlSeconds) {
        Ownership ownership = tryAcquire(key, ttlSeconds);
        if (ownership == null) {
            return false;
        }
        owned.put(key, ownership);
        return true;
    }

    @Override
    public boolean release(String key) {
        Ownership ownership = owned.remove(key);
        return ownership != null && release(key, ownership);
    }

    @Override
    public <T> T withLock(String key, long ttlSeconds, Supplier<T> action, int maxRetries) {
        int attempts = Math.max(1, maxRetries);
        for (int attempt = 1; attempt <= attempts; attempt++) {
            Ownership ownership = tryAcquire(key, ttlSeconds);
            if (ownership != null) {
                try {
                    return action.get();
                } finally {
                    release(key, ownership);
                }
            }
            if (attempt < attempts) {
                Duration delay = backoff(attempt);
                log.debug("Lock busy key={} attempt={}/{} delayMs={}", key, attempt, attempts, delay.toMillis());
                pause(delay);
            }
        }
        throw SchedulingException.lockTimeout(key, attempts);
    }

    Duration backoff(int attempt) {
        long base = lockProperties.getBaseDelay().toMillis();
        long cap = lockProperties.getMaxDelay().toMillis();
        int shift = Math.min(attempt - 1, 30);
        long delay = base > (cap >> shift) ? cap : base << shift;
        return Duration.ofMillis(Math.min(delay, cap));
    }

    private Ownership tryAcquire(String key, long ttlSeconds) {
        String storeKey = lockProperties.getKeyPrefix() + key;
        String token = UUID.randomUUID().toString();
        Duration ttl = Duration.ofSeconds(ttlSeconds);
        if (cacheStore.isConnected()) {
            try {
                boolean acquired = cacheStore.setIfAbsent(storeKey, token, ttl);
                if (degraded.compareAndSet(true, false)) {
                    log.info("Lock store reachable again, distributed locking restored");
                }
                return acquired ? new Ownership(token, false) : null;
            } catch (RuntimeException e) {
                if (!STORE_DOWN.contains(FailureClassifier.classify(e))) {
                    throw e;
                }
                degrade(key, e.getMessage());
            }
        } else {
            degrade(key, "store disconnected");
        }
        return localLocks.tryAcquire(storeKey, token, ttl) ? new Ownership(token, true) : null;
    }

    private void degrade(String key, String reason) {
        if (degraded.compareAndSet(false, true)) {
            log.warn("Lock store unavailable, falling back to in-process locks; exclusion no longer holds across instances key={} reason={}",
                    key, reason);
        } else {
            log.debug("Using in-process lock key={} reason={}", key, reason);
        }
    }

    private boolean release(String key, Ownership ownership) {
        String storeKey = lockProperties.getKeyPrefix() + key;
        if (ownership.local()) {
            return localLocks.release(storeKey, ownership.token());
        }
        try {
            return cacheStore.deleteIfValueMatches(storeKey, ownership.token());
        } catch (RuntimeException e) {
            // the TTL reclaims the key
            log.warn("Failed to release lock key={} error={}", key, e.getMessage());
            return false;
        }
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException(FailureKind.LOCK_CONTENTION, "Interrupted while waiting for lock", e);
        }
    }

    private record Ownership(String token, boolean local) {
    }
}
