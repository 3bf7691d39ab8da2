package com.abba.agenda.infrastructure.lock;

import com.abba.agenda.domain.exception.ErrorKind;
import com.abba.agenda.domain.exception.SchedulingException;
import com.abba.agenda.infrastructure.config.LockProperties;
import com.abba.agenda.support.InMemoryCacheStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.abba.agenda.support.TestFixtures.CLOCK;
import static com.abba.agenda.support.TestFixtures.NO_SLEEP;
import static org.junit.jupiter.api.Assertions.*;

class DistributedLockServiceTest {

    private final InMemoryCacheStore store = new InMemoryCacheStore(CLOCK);
    private final LockProperties properties = new LockProperties();
    private final DistributedLockService lockService = new DistributedLockService(store, properties, NO_SLEEP, CLOCK);

    @Test
    void acquireIsExclusiveUntilReleased() {
        assertTrue(lockService.acquire("slot_booking_1", 30));
        assertTrue(store.contains("lock:slot_booking_1"));

        DistributedLockService other = new DistributedLockService(store, properties, NO_SLEEP, CLOCK);
        assertFalse(other.acquire("slot_booking_1", 30));
        assertFalse(other.release("slot_booking_1"));

        assertTrue(lockService.release("slot_booking_1"));
        assertFalse(store.contains("lock:slot_booking_1"));
        assertTrue(other.acquire("slot_booking_1", 30));
    }

    @Test
    void withLockReleasesWhenActionFails() {
        assertThrows(IllegalStateException.class, () -> lockService.withLock("k", 30, () -> {
            throw new IllegalStateException("boom");
        }, 3));

        assertFalse(store.contains("lock:k"));
    }

    @Test
    void withLockTimesOutAfterBackoff() {
        List<Duration> sleeps = new ArrayList<>();
        DistributedLockService waiting = new DistributedLockService(store, properties, sleeps::add, CLOCK);
        store.setIfAbsent("lock:busy", "someone-else", Duration.ofSeconds(30));

        SchedulingException error = assertThrows(SchedulingException.class,
                () -> waiting.withLock("busy", 30, () -> "never", 3));

        assertEquals(ErrorKind.LOCK_TIMEOUT, error.getKind());
        assertEquals("Failed to acquire lock for key: busy after 3 attempts", error.getMessage());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void backoffIsCappedAtMaxDelay() {
        assertEquals(Duration.ofSeconds(1), lockService.backoff(1));
        assertEquals(Duration.ofSeconds(4), lockService.backoff(3));
        assertEquals(Duration.ofSeconds(5), lockService.backoff(4));
    }

    @Test
    void fallsBackToLocalLocksWhenStoreIsDisconnected() {
        store.disconnect();

        assertTrue(lockService.acquire("k", 30));
        assertFalse(lockService.acquire("k", 30));
        assertFalse(store.contains("lock:k"));
        assertTrue(lockService.release("k"));
    }

    @Test
    void fallsBackToLocalLocksWhenStoreIsUnreachable() {
        store.setUnreachable(true);

        String result = lockService.withLock("k", 30, () -> "done", 1);

        assertEquals("done", result);
    }

    @Test
    void localFallbackStillSerializesConcurrentCallers() throws Exception {
        store.disconnect();
        DistributedLockService pacedService = new DistributedLockService(store, properties,
                duration -> Thread.sleep(1), CLOCK);
        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        return pacedService.withLock("shared", 30, () -> {
                            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                            try {
                                Thread.sleep(5);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                            inside.decrementAndGet();
                            return true;
                        }, 2_000);
                    } catch (SchedulingException e) {
                        return false;
                    }
                }));
            }
            start.countDown();
            for (Future<Boolean> result : results) {
                result.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, maxInside.get());
        assertEquals(0, inside.get());
    }
}
