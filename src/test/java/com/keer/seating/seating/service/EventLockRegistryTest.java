package com.keer.seating.seating.service;

import com.keer.seating.common.exception.ConflictException;
import com.keer.seating.common.exception.ErrorCode;
import com.keer.seating.config.SeatingProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class EventLockRegistryTest {

    private static final long EVENT_ID = 3L;

    private EventLockRegistry locks;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        SeatingProperties properties = new SeatingProperties();
        properties.getEngine().setLockTimeout(Duration.ofSeconds(5));
        locks = new EventLockRegistry(properties);
        pool = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void shouldDropEntryOfDeletedEventWhenNobodyWaits() throws Exception {
        ReentrantLock lock = locks.acquire(EVENT_ID);

        locks.forget(EVENT_ID, lock);
        lock.unlock();

        assertFalse(locks.isRegistered(EVENT_ID));
    }

    @Test
    void shouldKeepEntryWhileAnotherWriterWaitsOnIt() throws Exception {
        ReentrantLock lock = locks.acquire(EVENT_ID);
        Future<ReentrantLock> waiter = pool.submit(() -> {
            ReentrantLock acquired = locks.acquire(EVENT_ID);
            acquired.unlock();
            return acquired;
        });
        await().atMost(Duration.ofSeconds(5)).until(lock::hasQueuedThreads);

        locks.forget(EVENT_ID, lock);
        lock.unlock();

        assertTrue(locks.isRegistered(EVENT_ID));
        assertSame(lock, waiter.get(5, TimeUnit.SECONDS), "the waiter must get the lock it queued on");
        ReentrantLock next = locks.acquire(EVENT_ID);
        assertSame(lock, next);
        next.unlock();
    }

    @Test
    void shouldIgnoreForgetFromThreadNotHoldingTheLock() throws Exception {
        ReentrantLock lock = locks.acquire(EVENT_ID);
        lock.unlock();

        locks.forget(EVENT_ID, lock);

        assertTrue(locks.isRegistered(EVENT_ID));
    }

    @Test
    void shouldReportBusyEventAfterTimeout() throws Exception {
        SeatingProperties properties = new SeatingProperties();
        properties.getEngine().setLockTimeout(Duration.ofMillis(50));
        EventLockRegistry impatient = new EventLockRegistry(properties);
        ReentrantLock held = impatient.acquire(EVENT_ID);
        try {
            Future<?> blocked = pool.submit(() -> impatient.acquire(EVENT_ID));

            Exception e = assertThrows(Exception.class, () -> blocked.get(5, TimeUnit.SECONDS));
            ConflictException conflict = assertInstanceOf(ConflictException.class, e.getCause());
            assertEquals(ErrorCode.EVENT_BUSY, conflict.getErrorCode());
        } finally {
            held.unlock();
        }
    }
}
