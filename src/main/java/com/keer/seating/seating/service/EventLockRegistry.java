package com.keer.seating.seating.service;

import com.keer.seating.common.exception.ConflictException;
import com.keer.seating.common.exception.ErrorCode;
import com.keer.seating.config.SeatingProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One write lock per event. Writes of different events never contend.
 */
@Component
public class EventLockRegistry {

    private final ConcurrentHashMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public EventLockRegistry(SeatingProperties properties) {
        this.timeout = properties.getEngine().getLockTimeout();
    }

    /**
     * Waits up to the configured timeout for the event's lock.
     *
     * @throws ConflictException    with {@link ErrorCode#EVENT_BUSY} if the lock stayed taken
     * @throws InterruptedException if the waiting thread was interrupted
     */
    public ReentrantLock acquire(long eventId) throws InterruptedException {
        ReentrantLock lock = locks.computeIfAbsent(eventId, id -> new ReentrantLock(true));
        if (!lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new ConflictException(ErrorCode.EVENT_BUSY,
                    "Event " + eventId + " stayed locked for " + timeout.toMillis() + " ms");
        }
        return lock;
    }

    /**
     * Drops the registry entry of a deleted event. Must be called by the holder of {@code lock};
     * the entry stays while other writers are queued on it.
     */
    public void forget(long eventId, ReentrantLock lock) {
        if (lock.isHeldByCurrentThread() && !lock.hasQueuedThreads()) {
            locks.remove(eventId, lock);
        }
    }

    boolean isRegistered(long eventId) {
        return locks.containsKey(eventId);
    }
}
