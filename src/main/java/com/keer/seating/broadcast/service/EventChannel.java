package com.keer.seating.broadcast.service;

import com.keer.seating.broadcast.model.Delta;
import com.keer.seating.broadcast.model.StreamMessage;
import com.keer.seating.seating.dto.SeatingSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Bounded delta log and subscriber list of one event. All state changes happen under the
 * channel monitor, so a subscriber is attached at an exact point of the log.
 */
@Slf4j
class EventChannel {

    private final long eventId;
    private final int capacity;
    private final int queueCapacity;
    private final ArrayDeque<Delta> deltaLog = new ArrayDeque<>();
    private final CopyOnWriteArrayList<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    // sequence of the newest appended delta, -1 until the first append
    private long head = -1;
    private boolean closed;

    EventChannel(long eventId, int capacity, int queueCapacity) {
        this.eventId = eventId;
        this.capacity = capacity;
        this.queueCapacity = queueCapacity;
    }

    synchronized void append(List<Delta> deltas) {
        for (Delta delta : deltas) {
            if (head >= 0 && delta.sequence() <= head) {
                log.debug("Event {} delta {} already appended, skipping", eventId, delta.sequence());
                continue;
            }
            if (head >= 0 && delta.sequence() != head + 1) {
                // subscribers can no longer be caught up from this log
                log.warn("Event {} delta log jumped from {} to {}, resetting subscribers",
                        eventId, head, delta.sequence());
                deltaLog.clear();
                subscriptions.forEach(s -> s.close("sequence gap", true));
            }

            deltaLog.addLast(delta);
            while (deltaLog.size() > capacity) {
                deltaLog.removeFirst();
            }
            head = delta.sequence();

            StreamMessage message = StreamMessage.delta(delta);
            for (Subscription subscription : subscriptions) {
                if (delta.sequence() > subscription.cursor) {
                    subscription.cursor = delta.sequence();
                    subscription.offer(message);
                }
            }
        }
    }

    /**
     * Attaches a subscriber that has seen everything up to {@code lastSequence}.
     *
     * @return false when the retained log or the subscriber queue cannot hold the gap and a snapshot is needed
     */
    synchronized boolean attachFromCheckpoint(Subscription subscription, long lastSequence) {
        if (closed) {
            subscription.close("event closed", true);
            return true;
        }
        if (head < 0 || lastSequence > head) {
            return false;
        }
        if (lastSequence < head && !retainedAfter(lastSequence)) {
            return false;
        }
        // the missed deltas must fit into the subscriber queue at once
        if (head - lastSequence >= queueCapacity) {
            log.debug("Event {} subscriber missed {} deltas, a full queue or more", eventId, head - lastSequence);
            return false;
        }
        attach(subscription, lastSequence);
        return true;
    }

    /**
     * Attaches a subscriber that starts from {@code snapshot}.
     *
     * @return false when deltas after the snapshot have already left the log or no longer fit the queue
     */
    synchronized boolean attachFromSnapshot(Subscription subscription, SeatingSnapshot snapshot) {
        if (closed) {
            subscription.close("event closed", true);
            return true;
        }
        long sequence = snapshot.sequence();
        if (head > sequence && !retainedAfter(sequence)) {
            return false;
        }
        // snapshot plus the deltas after it
        if (head - sequence >= queueCapacity) {
            return false;
        }
        subscription.offer(StreamMessage.snapshot(snapshot));
        attach(subscription, sequence);
        return true;
    }

    void detach(Subscription subscription) {
        subscriptions.remove(subscription);
    }

    synchronized void closeAll() {
        closed = true;
        subscriptions.forEach(s -> s.close("event closed", true));
        subscriptions.clear();
        deltaLog.clear();
    }

    synchronized long head() {
        return head;
    }

    synchronized boolean isClosed() {
        return closed;
    }

    int subscriberCount() {
        return subscriptions.size();
    }

    private boolean retainedAfter(long sequence) {
        return !deltaLog.isEmpty() && deltaLog.peekFirst().sequence() <= sequence + 1;
    }

    private void attach(Subscription subscription, long fromSequence) {
        subscription.cursor = fromSequence;
        for (Delta delta : deltaLog) {
            if (delta.sequence() > fromSequence) {
                subscription.cursor = delta.sequence();
                subscription.offer(StreamMessage.delta(delta));
            }
        }
        if (!subscription.isClosed()) {
            subscriptions.add(subscription);
        }
    }
}
