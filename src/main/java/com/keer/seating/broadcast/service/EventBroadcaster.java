package com.keer.seating.broadcast.service;

import com.keer.seating.broadcast.model.Delta;
import com.keer.seating.common.exception.ConflictException;
import com.keer.seating.common.exception.NotFoundException;
import com.keer.seating.config.SeatingConfig;
import com.keer.seating.config.SeatingProperties;
import com.keer.seating.seating.dto.SeatingSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Fans committed deltas out to live subscribers of each event.
 * <p>
 * {@link #publish} only appends to the event's log and offers to bounded subscriber queues;
 * delivery runs on the delivery executor, so writers never wait on subscribers.
 */
@Service
@Slf4j
public class EventBroadcaster {

    private static final int SNAPSHOT_ATTEMPTS = 3;

    private final ConcurrentHashMap<Long, EventChannel> channels = new ConcurrentHashMap<>();
    // events torn down by closeEvent, never given a channel again
    private final Set<Long> closedEvents = ConcurrentHashMap.newKeySet();
    private final AtomicLong subscriptionIds = new AtomicLong();
    private final Executor deliveryExecutor;
    private final int logCapacity;
    private final int queueCapacity;

    public EventBroadcaster(@Qualifier(SeatingConfig.DELIVERY_EXECUTOR) Executor deliveryExecutor,
                            SeatingProperties properties) {
        this.deliveryExecutor = deliveryExecutor;
        this.logCapacity = properties.getBroadcast().getLogCapacity();
        this.queueCapacity = properties.getBroadcast().getSubscriberQueueCapacity();
    }

    public void publish(long eventId, List<Delta> deltas) {
        if (deltas.isEmpty()) {
            return;
        }
        EventChannel channel = channel(eventId);
        if (channel == null) {
            log.debug("Event {} is closed, dropping {} deltas", eventId, deltas.size());
            return;
        }
        channel.append(deltas);
        log.debug("Event {} published deltas {}..{}", eventId,
                deltas.get(0).sequence(), deltas.get(deltas.size() - 1).sequence());
    }

    /**
     * Attaches a live subscriber. With a {@code lastSequence} still covered by the retained log the
     * subscriber gets exactly the missed deltas; otherwise it gets a snapshot followed by the deltas
     * after the snapshot's sequence.
     *
     * @throws NotFoundException if the event was closed
     */
    public Subscription subscribe(long eventId, Long lastSequence, DeltaSink sink,
                                  Supplier<SeatingSnapshot> snapshotLoader) {
        EventChannel channel = channel(eventId);
        if (channel == null) {
            throw NotFoundException.event(eventId);
        }
        Subscription subscription = new Subscription(subscriptionIds.incrementAndGet(), eventId, sink,
                queueCapacity, deliveryExecutor, channel::detach);

        if (lastSequence != null && channel.attachFromCheckpoint(subscription, lastSequence)) {
            log.debug("Subscriber {} of event {} resumed after sequence {}", subscription.getId(), eventId, lastSequence);
            return subscription;
        }

        for (int attempt = 1; attempt <= SNAPSHOT_ATTEMPTS; attempt++) {
            SeatingSnapshot snapshot = snapshotLoader.get();
            if (channel.attachFromSnapshot(subscription, snapshot)) {
                log.debug("Subscriber {} of event {} started from snapshot at sequence {}",
                        subscription.getId(), eventId, snapshot.sequence());
                return subscription;
            }
            log.debug("Snapshot at sequence {} of event {} already outside the log, reloading",
                    snapshot.sequence(), eventId);
        }
        throw new ConflictException("Could not attach a subscriber to event " + eventId + " under current write load");
    }

    /**
     * Disconnects every subscriber of a torn-down event and drops its log.
     */
    public void closeEvent(long eventId) {
        closedEvents.add(eventId);
        EventChannel channel = channels.remove(eventId);
        if (channel != null) {
            channel.closeAll();
            log.info("Closed live channel of event {}", eventId);
        }
    }

    public int subscriberCount(long eventId) {
        EventChannel channel = channels.get(eventId);
        return channel == null ? 0 : channel.subscriberCount();
    }

    public long headSequence(long eventId) {
        EventChannel channel = channels.get(eventId);
        return channel == null ? -1 : channel.head();
    }

    private EventChannel channel(long eventId) {
        if (closedEvents.contains(eventId)) {
            return null;
        }
        EventChannel channel = channels.computeIfAbsent(eventId,
                id -> new EventChannel(id, logCapacity, queueCapacity));
        if (closedEvents.contains(eventId)) {
            // closeEvent ran between the check and the insert
            channels.remove(eventId, channel);
            channel.closeAll();
            return null;
        }
        return channel;
    }
}
