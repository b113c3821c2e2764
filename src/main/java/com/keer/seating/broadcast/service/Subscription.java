package com.keer.seating.broadcast.service;

import com.keer.seating.broadcast.model.StreamMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One live subscriber: a bounded queue drained on the delivery executor, one drain at a time,
 * so messages reach the sink in the order they were offered.
 */
@Slf4j
public class Subscription {

    private final long id;
    private final long eventId;
    private final DeltaSink sink;
    private final BlockingQueue<StreamMessage> queue;
    private final Executor executor;
    private final Consumer<Subscription> onClose;
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    // last sequence handed to this subscriber, guarded by the owning channel
    long cursor;

    Subscription(long id, long eventId, DeltaSink sink, int queueCapacity,
                 Executor executor, Consumer<Subscription> onClose) {
        this.id = id;
        this.eventId = eventId;
        this.sink = sink;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.executor = executor;
        this.onClose = onClose;
    }

    public long getId() {
        return id;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Client went away; stops delivery without touching the sink again.
     */
    public void cancel() {
        close("cancelled by client", false);
    }

    void offer(StreamMessage message) {
        if (closed.get()) {
            return;
        }
        if (!queue.offer(message)) {
            log.warn("Subscriber {} of event {} overflowed at sequence {}, disconnecting",
                    id, eventId, message.sequence());
            close("queue overflow", true);
            return;
        }
        scheduleDrain();
    }

    void close(String reason, boolean closeSink) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        queue.clear();
        onClose.accept(this);
        log.debug("Subscriber {} of event {} closed: {}", id, eventId, reason);
        if (closeSink) {
            try {
                sink.close();
            } catch (RuntimeException e) {
                log.debug("Closing sink of subscriber {} failed: {}", id, e.getMessage());
            }
        }
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("Delivery executor rejected subscriber {} of event {}", id, eventId);
            close("delivery rejected", true);
        }
    }

    private void drain() {
        try {
            StreamMessage message;
            while (!closed.get() && (message = queue.poll()) != null) {
                try {
                    sink.send(message);
                } catch (RuntimeException e) {
                    log.warn("Delivery to subscriber {} of event {} failed, disconnecting: {}",
                            id, eventId, e.getMessage());
                    close("transport error", true);
                    return;
                }
            }
        } finally {
            draining.set(false);
        }
        if (!closed.get() && !queue.isEmpty()) {
            scheduleDrain();
        }
    }
}
