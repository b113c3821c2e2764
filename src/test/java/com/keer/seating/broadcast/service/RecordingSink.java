package com.keer.seating.broadcast.service;

import com.keer.seating.broadcast.model.Delta;
import com.keer.seating.broadcast.model.DeltaType;
import com.keer.seating.broadcast.model.StreamMessage;
import com.keer.seating.common.exception.TransportException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

/**
 * Sink that keeps everything it is sent. Can be told to fail or to block.
 */
public class RecordingSink implements DeltaSink {

    private final List<StreamMessage> messages = new CopyOnWriteArrayList<>();
    private volatile boolean closed;
    private volatile boolean failing;
    private volatile CountDownLatch gate;

    @Override
    public void send(StreamMessage message) {
        if (failing) {
            throw new TransportException("connection reset", null);
        }
        CountDownLatch current = gate;
        if (current != null) {
            try {
                current.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("interrupted", e);
            }
        }
        messages.add(message);
    }

    @Override
    public void close() {
        closed = true;
    }

    public void failSends() {
        this.failing = true;
    }

    public void blockUntil(CountDownLatch latch) {
        this.gate = latch;
    }

    public boolean isClosed() {
        return closed;
    }

    public List<StreamMessage> messages() {
        return messages;
    }

    public List<Delta> deltas() {
        return messages.stream()
                .filter(m -> m.type() == StreamMessage.Type.DELTA)
                .map(m -> (Delta) m.payload())
                .toList();
    }

    public List<DeltaType> deltaTypes() {
        return deltas().stream().map(Delta::type).toList();
    }

    public List<Long> sequences() {
        return messages.stream().map(StreamMessage::sequence).toList();
    }
}
