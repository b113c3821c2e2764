package com.keer.seating.broadcast.service;

import com.keer.seating.broadcast.model.StreamMessage;
import com.keer.seating.common.exception.TransportException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

public class SseDeltaSink implements DeltaSink {

    private final SseEmitter emitter;

    public SseDeltaSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(StreamMessage message) {
        try {
            // the event id lets EventSource resume with Last-Event-ID
            emitter.send(SseEmitter.event()
                    .id(Long.toString(message.sequence()))
                    .name(message.type().name().toLowerCase())
                    .data(message));
        } catch (IOException | IllegalStateException e) {
            throw new TransportException("SSE send failed at sequence " + message.sequence(), e);
        }
    }

    @Override
    public void close() {
        emitter.complete();
    }
}
