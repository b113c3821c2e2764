package com.keer.seating.broadcast.service;

import com.keer.seating.broadcast.model.StreamMessage;

/**
 * Transport end of one live subscriber.
 */
public interface DeltaSink {

    /**
     * @throws com.keer.seating.common.exception.TransportException if the message could not be written
     */
    void send(StreamMessage message);

    /**
     * Ends the connection so the client reconnects through catch-up.
     */
    void close();
}
