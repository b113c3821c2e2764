package com.keer.seating.common.exception;

/**
 * Delivery to one live subscriber failed. Stays local to that subscriber.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
