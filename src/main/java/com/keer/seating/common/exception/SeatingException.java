package com.keer.seating.common.exception;

import lombok.Getter;

/**
 * Base of every error the seating service reports to its callers.
 */
@Getter
public class SeatingException extends RuntimeException {

    private final ErrorCode errorCode;

    public SeatingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SeatingException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
