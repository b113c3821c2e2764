package com.keer.seating.common.exception;

public class UnauthorizedException extends SeatingException {

    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
