package com.keer.seating.common.exception;

public class NotFoundException extends SeatingException {

    public NotFoundException(ErrorCode errorCode, Object key) {
        super(errorCode, errorCode.getMessage() + ": " + key);
    }

    public static NotFoundException event(long eventId) {
        return new NotFoundException(ErrorCode.EVENT_NOT_FOUND, eventId);
    }

    public static NotFoundException event(String publicCode) {
        return new NotFoundException(ErrorCode.EVENT_NOT_FOUND, publicCode);
    }

    public static NotFoundException guest(long guestId) {
        return new NotFoundException(ErrorCode.GUEST_NOT_FOUND, guestId);
    }

    public static NotFoundException table(long tableId) {
        return new NotFoundException(ErrorCode.TABLE_NOT_FOUND, tableId);
    }

    public static NotFoundException token() {
        // the token itself is a credential and stays out of messages and logs
        return new NotFoundException(ErrorCode.TOKEN_NOT_FOUND, "<redacted>");
    }
}
