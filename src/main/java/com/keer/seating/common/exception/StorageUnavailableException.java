package com.keer.seating.common.exception;

public class StorageUnavailableException extends SeatingException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_UNAVAILABLE, message, cause);
    }
}
