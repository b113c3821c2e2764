package com.keer.seating.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {

    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Request is malformed"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Admin credential is missing or invalid"),

    VALIDATION_FAILED(HttpStatus.UNPROCESSABLE_ENTITY, "Proposed seating violates an invariant"),

    EVENT_NOT_FOUND(HttpStatus.NOT_FOUND, "Event not found"),
    GUEST_NOT_FOUND(HttpStatus.NOT_FOUND, "Guest not found"),
    TABLE_NOT_FOUND(HttpStatus.NOT_FOUND, "Table not found"),
    TOKEN_NOT_FOUND(HttpStatus.NOT_FOUND, "Lookup token not found"),

    CONFLICT(HttpStatus.CONFLICT, "Seating state changed concurrently, retry with fresh state"),
    EVENT_BUSY(HttpStatus.CONFLICT, "Another change to this event is in progress"),
    IMPORT_CANCELLED(HttpStatus.CONFLICT, "Import was cancelled before commit"),

    STORAGE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Seating store is unavailable"),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected server error");

    private final HttpStatus httpStatus;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String message) {
        this.httpStatus = httpStatus;
        this.message = message;
    }
}
