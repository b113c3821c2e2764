package com.keer.seating.common.exception;

import com.keer.seating.seating.validation.Rejection;
import lombok.Getter;

@Getter
public class ValidationException extends SeatingException {

    private final Rejection rejection;

    public ValidationException(Rejection rejection) {
        super(ErrorCode.VALIDATION_FAILED, rejection.describe());
        this.rejection = rejection;
    }
}
