package com.keer.seating.common.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.keer.seating.seating.validation.Rejection;
import com.keer.seating.seating.validation.RejectionReason;

import java.util.List;

/**
 * Body of every error response. The rejection fields are only present for validation failures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String code,
                            String message,
                            RejectionReason reason,
                            List<Integer> offendingRows,
                            List<String> offendingEntities) {

    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(errorCode.name(), message, null, null, null);
    }

    public static ErrorResponse of(Rejection rejection) {
        return new ErrorResponse(ErrorCode.VALIDATION_FAILED.name(), ErrorCode.VALIDATION_FAILED.getMessage(),
                rejection.reason(), rejection.offendingRows(), rejection.offendingEntities());
    }
}
