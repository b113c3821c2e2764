package com.keer.seating.common.exception;

public class ImportCancelledException extends SeatingException {

    public ImportCancelledException(long eventId) {
        super(ErrorCode.IMPORT_CANCELLED, "Import for event " + eventId + " was cancelled before commit");
    }
}
