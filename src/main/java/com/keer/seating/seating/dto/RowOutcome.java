package com.keer.seating.seating.dto;

/**
 * @param row zero-based index of the batch row
 */
public record RowOutcome(int row, long guestId, Outcome outcome) {

    public enum Outcome {
        ADDED, UPDATED, UNCHANGED
    }
}
