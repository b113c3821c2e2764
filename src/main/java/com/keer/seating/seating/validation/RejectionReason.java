package com.keer.seating.seating.validation;

/**
 * Typed rejection kinds, listed in the order the validator checks them.
 */
public enum RejectionReason {
    INVALID_TABLE_CAPACITY,
    MALFORMED_ROW,
    DUPLICATE_GUEST_KEY,
    UNKNOWN_TABLE,
    DUPLICATE_SEAT,
    CAPACITY_EXCEEDED,
    ORPHAN_TABLE_REFERENCE
}
