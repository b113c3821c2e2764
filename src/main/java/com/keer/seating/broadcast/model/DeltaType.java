package com.keer.seating.broadcast.model;

public enum DeltaType {
    TABLE_ADDED,
    TABLE_UPDATED,
    TABLE_REMOVED,
    GUEST_ADDED,
    GUEST_UPDATED,
    GUEST_REMOVED,
    SEATING_CHANGED,
    CHECKED_IN,
    CHECK_IN_REVERTED
}
