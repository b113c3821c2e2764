package com.keer.seating.seating.dto;

public enum ImportMode {
    /** Batch describes the whole event; unmatched guests and unreferenced tables are removed. */
    REPLACE_ALL,
    /** Batch adds and updates; everything else is left alone. */
    UPSERT
}
