package com.keer.seating.store;

/**
 * A table as seen inside one write. Negative ids are placeholders for tables not yet committed.
 */
public record TableRecord(long id, String label, int capacity) {

    public boolean isNew() {
        return id < 0;
    }

    public TableRecord withCapacity(int newCapacity) {
        return new TableRecord(id, label, newCapacity);
    }
}
