package com.keer.seating.seating.dto;

import com.keer.seating.store.SeatingState;
import com.keer.seating.store.TableRecord;

public record TableView(long id, String label, int capacity, int occupancy, long checkedIn) {

    public static TableView of(TableRecord table, SeatingState state) {
        return new TableView(table.id(), table.label(), table.capacity(),
                state.occupancy(table.id()), state.checkedInCount(table.id()));
    }

    public int availableSeats() {
        return capacity - occupancy;
    }
}
