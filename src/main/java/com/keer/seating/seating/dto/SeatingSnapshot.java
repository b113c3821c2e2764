package com.keer.seating.seating.dto;

import com.keer.seating.store.SeatingState;

import java.util.List;

/**
 * Full committed state of an event, tagged with the sequence of the last delta it reflects.
 */
public record SeatingSnapshot(long eventId,
                              String eventName,
                              long sequence,
                              List<TableView> tables,
                              List<GuestView> guests) {

    public static SeatingSnapshot of(SeatingState state) {
        List<TableView> tables = state.tables().values().stream()
                .map(t -> TableView.of(t, state))
                .toList();
        List<GuestView> guests = state.guests().values().stream()
                .map(g -> GuestView.of(g, state))
                .toList();
        return new SeatingSnapshot(state.eventId(), state.eventName(), state.sequence(), tables, guests);
    }
}
