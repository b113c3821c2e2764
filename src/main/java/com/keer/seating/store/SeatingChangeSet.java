package com.keer.seating.store;

import java.util.ArrayList;
import java.util.List;

/**
 * Difference between two states of one event, applied by the store in a single transaction.
 * Created rows carry negative placeholder ids that the store maps to real ids on commit.
 */
public record SeatingChangeSet(long eventId,
                               long expectedSequence,
                               long nextSequence,
                               List<TableRecord> createdTables,
                               List<TableRecord> updatedTables,
                               List<Long> removedTableIds,
                               List<GuestRecord> createdGuests,
                               List<GuestRecord> updatedGuests,
                               List<Long> removedGuestIds) {

    public static SeatingChangeSet between(SeatingState before, SeatingState after, long nextSequence) {
        List<TableRecord> createdTables = new ArrayList<>();
        List<TableRecord> updatedTables = new ArrayList<>();
        List<Long> removedTables = new ArrayList<>();
        for (TableRecord table : after.tables().values()) {
            TableRecord previous = before.tables().get(table.id());
            if (previous == null) {
                createdTables.add(table);
            } else if (!previous.equals(table)) {
                updatedTables.add(table);
            }
        }
        before.tables().keySet().stream()
                .filter(id -> !after.tables().containsKey(id))
                .forEach(removedTables::add);

        List<GuestRecord> createdGuests = new ArrayList<>();
        List<GuestRecord> updatedGuests = new ArrayList<>();
        List<Long> removedGuests = new ArrayList<>();
        for (GuestRecord guest : after.guests().values()) {
            GuestRecord previous = before.guests().get(guest.id());
            if (previous == null) {
                createdGuests.add(guest);
            } else if (!previous.equals(guest)) {
                updatedGuests.add(guest);
            }
        }
        before.guests().keySet().stream()
                .filter(id -> !after.guests().containsKey(id))
                .forEach(removedGuests::add);

        return new SeatingChangeSet(before.eventId(), before.sequence(), nextSequence,
                List.copyOf(createdTables), List.copyOf(updatedTables), List.copyOf(removedTables),
                List.copyOf(createdGuests), List.copyOf(updatedGuests), List.copyOf(removedGuests));
    }

    public boolean isEmpty() {
        return createdTables.isEmpty() && updatedTables.isEmpty() && removedTableIds.isEmpty()
                && createdGuests.isEmpty() && updatedGuests.isEmpty() && removedGuestIds.isEmpty();
    }
}
