package com.keer.seating.seating.service;

import com.keer.seating.broadcast.model.Delta;
import com.keer.seating.broadcast.model.DeltaType;
import com.keer.seating.seating.dto.GuestView;
import com.keer.seating.seating.dto.TableView;
import com.keer.seating.store.GuestRecord;
import com.keer.seating.store.SeatingState;
import com.keer.seating.store.TableRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the difference between two states of an event into the minimal ordered delta list.
 * <p>
 * Order: table additions and updates, guest removals, guest additions, guest changes
 * (seating, details, check-in), table removals. Sequences follow on from {@code before}.
 */
final class DeltaPlanner {

    private DeltaPlanner() {}

    static List<Delta> plan(SeatingState before, SeatingState after, Instant occurredAt) {
        List<Change> changes = new ArrayList<>();

        for (TableRecord table : after.tables().values()) {
            TableRecord previous = before.tables().get(table.id());
            if (previous == null) {
                changes.add(Change.table(DeltaType.TABLE_ADDED, TableView.of(table, after)));
            } else if (!previous.equals(table)) {
                changes.add(Change.table(DeltaType.TABLE_UPDATED, TableView.of(table, after)));
            }
        }

        for (GuestRecord guest : before.guests().values()) {
            if (!after.guests().containsKey(guest.id())) {
                changes.add(Change.guest(DeltaType.GUEST_REMOVED, GuestView.of(guest, before), null));
            }
        }

        for (GuestRecord guest : after.guests().values()) {
            if (!before.guests().containsKey(guest.id())) {
                changes.add(Change.guest(DeltaType.GUEST_ADDED, GuestView.of(guest, after), null));
            }
        }

        for (GuestRecord guest : after.guests().values()) {
            GuestRecord previous = before.guests().get(guest.id());
            if (previous == null || previous.equals(guest)) {
                continue;
            }
            GuestView view = GuestView.of(guest, after);
            if (!previous.sameSeat(guest)) {
                changes.add(Change.guest(DeltaType.SEATING_CHANGED, view, previous.tableId()));
            }
            if (!previous.sameDetails(guest)) {
                changes.add(Change.guest(DeltaType.GUEST_UPDATED, view, null));
            }
            if (!previous.sameCheckIn(guest)) {
                DeltaType type = guest.isCheckedIn() ? DeltaType.CHECKED_IN : DeltaType.CHECK_IN_REVERTED;
                changes.add(Change.guest(type, view, null));
            }
        }

        for (TableRecord table : before.tables().values()) {
            if (!after.tables().containsKey(table.id())) {
                // nobody can sit at a removed table, so occupancy comes from the new state
                changes.add(Change.table(DeltaType.TABLE_REMOVED, TableView.of(table, after)));
            }
        }

        List<Delta> deltas = new ArrayList<>(changes.size());
        long sequence = before.sequence();
        for (Change change : changes) {
            deltas.add(new Delta(before.eventId(), ++sequence, change.type(), occurredAt,
                    change.guest(), change.table(), change.previousTableId()));
        }
        return deltas;
    }

    private record Change(DeltaType type, GuestView guest, TableView table, Long previousTableId) {

        static Change table(DeltaType type, TableView table) {
            return new Change(type, null, table, null);
        }

        static Change guest(DeltaType type, GuestView guest, Long previousTableId) {
            return new Change(type, guest, null, previousTableId);
        }
    }
}
