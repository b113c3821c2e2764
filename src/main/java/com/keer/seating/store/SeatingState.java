package com.keer.seating.store;

import com.keer.seating.seating.validation.SeatingKeys;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of one event's tables and guests at a committed sequence.
 */
public final class SeatingState {

    private final long eventId;
    private final String eventName;
    private final long sequence;
    private final Map<Long, TableRecord> tables;
    private final Map<Long, GuestRecord> guests;

    public SeatingState(long eventId, String eventName, long sequence,
                        Collection<TableRecord> tables, Collection<GuestRecord> guests) {
        this.eventId = eventId;
        this.eventName = eventName;
        this.sequence = sequence;
        Map<Long, TableRecord> tableMap = new LinkedHashMap<>();
        tables.forEach(t -> tableMap.put(t.id(), t));
        Map<Long, GuestRecord> guestMap = new LinkedHashMap<>();
        guests.forEach(g -> guestMap.put(g.id(), g));
        this.tables = Collections.unmodifiableMap(tableMap);
        this.guests = Collections.unmodifiableMap(guestMap);
    }

    public long eventId() {
        return eventId;
    }

    public String eventName() {
        return eventName;
    }

    public long sequence() {
        return sequence;
    }

    public Map<Long, TableRecord> tables() {
        return tables;
    }

    public Map<Long, GuestRecord> guests() {
        return guests;
    }

    public Optional<GuestRecord> guest(long guestId) {
        return Optional.ofNullable(guests.get(guestId));
    }

    public Optional<TableRecord> table(Long tableId) {
        return tableId == null ? Optional.empty() : Optional.ofNullable(tables.get(tableId));
    }

    public Optional<TableRecord> tableByLabel(String label) {
        String key = SeatingKeys.tableKey(label);
        return tables.values().stream()
                .filter(t -> SeatingKeys.tableKey(t.label()).equals(key))
                .findFirst();
    }

    public String tableLabel(Long tableId) {
        return table(tableId).map(TableRecord::label).orElse(null);
    }

    public int occupancy(long tableId) {
        return (int) guests.values().stream()
                .filter(g -> g.tableId() != null && g.tableId() == tableId)
                .count();
    }

    public long checkedInCount(long tableId) {
        return guests.values().stream()
                .filter(g -> g.tableId() != null && g.tableId() == tableId && g.isCheckedIn())
                .count();
    }

    public SeatingState with(Collection<TableRecord> newTables, Collection<GuestRecord> newGuests) {
        return new SeatingState(eventId, eventName, sequence, newTables, newGuests);
    }

    public SeatingState atSequence(long newSequence) {
        return new SeatingState(eventId, eventName, newSequence, tables.values(), guests.values());
    }
}
