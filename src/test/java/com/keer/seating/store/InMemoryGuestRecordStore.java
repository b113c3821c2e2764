package com.keer.seating.store;

import com.keer.seating.common.exception.ConflictException;
import com.keer.seating.common.exception.NotFoundException;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed store with the same commit contract as the JPA store.
 */
public class InMemoryGuestRecordStore implements GuestRecordStore {

    private final Map<Long, SeatingState> events = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong(100);
    private final AtomicInteger commits = new AtomicInteger();
    private final AtomicInteger loads = new AtomicInteger();

    public void createEvent(long eventId, String name) {
        events.put(eventId, new SeatingState(eventId, name, 0, List.of(), List.of()));
    }

    public SeatingState current(long eventId) {
        return events.get(eventId);
    }

    public int commitCount() {
        return commits.get();
    }

    public int loadCount() {
        return loads.get();
    }

    @Override
    public SeatingState load(long eventId) {
        loads.incrementAndGet();
        SeatingState state = events.get(eventId);
        if (state == null) {
            throw NotFoundException.event(eventId);
        }
        return state;
    }

    @Override
    public synchronized Map<Long, Long> commit(SeatingChangeSet changes) {
        SeatingState current = events.get(changes.eventId());
        if (current == null) {
            throw NotFoundException.event(changes.eventId());
        }
        if (current.sequence() != changes.expectedSequence()) {
            throw new ConflictException("Event " + changes.eventId() + " is no longer at sequence " + changes.expectedSequence());
        }

        Map<Long, Long> assigned = new HashMap<>();
        Map<Long, TableRecord> tables = new LinkedHashMap<>(current.tables());
        Map<Long, GuestRecord> guests = new LinkedHashMap<>(current.guests());

        changes.removedGuestIds().forEach(guests::remove);
        for (TableRecord table : changes.createdTables()) {
            long id = ids.incrementAndGet();
            assigned.put(table.id(), id);
            tables.put(id, new TableRecord(id, table.label(), table.capacity()));
        }
        changes.updatedTables().forEach(t -> tables.put(t.id(), t));
        for (GuestRecord guest : changes.createdGuests()) {
            long id = ids.incrementAndGet();
            assigned.put(guest.id(), id);
            guests.put(id, guest.withIds(id, resolve(guest.tableId(), assigned)));
        }
        for (GuestRecord guest : changes.updatedGuests()) {
            guests.put(guest.id(), guest.withIds(guest.id(), resolve(guest.tableId(), assigned)));
        }
        changes.removedTableIds().forEach(tables::remove);

        events.put(changes.eventId(), new SeatingState(changes.eventId(), current.eventName(), changes.nextSequence(),
                tables.values(), guests.values()));
        commits.incrementAndGet();
        return assigned;
    }

    @Override
    public Optional<Long> findEventIdByToken(String lookupToken) {
        return events.values().stream()
                .filter(state -> state.guests().values().stream().anyMatch(g -> lookupToken.equals(g.lookupToken())))
                .map(SeatingState::eventId)
                .findFirst();
    }

    private static Long resolve(Long tableId, Map<Long, Long> assigned) {
        return tableId != null && tableId < 0 ? assigned.get(tableId) : tableId;
    }
}
