package com.keer.seating.store;

import com.keer.seating.common.exception.ConflictException;
import com.keer.seating.common.exception.NotFoundException;
import com.keer.seating.common.exception.StorageUnavailableException;
import com.keer.seating.config.SeatingProperties;
import com.keer.seating.event.model.Event;
import com.keer.seating.event.repository.EventRepository;
import com.keer.seating.guest.model.Guest;
import com.keer.seating.guest.model.SeatingTable;
import com.keer.seating.guest.repository.GuestRepository;
import com.keer.seating.guest.repository.SeatingTableRepository;
import com.keer.seating.seating.validation.SeatingKeys;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

@Component
@Slf4j
public class JpaGuestRecordStore implements GuestRecordStore {

    private final EventRepository eventRepository;
    private final SeatingTableRepository tableRepository;
    private final GuestRepository guestRepository;
    private final Retry storeRetry;
    private final Clock clock;
    private final TransactionTemplate readTemplate;
    private final TransactionTemplate writeTemplate;

    public JpaGuestRecordStore(EventRepository eventRepository,
                               SeatingTableRepository tableRepository,
                               GuestRepository guestRepository,
                               PlatformTransactionManager transactionManager,
                               Retry storeRetry,
                               SeatingProperties properties,
                               Clock clock) {
        this.eventRepository = eventRepository;
        this.tableRepository = tableRepository;
        this.guestRepository = guestRepository;
        this.storeRetry = storeRetry;
        this.clock = clock;

        int timeoutSeconds = (int) Math.max(1, properties.getStore().getCommitTimeout().toSeconds());

        this.readTemplate = new TransactionTemplate(transactionManager);
        readTemplate.setReadOnly(true);
        // tables, guests and sequence must come from the same snapshot
        readTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
        readTemplate.setTimeout(timeoutSeconds);

        this.writeTemplate = new TransactionTemplate(transactionManager);
        writeTemplate.setTimeout(timeoutSeconds);
    }

    @Override
    public SeatingState load(long eventId) {
        return withRetry("load event " + eventId, () -> readTemplate.execute(status -> {
            Event event = eventRepository.findById(eventId)
                    .orElseThrow(() -> NotFoundException.event(eventId));

            List<TableRecord> tables = tableRepository.findByEventIdOrderByIdAsc(eventId).stream()
                    .map(t -> new TableRecord(t.getId(), t.getLabel(), t.getCapacity()))
                    .toList();
            List<GuestRecord> guests = guestRepository.findByEventIdOrderByIdAsc(eventId).stream()
                    .map(JpaGuestRecordStore::toRecord)
                    .toList();

            return new SeatingState(eventId, event.getName(), event.getLastSequence(), tables, guests);
        }));
    }

    @Override
    public Map<Long, Long> commit(SeatingChangeSet changes) {
        try {
            return withRetry("commit event " + changes.eventId(),
                    () -> writeTemplate.execute(status -> apply(changes)));
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Commit for event " + changes.eventId() + " violated a store constraint", e);
        }
    }

    @Override
    public Optional<Long> findEventIdByToken(String lookupToken) {
        return withRetry("token lookup", () -> readTemplate.execute(status ->
                guestRepository.findByLookupToken(lookupToken).map(g -> g.getEvent().getId())));
    }

    private Map<Long, Long> apply(SeatingChangeSet changes) {
        long eventId = changes.eventId();
        int advanced = eventRepository.advanceSequence(eventId, changes.expectedSequence(), changes.nextSequence());
        if (advanced == 0) {
            if (!eventRepository.existsById(eventId)) {
                throw NotFoundException.event(eventId);
            }
            throw new ConflictException("Event " + eventId + " is no longer at sequence " + changes.expectedSequence());
        }

        Event event = eventRepository.getReferenceById(eventId);
        Map<Long, Long> assignedIds = new HashMap<>();

        if (!changes.removedGuestIds().isEmpty()) {
            guestRepository.deleteAllByIdInBatch(changes.removedGuestIds());
            guestRepository.flush();
        }

        for (TableRecord record : changes.createdTables()) {
            SeatingTable table = new SeatingTable();
            table.setEvent(event);
            copy(record, table);
            assignedIds.put(record.id(), tableRepository.save(table).getId());
        }
        for (TableRecord record : changes.updatedTables()) {
            SeatingTable table = tableRepository.findById(record.id())
                    .orElseThrow(() -> new ConflictException("Table " + record.id() + " disappeared during commit"));
            copy(record, table);
        }
        tableRepository.flush();

        for (GuestRecord record : changes.createdGuests()) {
            Guest guest = new Guest();
            guest.setEvent(event);
            copy(record, guest, assignedIds);
            assignedIds.put(record.id(), guestRepository.save(guest).getId());
        }
        for (GuestRecord record : changes.updatedGuests()) {
            Guest guest = guestRepository.findById(record.id())
                    .orElseThrow(() -> new ConflictException("Guest " + record.id() + " disappeared during commit"));
            copy(record, guest, assignedIds);
        }
        guestRepository.flush();

        if (!changes.removedTableIds().isEmpty()) {
            tableRepository.deleteAllByIdInBatch(changes.removedTableIds());
        }

        log.debug("Committed event {} sequence {} -> {}", eventId, changes.expectedSequence(), changes.nextSequence());
        return assignedIds;
    }

    private void copy(TableRecord record, SeatingTable table) {
        table.setLabel(record.label());
        table.setLabelKey(SeatingKeys.tableKey(record.label()));
        table.setCapacity(record.capacity());
    }

    private void copy(GuestRecord record, Guest guest, Map<Long, Long> assignedIds) {
        guest.setName(record.name());
        guest.setContact(record.contact());
        guest.setDietaryNotes(record.dietaryNotes());
        guest.setSeatNumber(record.seatNumber());
        guest.setStatus(record.status());
        guest.setCheckedInAt(record.checkedInAt());
        guest.setLookupToken(record.lookupToken());
        guest.setUpdatedAt(clock.instant());

        Long tableId = record.tableId();
        if (tableId == null) {
            guest.setTable(null);
        } else {
            long resolved = tableId < 0 ? assignedIds.get(tableId) : tableId;
            guest.setTable(tableRepository.getReferenceById(resolved));
        }
    }

    private <T> T withRetry(String operation, Supplier<T> action) {
        try {
            return Retry.decorateSupplier(storeRetry, action).get();
        } catch (RuntimeException e) {
            if (StoreRetryPolicy.isTransient(e)) {
                log.error("Store unavailable for {} after {} attempts", operation,
                        storeRetry.getRetryConfig().getMaxAttempts(), e);
                throw new StorageUnavailableException("Store unavailable for " + operation, e);
            }
            throw e;
        }
    }

    static GuestRecord toRecord(Guest guest) {
        Long tableId = guest.getTable() != null ? guest.getTable().getId() : null;
        return new GuestRecord(guest.getId(), guest.getName(), guest.getContact(), guest.getDietaryNotes(),
                tableId, guest.getSeatNumber(), guest.getStatus(), guest.getCheckedInAt(), guest.getLookupToken());
    }
}
