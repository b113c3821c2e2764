package com.keer.seating.seating.service;

import com.keer.seating.auth.AdminGrant;
import com.keer.seating.broadcast.model.Delta;
import com.keer.seating.broadcast.service.EventBroadcaster;
import com.keer.seating.common.exception.ConflictException;
import com.keer.seating.common.exception.ErrorCode;
import com.keer.seating.common.exception.ImportCancelledException;
import com.keer.seating.common.exception.NotFoundException;
import com.keer.seating.common.exception.ValidationException;
import com.keer.seating.event.model.Event;
import com.keer.seating.seating.dto.AssignmentResult;
import com.keer.seating.seating.dto.CheckInResult;
import com.keer.seating.seating.dto.GuestDetails;
import com.keer.seating.seating.dto.GuestLookupView;
import com.keer.seating.seating.dto.GuestRequest;
import com.keer.seating.seating.dto.GuestUpdateRequest;
import com.keer.seating.seating.dto.GuestView;
import com.keer.seating.seating.dto.ImportCommand;
import com.keer.seating.seating.dto.ImportMode;
import com.keer.seating.seating.dto.ImportResult;
import com.keer.seating.seating.dto.ImportRow;
import com.keer.seating.seating.dto.RowOutcome;
import com.keer.seating.seating.dto.SeatingExport;
import com.keer.seating.seating.dto.SeatingSnapshot;
import com.keer.seating.seating.dto.TableSpec;
import com.keer.seating.seating.dto.TableUpdateRequest;
import com.keer.seating.seating.dto.TableView;
import com.keer.seating.seating.validation.AssignmentValidator;
import com.keer.seating.seating.validation.Placement;
import com.keer.seating.seating.validation.ProposedSeating;
import com.keer.seating.seating.validation.Rejection;
import com.keer.seating.seating.validation.RejectionReason;
import com.keer.seating.seating.validation.SeatingKeys;
import com.keer.seating.store.GuestRecord;
import com.keer.seating.store.GuestRecordStore;
import com.keer.seating.store.SeatingChangeSet;
import com.keer.seating.store.SeatingState;
import com.keer.seating.store.TableRecord;
import com.keer.seating.token.service.LookupTokenIssuer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Single writer of seating truth.
 * <p>
 * Every write runs under the event's lock: load the committed state, build the proposed state,
 * validate it, commit the difference together with the advanced sequence, then hand the deltas to
 * the broadcaster. Reads take no lock.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SeatingEngine {

    public static final int DEFAULT_TABLE_CAPACITY = Event.TABLE_CAPACITY_LIMIT;

    private final GuestRecordStore store;
    private final AssignmentValidator validator;
    private final EventBroadcaster broadcaster;
    private final LookupTokenIssuer tokenIssuer;
    private final EventLockRegistry locks;
    private final Clock clock;

    // ---- writes ----

    /**
     * Applies a batch of rows as one unit. Cancellable through thread interruption until the
     * commit starts.
     *
     * @throws ValidationException       if the resulting state would break an invariant
     * @throws ImportCancelledException if the calling thread was interrupted before commit
     */
    public ImportResult importSeating(AdminGrant grant, long eventId, ImportCommand command) {
        Objects.requireNonNull(grant, "admin grant");
        log.info("Import into event {} requested by {}: mode={}, rows={}", eventId, grant.principal(),
                command.effectiveMode(), command.getRows() == null ? 0 : command.getRows().size());
        return write(eventId, "Import", true, before -> planImport(before, command));
    }

    public AssignmentResult assignGuestToTable(AdminGrant grant, long eventId, long guestId, Long tableId) {
        return assignGuestToTable(grant, eventId, guestId, tableId, null);
    }

    /**
     * Seats the guest at {@code tableId}, optionally on a numbered seat. A null table unassigns
     * the guest and drops the seat.
     *
     * @throws ValidationException with {@link RejectionReason#DUPLICATE_SEAT} if another guest holds the seat
     */
    public AssignmentResult assignGuestToTable(AdminGrant grant, long eventId, long guestId, Long tableId,
                                               Integer seatNumber) {
        Objects.requireNonNull(grant, "admin grant");
        return write(eventId, "Seat assignment", false, before -> {
            GuestRecord guest = before.guest(guestId).orElseThrow(() -> NotFoundException.guest(guestId));
            requireTable(before, tableId);

            GuestRecord seated = guest.seatedAt(tableId, seatNumber);
            SeatingState after = putGuest(before, seated);
            validate(propose(before, after, Set.of(guestId)));

            boolean changed = !guest.sameSeat(seated);
            return new Plan<>(after, (state, ids) -> new AssignmentResult(
                    GuestView.of(state.guest(guestId).orElseThrow(), state), guest.tableId(), changed, state.sequence()));
        });
    }

    /**
     * Idempotent: the first call stamps the arrival time, later calls report it unchanged.
     * Concurrent calls agree on {@link CheckInResult#checkedInAt()} and the sequence; only the
     * call that stamped the time gets {@code alreadyCheckedIn == false}.
     */
    public CheckInResult checkIn(long eventId, long guestId) {
        return write(eventId, "Check-in", false, before -> {
            GuestRecord guest = before.guest(guestId).orElseThrow(() -> NotFoundException.guest(guestId));
            if (guest.isCheckedIn()) {
                return new Plan<>(before, (state, ids) ->
                        new CheckInResult(guestId, guest.checkedInAt(), true, state.sequence()));
            }
            Instant arrivedAt = now();
            return new Plan<>(putGuest(before, guest.checkedIn(arrivedAt)), (state, ids) ->
                    new CheckInResult(guestId, arrivedAt, false, state.sequence()));
        });
    }

    public CheckInResult checkInByToken(String token) {
        GuestLookupView lookup = lookupByToken(token);
        return checkIn(lookup.eventId(), lookup.guest().id());
    }

    public GuestDetails revertCheckIn(AdminGrant grant, long eventId, long guestId) {
        Objects.requireNonNull(grant, "admin grant");
        return write(eventId, "Check-in revert", false, before -> {
            GuestRecord guest = before.guest(guestId).orElseThrow(() -> NotFoundException.guest(guestId));
            SeatingState after = guest.isCheckedIn() ? putGuest(before, guest.notArrived()) : before;
            return new Plan<>(after, (state, ids) -> details(state.guest(guestId).orElseThrow(), state));
        });
    }

    public GuestDetails addGuest(AdminGrant grant, long eventId, GuestRequest request) {
        Objects.requireNonNull(grant, "admin grant");
        return write(eventId, "Guest add", false, before -> {
            requireTable(before, request.getTableId());
            Placeholders placeholders = new Placeholders();
            GuestRecord guest = GuestRecord.arriving(placeholders.next(), trim(request.getName()),
                    trimToNull(request.getContact()), trimToNull(request.getDietaryNotes()), request.getTableId(),
                    request.getSeatNumber(), null);

            SeatingState after = putGuest(before, guest);
            validate(propose(before, after, Set.of(guest.id())));
            requireUniqueKey(before, guest.name(), guest.contact(), null);

            GuestRecord issued = guest.withLookupToken(tokenIssuer.mint());
            return new Plan<>(putGuest(before, issued), (state, ids) ->
                    details(state.guest(ids.get(issued.id())).orElseThrow(), state));
        });
    }

    public GuestDetails updateGuest(AdminGrant grant, long eventId, long guestId, GuestUpdateRequest request) {
        Objects.requireNonNull(grant, "admin grant");
        return write(eventId, "Guest update", false, before -> {
            GuestRecord guest = before.guest(guestId).orElseThrow(() -> NotFoundException.guest(guestId));
            GuestRecord updated = guest.withDetails(
                    request.getName() != null ? trim(request.getName()) : guest.name(),
                    request.getContact() != null ? trimToNull(request.getContact()) : guest.contact(),
                    request.getDietaryNotes() != null ? trimToNull(request.getDietaryNotes()) : guest.dietaryNotes());

            SeatingState after = putGuest(before, updated);
            validate(propose(before, after, Set.of(guestId)));
            requireUniqueKey(before, updated.name(), updated.contact(), guestId);
            return new Plan<>(after, (state, ids) -> details(state.guest(guestId).orElseThrow(), state));
        });
    }

    /**
     * Removes the guest. Their lookup token stays registered and is never handed out again.
     *
     * @return committed sequence after the removal
     */
    public long removeGuest(AdminGrant grant, long eventId, long guestId) {
        Objects.requireNonNull(grant, "admin grant");
        return write(eventId, "Guest removal", false, before -> {
            before.guest(guestId).orElseThrow(() -> NotFoundException.guest(guestId));
            List<GuestRecord> guests = before.guests().values().stream()
                    .filter(g -> g.id() != guestId)
                    .toList();
            return new Plan<>(before.with(before.tables().values(), guests), (state, ids) -> state.sequence());
        });
    }

    public TableView defineTable(AdminGrant grant, long eventId, TableSpec spec) {
        Objects.requireNonNull(grant, "admin grant");
        return write(eventId, "Table definition", false, before -> {
            requireTableLabel(spec.getLabel());
            String label = spec.getLabel().trim();
            if (before.tableByLabel(label).isPresent()) {
                throw new ConflictException("Table '" + label + "' already exists in event " + eventId);
            }
            int capacity = spec.getCapacity() != null ? spec.getCapacity() : DEFAULT_TABLE_CAPACITY;
            TableRecord table = new TableRecord(new Placeholders().next(), label, capacity);

            SeatingState after = putTable(before, table);
            validate(propose(before, after, Set.of()));
            return new Plan<>(after, (state, ids) ->
                    TableView.of(state.table(ids.get(table.id())).orElseThrow(), state));
        });
    }

    /**
     * Renames and/or resizes a table. Shrinking below the current occupancy is rejected.
     */
    public TableView resizeTable(AdminGrant grant, long eventId, long tableId, TableUpdateRequest request) {
        Objects.requireNonNull(grant, "admin grant");
        return write(eventId, "Table update", false, before -> {
            TableRecord table = before.table(tableId).orElseThrow(() -> NotFoundException.table(tableId));
            String label = table.label();
            if (request.getLabel() != null) {
                requireTableLabel(request.getLabel());
                label = request.getLabel().trim();
                boolean taken = before.tableByLabel(label).filter(t -> t.id() != tableId).isPresent();
                if (taken) {
                    throw new ConflictException("Table '" + label + "' already exists in event " + eventId);
                }
            }
            int capacity = request.getCapacity() != null ? request.getCapacity() : table.capacity();

            SeatingState after = putTable(before, new TableRecord(tableId, label, capacity));
            validate(propose(before, after, Set.of()));
            return new Plan<>(after, (state, ids) -> TableView.of(state.table(tableId).orElseThrow(), state));
        });
    }

    /**
     * @return committed sequence after the removal
     * @throws ValidationException with {@link RejectionReason#ORPHAN_TABLE_REFERENCE} while guests sit there
     */
    public long removeTable(AdminGrant grant, long eventId, long tableId) {
        Objects.requireNonNull(grant, "admin grant");
        return write(eventId, "Table removal", false, before -> {
            before.table(tableId).orElseThrow(() -> NotFoundException.table(tableId));
            List<TableRecord> tables = before.tables().values().stream()
                    .filter(t -> t.id() != tableId)
                    .toList();
            SeatingState after = before.with(tables, before.guests().values());
            validate(propose(before, after, Set.of()));
            return new Plan<>(after, (state, ids) -> state.sequence());
        });
    }

    // ---- reads ----

    /**
     * Resolves a guest's lookup token. Unsigned or forged tokens are rejected before the store is read.
     */
    public GuestLookupView lookupByToken(String token) {
        if (!tokenIssuer.verify(token)) {
            log.debug("Rejected lookup with an unsigned token");
            throw NotFoundException.token();
        }
        long eventId = store.findEventIdByToken(token).orElseThrow(NotFoundException::token);
        SeatingState state = store.load(eventId);
        GuestRecord guest = state.guests().values().stream()
                .filter(g -> token.equals(g.lookupToken()))
                .findFirst()
                .orElseThrow(NotFoundException::token);

        TableView table = state.table(guest.tableId()).map(t -> TableView.of(t, state)).orElse(null);
        List<String> tablemates = guest.tableId() == null ? List.of() : state.guests().values().stream()
                .filter(g -> g.id() != guest.id() && guest.tableId().equals(g.tableId()))
                .sorted(Comparator.comparing(GuestRecord::seatNumber, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(GuestRecord::name)
                .toList();
        return new GuestLookupView(eventId, state.eventName(), GuestView.of(guest, state), table, tablemates,
                state.sequence());
    }

    public SeatingSnapshot snapshot(long eventId) {
        return SeatingSnapshot.of(store.load(eventId));
    }

    /**
     * Exports the committed state in the shape {@link #importSeating} accepts.
     */
    public SeatingExport export(AdminGrant grant, long eventId) {
        Objects.requireNonNull(grant, "admin grant");
        SeatingState state = store.load(eventId);
        List<TableSpec> tables = state.tables().values().stream()
                .map(t -> new TableSpec(t.label(), t.capacity()))
                .toList();
        List<ImportRow> rows = state.guests().values().stream()
                .map(g -> ImportRow.builder()
                        .guestName(g.name())
                        .tableLabel(state.tableLabel(g.tableId()))
                        .seatNumber(g.seatNumber())
                        .dietaryNotes(g.dietaryNotes())
                        .contact(g.contact())
                        .checkedIn(g.isCheckedIn())
                        .checkedInAt(g.checkedInAt())
                        .build())
                .toList();
        log.info("Exported event {} at sequence {} for {}", eventId, state.sequence(), grant.principal());
        return new SeatingExport(eventId, state.eventName(), state.sequence(), tables, rows);
    }

    // ---- import planning ----

    private Plan<ImportResult> planImport(SeatingState before, ImportCommand command) {
        long eventId = before.eventId();
        ImportMode mode = command.effectiveMode();
        List<ImportRow> rows = orEmpty(command.getRows());
        List<TableSpec> specs = orEmpty(command.getTables());
        Placeholders placeholders = new Placeholders();
        Instant importedAt = now();

        checkTableSpecs(specs);

        Map<String, TableRecord> tables = new LinkedHashMap<>();
        before.tables().values().forEach(t -> tables.put(SeatingKeys.tableKey(t.label()), t));
        Set<String> referenced = new HashSet<>();
        for (TableSpec spec : specs) {
            String key = SeatingKeys.tableKey(spec.getLabel());
            referenced.add(key);
            TableRecord existing = tables.get(key);
            tables.put(key, existing != null
                    ? existing.withCapacity(spec.getCapacity())
                    : new TableRecord(placeholders.next(), spec.getLabel().trim(), spec.getCapacity()));
        }

        Map<String, String> removed = new LinkedHashMap<>();
        for (String label : orEmpty(command.getRemoveTables())) {
            if (SeatingKeys.isBlank(label)) {
                continue;
            }
            String key = SeatingKeys.tableKey(label);
            TableRecord existing = tables.remove(key);
            removed.put(key, existing != null ? existing.label() : label.trim());
        }

        Map<String, GuestRecord> existingByKey = new LinkedHashMap<>();
        before.guests().values().forEach(g -> existingByKey.putIfAbsent(SeatingKeys.naturalKey(g.name(), g.contact()), g));

        Map<Long, GuestRecord> guests = new LinkedHashMap<>();
        if (mode == ImportMode.UPSERT) {
            guests.putAll(before.guests());
        }
        Set<Long> matched = new HashSet<>();
        List<Placement> placements = new ArrayList<>();
        List<PendingOutcome> outcomes = new ArrayList<>();

        for (int i = 0; i < rows.size(); i++) {
            ImportRow row = rows.get(i);
            if (row == null || SeatingKeys.isBlank(row.getGuestName())) {
                placements.add(Placement.batchRow(i, row == null ? null : row.getGuestName(), null, null, null));
                continue;
            }

            String label = trimToNull(row.getTableLabel());
            Long tableId = null;
            if (label != null) {
                String key = SeatingKeys.tableKey(label);
                referenced.add(key);
                TableRecord table = tables.get(key);
                if (table == null && !removed.containsKey(key) && command.createsMissingTables()) {
                    table = new TableRecord(placeholders.next(), label, DEFAULT_TABLE_CAPACITY);
                    tables.put(key, table);
                }
                if (table != null) {
                    tableId = table.id();
                    label = table.label();
                }
            }

            String name = row.getGuestName().trim();
            String contact = trimToNull(row.getContact());
            Integer seatNumber = tableId != null ? row.getSeatNumber() : null;
            GuestRecord existing = existingByKey.get(SeatingKeys.naturalKey(name, contact));
            GuestRecord next;
            RowOutcome.Outcome outcome;
            if (existing != null) {
                matched.add(existing.id());
                next = applyCheckIn(existing.withDetails(name, contact, trimToNull(row.getDietaryNotes()))
                        .seatedAt(tableId, seatNumber), row, importedAt);
                outcome = next.equals(existing) ? RowOutcome.Outcome.UNCHANGED : RowOutcome.Outcome.UPDATED;
            } else {
                next = applyCheckIn(GuestRecord.arriving(placeholders.next(), name, contact,
                        trimToNull(row.getDietaryNotes()), tableId, seatNumber, null), row, importedAt);
                outcome = RowOutcome.Outcome.ADDED;
            }
            guests.put(next.id(), next);
            placements.add(Placement.batchRow(i, name, contact, label, row.getSeatNumber()));
            outcomes.add(new PendingOutcome(i, next.id(), outcome));
        }

        if (mode == ImportMode.REPLACE_ALL) {
            tables.keySet().retainAll(referenced);
        }

        ProposedSeating proposal = new ProposedSeating();
        tables.values().forEach(t -> proposal.table(t.label(), t.capacity()));
        removed.values().forEach(proposal::removeTable);
        placements.forEach(proposal::place);
        for (GuestRecord guest : guests.values()) {
            if (!guest.isNew() && !matched.contains(guest.id())) {
                proposal.place(Placement.unchanged(guest.name(), guest.contact(),
                        before.tableLabel(guest.tableId()), guest.seatNumber()));
            }
        }
        validate(proposal);
        checkCancelled(eventId);

        List<GuestRecord> finalGuests = new ArrayList<>(guests.size());
        for (GuestRecord guest : guests.values()) {
            if (guest.isNew()) {
                checkCancelled(eventId);
                finalGuests.add(guest.withLookupToken(tokenIssuer.mint()));
            } else {
                finalGuests.add(guest);
            }
        }
        checkCancelled(eventId);

        SeatingState after = before.with(tables.values(), finalGuests);
        int removedGuests = (int) before.guests().keySet().stream().filter(id -> !after.guests().containsKey(id)).count();
        int removedTables = (int) before.tables().keySet().stream().filter(id -> !after.tables().containsKey(id)).count();

        return new Plan<>(after, (state, ids) -> {
            List<RowOutcome> rowOutcomes = outcomes.stream()
                    .map(o -> new RowOutcome(o.row(), o.guestId() < 0 ? ids.get(o.guestId()) : o.guestId(), o.outcome()))
                    .toList();
            return ImportResult.builder()
                    .eventId(eventId)
                    .mode(mode)
                    .sequence(state.sequence())
                    .added(count(rowOutcomes, RowOutcome.Outcome.ADDED))
                    .updated(count(rowOutcomes, RowOutcome.Outcome.UPDATED))
                    .unchanged(count(rowOutcomes, RowOutcome.Outcome.UNCHANGED))
                    .removedGuests(removedGuests)
                    .removedTables(removedTables)
                    .rows(rowOutcomes)
                    .build();
        });
    }

    private static GuestRecord applyCheckIn(GuestRecord guest, ImportRow row, Instant importedAt) {
        if (Boolean.TRUE.equals(row.getCheckedIn())) {
            if (row.getCheckedInAt() != null) {
                return guest.checkedIn(row.getCheckedInAt().truncatedTo(ChronoUnit.MICROS));
            }
            return guest.isCheckedIn() ? guest : guest.checkedIn(importedAt);
        }
        if (Boolean.FALSE.equals(row.getCheckedIn())) {
            return guest.notArrived();
        }
        return guest;
    }

    private static void checkTableSpecs(List<TableSpec> specs) {
        List<String> malformed = new ArrayList<>();
        for (int i = 0; i < specs.size(); i++) {
            TableSpec spec = specs.get(i);
            if (spec == null || SeatingKeys.isBlank(spec.getLabel()) || spec.getCapacity() == null) {
                malformed.add("table spec " + i);
            }
        }
        if (!malformed.isEmpty()) {
            throw new ValidationException(new Rejection(RejectionReason.MALFORMED_ROW, List.of(), malformed));
        }
    }

    private static int count(List<RowOutcome> outcomes, RowOutcome.Outcome outcome) {
        return (int) outcomes.stream().filter(o -> o.outcome() == outcome).count();
    }

    // ---- write pipeline ----

    private <R> R write(long eventId, String operation, boolean cancellable, Function<SeatingState, Plan<R>> planner) {
        ReentrantLock lock;
        try {
            lock = locks.acquire(eventId);
        } catch (InterruptedException e) {
            if (cancellable) {
                throw new ImportCancelledException(eventId);
            }
            Thread.currentThread().interrupt();
            throw new ConflictException(ErrorCode.EVENT_BUSY, "Interrupted while waiting for event " + eventId);
        }

        try {
            SeatingState before = store.load(eventId);
            Plan<R> plan = planner.apply(before);
            if (cancellable) {
                checkCancelled(eventId);
            }

            Instant occurredAt = now();
            List<Delta> planned = DeltaPlanner.plan(before, plan.after(), occurredAt);
            SeatingChangeSet changes = SeatingChangeSet.between(before, plan.after(), before.sequence() + planned.size());
            if (changes.isEmpty()) {
                log.debug("{} on event {} changed nothing", operation, eventId);
                return plan.result().apply(before, Map.of());
            }

            Map<Long, Long> assignedIds = store.commit(changes);
            SeatingState committed = resolve(plan.after(), assignedIds).atSequence(changes.nextSequence());
            List<Delta> deltas = DeltaPlanner.plan(before, committed, occurredAt);
            broadcaster.publish(eventId, deltas);

            log.info("{} committed on event {}: sequence {} -> {}", operation, eventId,
                    before.sequence(), changes.nextSequence());
            return plan.result().apply(committed, assignedIds);
        } finally {
            lock.unlock();
        }
    }

    private void validate(ProposedSeating proposal) {
        validator.validate(proposal).rejection().ifPresent(rejection -> {
            log.warn("Rejected seating change: {}", rejection.describe());
            throw new ValidationException(rejection);
        });
    }

    /**
     * Builds the validator's view of {@code after}. Tables dropped since {@code before} are
     * scheduled removals, so guests still pointing at them surface as orphans.
     */
    private static ProposedSeating propose(SeatingState before, SeatingState after, Set<Long> edited) {
        ProposedSeating proposal = new ProposedSeating();
        after.tables().values().forEach(t -> proposal.table(t.label(), t.capacity()));
        before.tables().values().stream()
                .filter(t -> !after.tables().containsKey(t.id()))
                .forEach(t -> proposal.removeTable(t.label()));

        for (GuestRecord guest : after.guests().values()) {
            String label = after.table(guest.tableId())
                    .or(() -> before.table(guest.tableId()))
                    .map(TableRecord::label)
                    .orElse(null);
            proposal.place(edited.contains(guest.id())
                    ? Placement.edited(guest.name(), guest.contact(), label, guest.seatNumber())
                    : Placement.unchanged(guest.name(), guest.contact(), label, guest.seatNumber()));
        }
        return proposal;
    }

    private static void requireUniqueKey(SeatingState state, String name, String contact, Long exceptGuestId) {
        String key = SeatingKeys.naturalKey(name, contact);
        boolean duplicate = state.guests().values().stream()
                .filter(g -> exceptGuestId == null || g.id() != exceptGuestId)
                .anyMatch(g -> SeatingKeys.naturalKey(g.name(), g.contact()).equals(key));
        if (duplicate) {
            throw new ValidationException(new Rejection(RejectionReason.DUPLICATE_GUEST_KEY, List.of(), List.of(name)));
        }
    }

    private static void requireTable(SeatingState state, Long tableId) {
        if (tableId != null && state.table(tableId).isEmpty()) {
            throw NotFoundException.table(tableId);
        }
    }

    private static void requireTableLabel(String label) {
        if (SeatingKeys.isBlank(label)) {
            throw new ValidationException(new Rejection(RejectionReason.MALFORMED_ROW, List.of(), List.of("table")));
        }
    }

    private static void checkCancelled(long eventId) {
        if (Thread.interrupted()) {
            throw new ImportCancelledException(eventId);
        }
    }

    private static SeatingState resolve(SeatingState state, Map<Long, Long> assignedIds) {
        if (assignedIds.isEmpty()) {
            return state;
        }
        List<TableRecord> tables = state.tables().values().stream()
                .map(t -> t.isNew() ? new TableRecord(assignedIds.get(t.id()), t.label(), t.capacity()) : t)
                .toList();
        List<GuestRecord> guests = state.guests().values().stream()
                .map(g -> {
                    long id = g.isNew() ? assignedIds.get(g.id()) : g.id();
                    Long tableId = g.tableId() != null && g.tableId() < 0 ? assignedIds.get(g.tableId()) : g.tableId();
                    return g.withIds(id, tableId);
                })
                .toList();
        return state.with(tables, guests);
    }

    private static SeatingState putGuest(SeatingState state, GuestRecord guest) {
        Map<Long, GuestRecord> guests = new LinkedHashMap<>(state.guests());
        guests.put(guest.id(), guest);
        return state.with(state.tables().values(), guests.values());
    }

    private static SeatingState putTable(SeatingState state, TableRecord table) {
        Map<Long, TableRecord> tables = new LinkedHashMap<>(state.tables());
        tables.put(table.id(), table);
        return state.with(tables.values(), state.guests().values());
    }

    private GuestDetails details(GuestRecord guest, SeatingState state) {
        return GuestDetails.builder()
                .id(guest.id())
                .name(guest.name())
                .contact(guest.contact())
                .dietaryNotes(guest.dietaryNotes())
                .tableId(guest.tableId())
                .tableLabel(state.tableLabel(guest.tableId()))
                .seatNumber(guest.seatNumber())
                .status(guest.status())
                .checkedInAt(guest.checkedInAt())
                .lookupToken(guest.lookupToken())
                .portalLink(guest.lookupToken() != null ? tokenIssuer.portalLink(guest.lookupToken()) : null)
                .build();
    }

    // the store keeps microseconds, so timestamps are cut there before they reach any state
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }

    private static String trimToNull(String value) {
        return SeatingKeys.isBlank(value) ? null : value.trim();
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private record Plan<R>(SeatingState after, BiFunction<SeatingState, Map<Long, Long>, R> result) {
    }

    private record PendingOutcome(int row, long guestId, RowOutcome.Outcome outcome) {
    }

    /**
     * Negative ids for rows created within one write; tables and guests share the sequence so
     * the store's id map stays unambiguous.
     */
    private static final class Placeholders {

        private long last;

        long next() {
            return --last;
        }
    }
}
