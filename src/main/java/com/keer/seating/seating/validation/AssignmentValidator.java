package com.keer.seating.seating.validation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks a proposed seating state against the event invariants before anything is committed.
 * <p>
 * Checks run in {@link RejectionReason} order and the first failing kind wins; the rejection
 * lists every offender of that kind. Occupancy is projected over the whole proposal, so a batch
 * is accepted or rejected as a unit.
 */
@Component
public class AssignmentValidator {

    public static final int MAX_TABLE_CAPACITY = 12;

    public ValidationResult validate(ProposedSeating proposal) {
        return checkTableCapacities(proposal)
                .or(() -> checkMalformedRows(proposal))
                .or(() -> checkDuplicateKeys(proposal))
                .or(() -> checkUnknownTables(proposal))
                .or(() -> checkDuplicateSeats(proposal))
                .or(() -> checkCapacity(proposal))
                .or(() -> checkOrphans(proposal))
                .map(ValidationResult::rejected)
                .orElseGet(ValidationResult::accepted);
    }

    private Optional<Rejection> checkTableCapacities(ProposedSeating proposal) {
        List<String> offending = new ArrayList<>();
        proposal.capacities().forEach((key, capacity) -> {
            if (capacity < 1 || capacity > MAX_TABLE_CAPACITY) {
                offending.add(proposal.label(key));
            }
        });
        return reject(RejectionReason.INVALID_TABLE_CAPACITY, List.of(), offending);
    }

    private Optional<Rejection> checkMalformedRows(ProposedSeating proposal) {
        List<Integer> rows = new ArrayList<>();
        List<String> entities = new ArrayList<>();
        for (Placement placement : proposal.placements()) {
            if (!placement.fromBatch()) {
                continue;
            }
            if (SeatingKeys.isBlank(placement.guestName())) {
                addRow(rows, placement);
                entities.add(placement.rowIndex() != null ? "row " + placement.rowIndex() : "guest");
            } else if (placement.seatNumber() != null && placement.seatNumber() < 1) {
                addRow(rows, placement);
                entities.add(placement.entityName());
            }
        }
        return reject(RejectionReason.MALFORMED_ROW, rows, entities);
    }

    private Optional<Rejection> checkDuplicateKeys(ProposedSeating proposal) {
        Map<String, List<Placement>> byKey = new LinkedHashMap<>();
        for (Placement placement : proposal.placements()) {
            if (placement.fromBatch()) {
                byKey.computeIfAbsent(placement.naturalKey(), k -> new ArrayList<>()).add(placement);
            }
        }

        List<Integer> rows = new ArrayList<>();
        List<String> entities = new ArrayList<>();
        for (List<Placement> group : byKey.values()) {
            if (group.size() > 1) {
                group.forEach(p -> addRow(rows, p));
                entities.add(group.get(0).guestName().trim());
            }
        }
        return reject(RejectionReason.DUPLICATE_GUEST_KEY, rows, entities);
    }

    private Optional<Rejection> checkUnknownTables(ProposedSeating proposal) {
        List<Integer> rows = new ArrayList<>();
        Set<String> entities = new LinkedHashSet<>();
        for (Placement placement : proposal.placements()) {
            if (placement.tableLabel() == null) {
                continue;
            }
            String key = SeatingKeys.tableKey(placement.tableLabel());
            if (!proposal.capacities().containsKey(key) && !proposal.removedTables().contains(key)) {
                addRow(rows, placement);
                entities.add(placement.tableLabel().trim());
            }
        }
        return reject(RejectionReason.UNKNOWN_TABLE, rows, new ArrayList<>(entities));
    }

    /**
     * Two guests may not share a seat at one table. Clashes among guests the operation does not
     * touch are left alone.
     */
    private Optional<Rejection> checkDuplicateSeats(ProposedSeating proposal) {
        Map<String, List<Placement>> bySeat = new LinkedHashMap<>();
        for (Placement placement : proposal.placements()) {
            if (placement.tableLabel() == null || placement.seatNumber() == null) {
                continue;
            }
            String key = SeatingKeys.tableKey(placement.tableLabel());
            if (proposal.capacities().containsKey(key)) {
                bySeat.computeIfAbsent(key + "#" + placement.seatNumber(), k -> new ArrayList<>()).add(placement);
            }
        }

        List<Integer> rows = new ArrayList<>();
        List<String> entities = new ArrayList<>();
        for (List<Placement> group : bySeat.values()) {
            if (group.size() > 1 && group.stream().anyMatch(Placement::fromBatch)) {
                group.stream().filter(Placement::fromBatch).forEach(p -> addRow(rows, p));
                Placement first = group.get(0);
                entities.add("seat " + first.seatNumber() + " at "
                        + proposal.label(SeatingKeys.tableKey(first.tableLabel())));
            }
        }
        return reject(RejectionReason.DUPLICATE_SEAT, rows, entities);
    }

    private Optional<Rejection> checkCapacity(ProposedSeating proposal) {
        Map<String, List<Placement>> byTable = new LinkedHashMap<>();
        for (Placement placement : proposal.placements()) {
            if (placement.tableLabel() == null) {
                continue;
            }
            String key = SeatingKeys.tableKey(placement.tableLabel());
            if (proposal.capacities().containsKey(key)) {
                byTable.computeIfAbsent(key, k -> new ArrayList<>()).add(placement);
            }
        }

        List<Integer> rows = new ArrayList<>();
        List<String> entities = new ArrayList<>();
        byTable.forEach((key, seated) -> {
            if (seated.size() > proposal.capacities().get(key)) {
                entities.add(proposal.label(key));
                seated.stream().filter(Placement::fromBatch).forEach(p -> addRow(rows, p));
            }
        });
        return reject(RejectionReason.CAPACITY_EXCEEDED, rows, entities);
    }

    private Optional<Rejection> checkOrphans(ProposedSeating proposal) {
        List<Integer> rows = new ArrayList<>();
        List<String> entities = new ArrayList<>();
        for (Placement placement : proposal.placements()) {
            if (placement.tableLabel() != null
                    && proposal.removedTables().contains(SeatingKeys.tableKey(placement.tableLabel()))) {
                addRow(rows, placement);
                entities.add(placement.entityName());
            }
        }
        return reject(RejectionReason.ORPHAN_TABLE_REFERENCE, rows, entities);
    }

    private static void addRow(List<Integer> rows, Placement placement) {
        if (placement.rowIndex() != null) {
            rows.add(placement.rowIndex());
        }
    }

    private static Optional<Rejection> reject(RejectionReason reason, List<Integer> rows, List<String> entities) {
        if (rows.isEmpty() && entities.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Rejection(reason, rows, entities));
    }
}
