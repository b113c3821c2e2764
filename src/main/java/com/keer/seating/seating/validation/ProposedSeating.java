package com.keer.seating.seating.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Complete seating state an operation wants to commit, in label terms.
 * Tables are keyed by {@link SeatingKeys#tableKey(String)}.
 */
public final class ProposedSeating {

    private final Map<String, String> labels = new LinkedHashMap<>();
    private final Map<String, Integer> capacities = new LinkedHashMap<>();
    private final Set<String> removedTables = new LinkedHashSet<>();
    private final List<Placement> placements = new ArrayList<>();

    public ProposedSeating table(String label, int capacity) {
        String key = SeatingKeys.tableKey(label);
        labels.put(key, label.trim());
        capacities.put(key, capacity);
        removedTables.remove(key);
        return this;
    }

    public ProposedSeating removeTable(String label) {
        String key = SeatingKeys.tableKey(label);
        labels.putIfAbsent(key, label.trim());
        capacities.remove(key);
        removedTables.add(key);
        return this;
    }

    public ProposedSeating place(Placement placement) {
        placements.add(placement);
        return this;
    }

    public Map<String, Integer> capacities() {
        return Collections.unmodifiableMap(capacities);
    }

    public Set<String> removedTables() {
        return Collections.unmodifiableSet(removedTables);
    }

    public List<Placement> placements() {
        return Collections.unmodifiableList(placements);
    }

    public String label(String tableKey) {
        return labels.getOrDefault(tableKey, tableKey);
    }
}
