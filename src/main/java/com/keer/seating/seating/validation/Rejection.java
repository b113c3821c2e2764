package com.keer.seating.seating.validation;

import java.util.List;

/**
 * @param offendingRows     zero-based batch row indices, empty for single-guest edits
 * @param offendingEntities table labels or guest names the reason applies to
 */
public record Rejection(RejectionReason reason, List<Integer> offendingRows, List<String> offendingEntities) {

    public Rejection {
        offendingRows = List.copyOf(offendingRows);
        offendingEntities = List.copyOf(offendingEntities);
    }

    public String describe() {
        return reason + " " + offendingEntities;
    }
}
