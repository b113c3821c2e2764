package com.keer.seating.seating.validation;

/**
 * One guest's position in a proposed seating state.
 *
 * @param rowIndex   batch row the placement came from, null when not part of the batch
 * @param tableLabel requested table label, null for an unassigned guest
 * @param seatNumber requested seat at that table, null when unnumbered
 * @param fromBatch  whether the placement is being changed by the operation under validation
 */
public record Placement(Integer rowIndex, String guestName, String naturalKey, String tableLabel,
                        Integer seatNumber, boolean fromBatch) {

    public static Placement batchRow(int rowIndex, String guestName, String contact, String tableLabel) {
        return batchRow(rowIndex, guestName, contact, tableLabel, null);
    }

    public static Placement batchRow(int rowIndex, String guestName, String contact, String tableLabel,
                                     Integer seatNumber) {
        return new Placement(rowIndex, guestName, SeatingKeys.naturalKey(guestName, contact), tableLabel,
                seatNumber, true);
    }

    public static Placement edited(String guestName, String contact, String tableLabel, Integer seatNumber) {
        return new Placement(null, guestName, SeatingKeys.naturalKey(guestName, contact), tableLabel, seatNumber, true);
    }

    public static Placement unchanged(String guestName, String contact, String tableLabel) {
        return unchanged(guestName, contact, tableLabel, null);
    }

    public static Placement unchanged(String guestName, String contact, String tableLabel, Integer seatNumber) {
        return new Placement(null, guestName, SeatingKeys.naturalKey(guestName, contact), tableLabel, seatNumber, false);
    }

    public String entityName() {
        return rowIndex != null ? "row " + rowIndex + " (" + guestName + ")" : guestName;
    }
}
