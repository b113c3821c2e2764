package com.keer.seating.store;

import com.keer.seating.guest.model.CheckInStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * A guest as seen inside one write. Negative ids (guest or table) are placeholders for rows
 * not yet committed. A seat number only exists together with a table.
 */
public record GuestRecord(long id,
                          String name,
                          String contact,
                          String dietaryNotes,
                          Long tableId,
                          Integer seatNumber,
                          CheckInStatus status,
                          Instant checkedInAt,
                          String lookupToken) {

    public GuestRecord {
        if ((status == CheckInStatus.CHECKED_IN) != (checkedInAt != null)) {
            throw new IllegalArgumentException("checkedInAt must be set iff status is CHECKED_IN");
        }
        if (tableId == null) {
            seatNumber = null;
        }
    }

    public static GuestRecord arriving(long id, String name, String contact, String dietaryNotes,
                                       Long tableId, Integer seatNumber, String lookupToken) {
        return new GuestRecord(id, name, contact, dietaryNotes, tableId, seatNumber,
                CheckInStatus.NOT_ARRIVED, null, lookupToken);
    }

    public boolean isNew() {
        return id < 0;
    }

    public boolean isCheckedIn() {
        return status == CheckInStatus.CHECKED_IN;
    }

    public GuestRecord seatedAt(Long newTableId, Integer newSeatNumber) {
        return new GuestRecord(id, name, contact, dietaryNotes, newTableId, newSeatNumber, status, checkedInAt, lookupToken);
    }

    public GuestRecord withDetails(String newName, String newContact, String newDietaryNotes) {
        return new GuestRecord(id, newName, newContact, newDietaryNotes, tableId, seatNumber, status, checkedInAt, lookupToken);
    }

    public GuestRecord withLookupToken(String token) {
        return new GuestRecord(id, name, contact, dietaryNotes, tableId, seatNumber, status, checkedInAt, token);
    }

    public GuestRecord withIds(long newId, Long newTableId) {
        return new GuestRecord(newId, name, contact, dietaryNotes, newTableId, seatNumber, status, checkedInAt, lookupToken);
    }

    public GuestRecord checkedIn(Instant at) {
        return new GuestRecord(id, name, contact, dietaryNotes, tableId, seatNumber, CheckInStatus.CHECKED_IN, at, lookupToken);
    }

    public GuestRecord notArrived() {
        return new GuestRecord(id, name, contact, dietaryNotes, tableId, seatNumber, CheckInStatus.NOT_ARRIVED, null, lookupToken);
    }

    public boolean sameDetails(GuestRecord other) {
        return Objects.equals(name, other.name)
                && Objects.equals(contact, other.contact)
                && Objects.equals(dietaryNotes, other.dietaryNotes);
    }

    public boolean sameSeat(GuestRecord other) {
        return Objects.equals(tableId, other.tableId) && Objects.equals(seatNumber, other.seatNumber);
    }

    public boolean sameCheckIn(GuestRecord other) {
        return status == other.status && Objects.equals(checkedInAt, other.checkedInAt);
    }
}
