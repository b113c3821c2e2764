package com.keer.seating.seating.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.keer.seating.guest.model.CheckInStatus;
import com.keer.seating.store.GuestRecord;
import com.keer.seating.store.SeatingState;

import java.time.Instant;

/**
 * Guest as shown to live viewers and the portal. Contact and lookup token are never part of it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GuestView(long id,
                        String name,
                        String dietaryNotes,
                        Long tableId,
                        String tableLabel,
                        Integer seatNumber,
                        CheckInStatus status,
                        Instant checkedInAt) {

    public static GuestView of(GuestRecord guest, SeatingState state) {
        return new GuestView(guest.id(), guest.name(), guest.dietaryNotes(), guest.tableId(),
                state.tableLabel(guest.tableId()), guest.seatNumber(), guest.status(), guest.checkedInAt());
    }
}
