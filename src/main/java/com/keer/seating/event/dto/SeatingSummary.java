package com.keer.seating.event.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;
import java.util.List;

/**
 * Public overview of an event's tables. Guests, in seat order, are only included on request.
 */
public record SeatingSummary(String eventName,
                             LocalDate eventDate,
                             long sequence,
                             int totalGuests,
                             int checkedIn,
                             int unassigned,
                             List<TableSummary> tables) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TableSummary(long tableId,
                               String label,
                               int capacity,
                               int occupancy,
                               long checkedIn,
                               int availableSeats,
                               List<SeatedGuest> guests) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SeatedGuest(String name, Integer seatNumber) {
    }
}
