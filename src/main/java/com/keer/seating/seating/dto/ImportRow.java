package com.keer.seating.seating.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportRow {

    private String guestName;

    private String tableLabel;

    // seat at the table, unique per table when given
    private Integer seatNumber;

    private String dietaryNotes;

    private String contact;

    // null leaves the guest's check-in status as it is
    private Boolean checkedIn;

    private Instant checkedInAt;
}
