package com.keer.seating.seating.dto;

import com.keer.seating.guest.model.CheckInStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Admin view of a guest, including contact and the lookup credential.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GuestDetails {

    private Long id;

    private String name;

    private String contact;

    private String dietaryNotes;

    private Long tableId;

    private String tableLabel;

    private Integer seatNumber;

    private CheckInStatus status;

    private Instant checkedInAt;

    private String lookupToken;

    private String portalLink;
}
