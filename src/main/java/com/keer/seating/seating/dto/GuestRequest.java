package com.keer.seating.seating.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GuestRequest {

    private String name;

    private String contact;

    private String dietaryNotes;

    private Long tableId;

    private Integer seatNumber;
}
