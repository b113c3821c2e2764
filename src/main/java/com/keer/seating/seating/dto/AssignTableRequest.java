package com.keer.seating.seating.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssignTableRequest {

    // null unassigns the guest
    private Long tableId;

    // optional, ignored without a table
    private Integer seatNumber;
}
