package com.keer.seating.seating.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update; null fields keep their current value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GuestUpdateRequest {

    private String name;

    private String contact;

    private String dietaryNotes;
}
