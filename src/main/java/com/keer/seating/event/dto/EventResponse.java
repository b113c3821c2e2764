package com.keer.seating.event.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EventResponse {

    private Long id;

    private String name;

    private LocalDate eventDate;

    private String organizerEmail;

    private String publicCode;

    private Instant createdAt;

    private long lastSequence;

    private long tableCount;

    private long guestCount;

    private long checkedInCount;

    private int liveSubscribers;
}
