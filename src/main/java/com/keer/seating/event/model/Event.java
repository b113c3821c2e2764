package com.keer.seating.event.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "event")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    public static final int TABLE_CAPACITY_LIMIT = 12;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private LocalDate eventDate;

    @Column(nullable = false)
    private String organizerEmail;

    @Column(nullable = false, unique = true, length = 50)
    private String publicCode;

    @Column(nullable = false)
    private Instant createdAt = Instant.now();

    // sequence of the last delta committed for this event
    @Column(nullable = false)
    private long lastSequence;
}
