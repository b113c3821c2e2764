package com.keer.seating.guest.model;

import com.keer.seating.event.model.Event;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "guest", indexes = @Index(name = "idx_guest_event", columnList = "event_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Guest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "event_id", nullable = false)
    private Event event;

    @Column(nullable = false)
    private String name;

    private String contact;

    private String dietaryNotes;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "table_id")
    private SeatingTable table;

    private Integer seatNumber;

    @Column(nullable = false)
    @Enumerated(EnumType.STRING)
    private CheckInStatus status = CheckInStatus.NOT_ARRIVED;

    private Instant checkedInAt;

    @Column(nullable = false, unique = true, length = 80)
    private String lookupToken;

    @Column(nullable = false)
    private Instant updatedAt = Instant.now();
}
