package com.keer.seating.guest.model;

import com.keer.seating.event.model.Event;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "seating_table",
        uniqueConstraints = @UniqueConstraint(columnNames = {"event_id", "label_key"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeatingTable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "event_id", nullable = false)
    private Event event;

    @Column(nullable = false, length = 100)
    private String label;

    // normalized label, unique per event
    @Column(name = "label_key", nullable = false, length = 100)
    private String labelKey;

    @Column(nullable = false)
    private int capacity;
}
