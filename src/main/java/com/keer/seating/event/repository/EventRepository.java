package com.keer.seating.event.repository;

import com.keer.seating.event.model.Event;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface EventRepository extends JpaRepository<Event, Long> {

    Optional<Event> findByPublicCode(String publicCode);

    boolean existsByPublicCode(String publicCode);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Event e SET e.lastSequence = :next WHERE e.id = :eventId AND e.lastSequence = :expected")
    int advanceSequence(@Param("eventId") Long eventId,
                        @Param("expected") long expected,
                        @Param("next") long next);
}
