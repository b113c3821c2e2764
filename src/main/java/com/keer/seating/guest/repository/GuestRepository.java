package com.keer.seating.guest.repository;

import com.keer.seating.guest.model.CheckInStatus;
import com.keer.seating.guest.model.Guest;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface GuestRepository extends JpaRepository<Guest, Long> {

    @EntityGraph(attributePaths = "table")
    List<Guest> findByEventIdOrderByIdAsc(Long eventId);

    @EntityGraph(attributePaths = {"event", "table"})
    Optional<Guest> findByLookupToken(String lookupToken);

    @EntityGraph(attributePaths = "table")
    Page<Guest> findByEventIdAndNameContainingIgnoreCase(Long eventId, String name, Pageable pageable);

    @EntityGraph(attributePaths = "table")
    Page<Guest> findByEventId(Long eventId, Pageable pageable);

    long countByEventId(Long eventId);

    long countByEventIdAndStatus(Long eventId, CheckInStatus status);

    void deleteByEventId(Long eventId);
}
