package com.keer.seating.guest.repository;

import com.keer.seating.guest.model.SeatingTable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SeatingTableRepository extends JpaRepository<SeatingTable, Long> {

    List<SeatingTable> findByEventIdOrderByIdAsc(Long eventId);

    long countByEventId(Long eventId);

    void deleteByEventId(Long eventId);
}
