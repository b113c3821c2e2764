package com.keer.seating.store;

import java.util.Map;
import java.util.Optional;

/**
 * Durable storage of one event's tables and guests.
 * <p>
 * Implementations must read committed data only and apply a change set atomically: either every
 * row and the advanced sequence become visible, or nothing does.
 */
public interface GuestRecordStore {

    /**
     * Loads the committed state of an event together with its last delta sequence.
     *
     * @throws com.keer.seating.common.exception.NotFoundException if the event does not exist
     */
    SeatingState load(long eventId);

    /**
     * Applies the change set if the event is still at {@code expectedSequence}.
     *
     * @return real ids assigned to the change set's placeholder ids
     * @throws com.keer.seating.common.exception.ConflictException if the event moved on
     * @throws com.keer.seating.common.exception.StorageUnavailableException if the store could not be reached
     */
    Map<Long, Long> commit(SeatingChangeSet changes);

    /**
     * Finds the event that owns the guest holding {@code lookupToken}.
     */
    Optional<Long> findEventIdByToken(String lookupToken);
}
