package com.keer.seating.broadcast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.keer.seating.seating.dto.GuestView;
import com.keer.seating.seating.dto.TableView;

import java.time.Instant;

/**
 * One committed state change of an event. Sequences are per event, start at 1 and have no gaps.
 *
 * @param previousTableId table the guest left, only set for {@link DeltaType#SEATING_CHANGED}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Delta(long eventId,
                    long sequence,
                    DeltaType type,
                    Instant occurredAt,
                    GuestView guest,
                    TableView table,
                    Long previousTableId) {
}
