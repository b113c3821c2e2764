package com.keer.seating.seating.dto;

import java.time.Instant;

/**
 * Outcome of a check-in. Every caller checking in the same guest gets the same {@code checkedInAt};
 * {@code sequence} is the event sequence the call observed, so concurrent callers with no other
 * write in between see the same value. Only {@code alreadyCheckedIn} differs: it is false for the
 * single call that recorded the arrival.
 */
public record CheckInResult(long guestId, Instant checkedInAt, boolean alreadyCheckedIn, long sequence) {
}
