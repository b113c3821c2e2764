package com.keer.seating.seating.dto;

public record AssignmentResult(GuestView guest, Long previousTableId, boolean changed, long sequence) {
}
