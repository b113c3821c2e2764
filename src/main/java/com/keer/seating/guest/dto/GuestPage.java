package com.keer.seating.guest.dto;

import com.keer.seating.seating.dto.GuestDetails;

import java.util.List;

public record GuestPage(List<GuestDetails> content,
                        int page,
                        int size,
                        long totalElements,
                        int totalPages) {
}
