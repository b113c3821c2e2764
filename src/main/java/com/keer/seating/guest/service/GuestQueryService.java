package com.keer.seating.guest.service;

import com.keer.seating.common.exception.NotFoundException;
import com.keer.seating.event.repository.EventRepository;
import com.keer.seating.guest.dto.GuestPage;
import com.keer.seating.guest.model.Guest;
import com.keer.seating.guest.repository.GuestRepository;
import com.keer.seating.seating.dto.GuestDetails;
import com.keer.seating.token.service.LookupTokenIssuer;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Paged guest listing for the admin console. Reads committed rows directly, without the engine lock.
 */
@Service
@RequiredArgsConstructor
public class GuestQueryService {

    static final int MAX_PAGE_SIZE = 200;

    private final EventRepository eventRepository;
    private final GuestRepository guestRepository;
    private final LookupTokenIssuer tokenIssuer;

    @Transactional(readOnly = true)
    public GuestPage search(long eventId, String search, int page, int size) {
        if (!eventRepository.existsById(eventId)) {
            throw NotFoundException.event(eventId);
        }
        Pageable pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE),
                Sort.by("name").and(Sort.by("id")));

        Page<Guest> guests = search == null || search.isBlank()
                ? guestRepository.findByEventId(eventId, pageable)
                : guestRepository.findByEventIdAndNameContainingIgnoreCase(eventId, search.trim(), pageable);

        return new GuestPage(guests.map(this::toDetails).getContent(), guests.getNumber(), guests.getSize(),
                guests.getTotalElements(), guests.getTotalPages());
    }

    private GuestDetails toDetails(Guest guest) {
        return GuestDetails.builder()
                .id(guest.getId())
                .name(guest.getName())
                .contact(guest.getContact())
                .dietaryNotes(guest.getDietaryNotes())
                .tableId(guest.getTable() != null ? guest.getTable().getId() : null)
                .tableLabel(guest.getTable() != null ? guest.getTable().getLabel() : null)
                .seatNumber(guest.getSeatNumber())
                .status(guest.getStatus())
                .checkedInAt(guest.getCheckedInAt())
                .lookupToken(guest.getLookupToken())
                .portalLink(tokenIssuer.portalLink(guest.getLookupToken()))
                .build();
    }
}
