package com.keer.seating.event.service;

import com.keer.seating.auth.AdminGrant;
import com.keer.seating.broadcast.service.EventBroadcaster;
import com.keer.seating.common.exception.ConflictException;
import com.keer.seating.common.exception.ErrorCode;
import com.keer.seating.common.exception.NotFoundException;
import com.keer.seating.event.dto.EventRequest;
import com.keer.seating.event.dto.EventResponse;
import com.keer.seating.event.dto.SeatingSummary;
import com.keer.seating.event.model.Event;
import com.keer.seating.event.repository.EventRepository;
import com.keer.seating.guest.model.CheckInStatus;
import com.keer.seating.guest.repository.GuestRepository;
import com.keer.seating.guest.repository.SeatingTableRepository;
import com.keer.seating.seating.dto.GuestView;
import com.keer.seating.seating.dto.SeatingSnapshot;
import com.keer.seating.seating.dto.TableView;
import com.keer.seating.seating.service.EventLockRegistry;
import com.keer.seating.seating.service.SeatingEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

@Service
@Slf4j
public class EventService {

    private static final int PUBLIC_CODE_BYTES = 9;
    private static final int MAX_CODE_ATTEMPTS = 5;
    // unnumbered guests after the numbered ones
    private static final Comparator<GuestView> BY_SEAT =
            Comparator.comparing(GuestView::seatNumber, Comparator.nullsLast(Comparator.naturalOrder()));

    private final EventRepository eventRepository;
    private final SeatingTableRepository tableRepository;
    private final GuestRepository guestRepository;
    private final SeatingEngine seatingEngine;
    private final EventBroadcaster broadcaster;
    private final EventLockRegistry locks;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public EventService(EventRepository eventRepository,
                        SeatingTableRepository tableRepository,
                        GuestRepository guestRepository,
                        SeatingEngine seatingEngine,
                        EventBroadcaster broadcaster,
                        EventLockRegistry locks,
                        PlatformTransactionManager transactionManager,
                        Clock clock) {
        this.eventRepository = eventRepository;
        this.tableRepository = tableRepository;
        this.guestRepository = guestRepository;
        this.seatingEngine = seatingEngine;
        this.broadcaster = broadcaster;
        this.locks = locks;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Transactional
    public EventResponse createEvent(AdminGrant grant, EventRequest request) {
        Objects.requireNonNull(grant, "admin grant");
        Event event = new Event();
        event.setName(request.getName().trim());
        event.setEventDate(request.getEventDate());
        event.setOrganizerEmail(request.getOrganizerEmail().trim());
        event.setPublicCode(newPublicCode());
        event.setCreatedAt(clock.instant());
        Event saved = eventRepository.save(event);

        log.info("Event {} '{}' created by {}", saved.getId(), saved.getName(), grant.principal());
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public EventResponse getEvent(AdminGrant grant, long eventId) {
        Objects.requireNonNull(grant, "admin grant");
        return eventRepository.findById(eventId)
                .map(this::toResponse)
                .orElseThrow(() -> NotFoundException.event(eventId));
    }

    /**
     * Tears the event down: guests and tables are deleted, live subscribers disconnected.
     * Lookup tokens of the deleted guests stay registered.
     */
    public void deleteEvent(AdminGrant grant, long eventId) {
        Objects.requireNonNull(grant, "admin grant");
        ReentrantLock lock;
        try {
            lock = locks.acquire(eventId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConflictException(ErrorCode.EVENT_BUSY, "Interrupted while waiting for event " + eventId);
        }
        try {
            transactionTemplate.executeWithoutResult(status -> {
                if (!eventRepository.existsById(eventId)) {
                    throw NotFoundException.event(eventId);
                }
                guestRepository.deleteByEventId(eventId);
                tableRepository.deleteByEventId(eventId);
                eventRepository.deleteById(eventId);
            });
            broadcaster.closeEvent(eventId);
            locks.forget(eventId, lock);
            log.info("Event {} deleted by {}", eventId, grant.principal());
        } finally {
            lock.unlock();
        }
    }

    @Transactional(readOnly = true)
    public long resolvePublicCode(String publicCode) {
        return eventRepository.findByPublicCode(publicCode)
                .map(Event::getId)
                .orElseThrow(() -> NotFoundException.event(publicCode));
    }

    public SeatingSummary summary(String publicCode, boolean includeNames) {
        Event event = eventRepository.findByPublicCode(publicCode)
                .orElseThrow(() -> NotFoundException.event(publicCode));
        SeatingSnapshot snapshot = seatingEngine.snapshot(event.getId());

        List<SeatingSummary.TableSummary> tables = snapshot.tables().stream()
                .map(table -> toTableSummary(table, snapshot, includeNames))
                .toList();
        int checkedIn = (int) snapshot.guests().stream()
                .filter(g -> g.status() == CheckInStatus.CHECKED_IN)
                .count();
        int unassigned = (int) snapshot.guests().stream()
                .filter(g -> g.tableId() == null)
                .count();
        return new SeatingSummary(snapshot.eventName(), event.getEventDate(), snapshot.sequence(),
                snapshot.guests().size(), checkedIn, unassigned, tables);
    }

    private SeatingSummary.TableSummary toTableSummary(TableView table, SeatingSnapshot snapshot, boolean includeNames) {
        List<SeatingSummary.SeatedGuest> guests = null;
        if (includeNames) {
            guests = snapshot.guests().stream()
                    .filter(g -> g.tableId() != null && g.tableId() == table.id())
                    .sorted(BY_SEAT)
                    .map(g -> new SeatingSummary.SeatedGuest(g.name(), g.seatNumber()))
                    .toList();
        }
        return new SeatingSummary.TableSummary(table.id(), table.label(), table.capacity(), table.occupancy(),
                table.checkedIn(), table.availableSeats(), guests);
    }

    private String newPublicCode() {
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            byte[] bytes = new byte[PUBLIC_CODE_BYTES];
            random.nextBytes(bytes);
            String code = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
            if (!eventRepository.existsByPublicCode(code)) {
                return code;
            }
        }
        throw new ConflictException("Could not generate a unique public code");
    }

    private EventResponse toResponse(Event event) {
        Long id = event.getId();
        return EventResponse.builder()
                .id(id)
                .name(event.getName())
                .eventDate(event.getEventDate())
                .organizerEmail(event.getOrganizerEmail())
                .publicCode(event.getPublicCode())
                .createdAt(event.getCreatedAt())
                .lastSequence(event.getLastSequence())
                .tableCount(tableRepository.countByEventId(id))
                .guestCount(guestRepository.countByEventId(id))
                .checkedInCount(guestRepository.countByEventIdAndStatus(id, CheckInStatus.CHECKED_IN))
                .liveSubscribers(broadcaster.subscriberCount(id))
                .build();
    }
}
