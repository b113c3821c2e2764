package com.keer.seating.seating.controller;

import com.keer.seating.auth.AdminGrant;
import com.keer.seating.guest.dto.GuestPage;
import com.keer.seating.guest.service.GuestQueryService;
import com.keer.seating.seating.dto.AssignTableRequest;
import com.keer.seating.seating.dto.AssignmentResult;
import com.keer.seating.seating.dto.CheckInResult;
import com.keer.seating.seating.dto.GuestDetails;
import com.keer.seating.seating.dto.GuestRequest;
import com.keer.seating.seating.dto.GuestUpdateRequest;
import com.keer.seating.seating.dto.ImportCommand;
import com.keer.seating.seating.dto.ImportResult;
import com.keer.seating.seating.dto.SeatingExport;
import com.keer.seating.seating.dto.SeatingSnapshot;
import com.keer.seating.seating.dto.TableSpec;
import com.keer.seating.seating.dto.TableUpdateRequest;
import com.keer.seating.seating.dto.TableView;
import com.keer.seating.seating.service.SeatingEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin/events/{eventId}")
@RequiredArgsConstructor
public class AdminSeatingController {

    private final SeatingEngine seatingEngine;
    private final GuestQueryService guestQueryService;

    @PostMapping("/import")
    public ResponseEntity<ImportResult> importSeating(AdminGrant grant, @PathVariable Long eventId,
                                                      @Valid @RequestBody ImportCommand command) {
        return ResponseEntity.ok(seatingEngine.importSeating(grant, eventId, command));
    }

    @GetMapping("/export")
    public ResponseEntity<SeatingExport> exportSeating(AdminGrant grant, @PathVariable Long eventId) {
        return ResponseEntity.ok(seatingEngine.export(grant, eventId));
    }

    @GetMapping("/snapshot")
    public ResponseEntity<SeatingSnapshot> getSnapshot(AdminGrant grant, @PathVariable Long eventId) {
        return ResponseEntity.ok(seatingEngine.snapshot(eventId));
    }

    @GetMapping("/guests")
    public ResponseEntity<GuestPage> searchGuests(AdminGrant grant, @PathVariable Long eventId,
                                                  @RequestParam(required = false) String search,
                                                  @RequestParam(defaultValue = "0") int page,
                                                  @RequestParam(defaultValue = "50") int size) {
        return ResponseEntity.ok(guestQueryService.search(eventId, search, page, size));
    }

    @PostMapping("/guests")
    public ResponseEntity<GuestDetails> addGuest(AdminGrant grant, @PathVariable Long eventId,
                                                 @RequestBody GuestRequest request) {
        GuestDetails response = seatingEngine.addGuest(grant, eventId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PatchMapping("/guests/{guestId}")
    public ResponseEntity<GuestDetails> updateGuest(AdminGrant grant, @PathVariable Long eventId,
                                                    @PathVariable Long guestId,
                                                    @RequestBody GuestUpdateRequest request) {
        return ResponseEntity.ok(seatingEngine.updateGuest(grant, eventId, guestId, request));
    }

    @DeleteMapping("/guests/{guestId}")
    public ResponseEntity<Void> removeGuest(AdminGrant grant, @PathVariable Long eventId, @PathVariable Long guestId) {
        seatingEngine.removeGuest(grant, eventId, guestId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/guests/{guestId}/table")
    public ResponseEntity<AssignmentResult> assignTable(AdminGrant grant, @PathVariable Long eventId,
                                                        @PathVariable Long guestId,
                                                        @RequestBody AssignTableRequest request) {
        return ResponseEntity.ok(seatingEngine.assignGuestToTable(grant, eventId, guestId,
                request.getTableId(), request.getSeatNumber()));
    }

    @PostMapping("/guests/{guestId}/check-in")
    public ResponseEntity<CheckInResult> checkIn(AdminGrant grant, @PathVariable Long eventId, @PathVariable Long guestId) {
        return ResponseEntity.ok(seatingEngine.checkIn(eventId, guestId));
    }

    @DeleteMapping("/guests/{guestId}/check-in")
    public ResponseEntity<GuestDetails> revertCheckIn(AdminGrant grant, @PathVariable Long eventId,
                                                      @PathVariable Long guestId) {
        return ResponseEntity.ok(seatingEngine.revertCheckIn(grant, eventId, guestId));
    }

    @PostMapping("/tables")
    public ResponseEntity<TableView> defineTable(AdminGrant grant, @PathVariable Long eventId,
                                                 @Valid @RequestBody TableSpec request) {
        TableView response = seatingEngine.defineTable(grant, eventId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PatchMapping("/tables/{tableId}")
    public ResponseEntity<TableView> updateTable(AdminGrant grant, @PathVariable Long eventId,
                                                 @PathVariable Long tableId,
                                                 @RequestBody TableUpdateRequest request) {
        return ResponseEntity.ok(seatingEngine.resizeTable(grant, eventId, tableId, request));
    }

    @DeleteMapping("/tables/{tableId}")
    public ResponseEntity<Void> removeTable(AdminGrant grant, @PathVariable Long eventId, @PathVariable Long tableId) {
        seatingEngine.removeTable(grant, eventId, tableId);
        return ResponseEntity.noContent().build();
    }
}
