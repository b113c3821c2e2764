package com.keer.seating.seating.controller;

import com.keer.seating.seating.dto.CheckInRequest;
import com.keer.seating.seating.dto.CheckInResult;
import com.keer.seating.seating.dto.GuestLookupView;
import com.keer.seating.seating.service.SeatingEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Endpoints reached through a guest's lookup token. Guests can check themselves in but never undo it.
 */
@RestController
@RequestMapping("/api/guest")
@RequiredArgsConstructor
public class GuestPortalController {

    private final SeatingEngine seatingEngine;

    @GetMapping("/lookup")
    public ResponseEntity<GuestLookupView> lookup(@RequestParam String token) {
        return ResponseEntity.ok(seatingEngine.lookupByToken(token));
    }

    @PostMapping("/check-in")
    public ResponseEntity<CheckInResult> checkIn(@Valid @RequestBody CheckInRequest request) {
        return ResponseEntity.ok(seatingEngine.checkInByToken(request.getToken()));
    }
}
