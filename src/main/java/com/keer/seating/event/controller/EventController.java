package com.keer.seating.event.controller;

import com.keer.seating.auth.AdminGrant;
import com.keer.seating.event.dto.EventRequest;
import com.keer.seating.event.dto.EventResponse;
import com.keer.seating.event.service.EventService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin/events")
@RequiredArgsConstructor
public class EventController {

    private final EventService eventService;

    @PostMapping
    public ResponseEntity<EventResponse> createEvent(AdminGrant grant, @Valid @RequestBody EventRequest request) {
        EventResponse response = eventService.createEvent(grant, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{id}")
    public ResponseEntity<EventResponse> getEvent(AdminGrant grant, @PathVariable Long id) {
        return ResponseEntity.ok(eventService.getEvent(grant, id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteEvent(AdminGrant grant, @PathVariable Long id) {
        eventService.deleteEvent(grant, id);
        return ResponseEntity.noContent().build();
    }
}
