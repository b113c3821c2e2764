package com.keer.seating.event.controller;

import com.keer.seating.event.dto.SeatingSummary;
import com.keer.seating.event.service.EventService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/public/events")
@RequiredArgsConstructor
public class PublicEventController {

    private final EventService eventService;

    @GetMapping("/{publicCode}/summary")
    public ResponseEntity<SeatingSummary> getSummary(@PathVariable String publicCode,
                                                     @RequestParam(defaultValue = "false") boolean includeNames) {
        return ResponseEntity.ok(eventService.summary(publicCode, includeNames));
    }
}
