package com.keer.seating.broadcast.controller;

import com.keer.seating.broadcast.service.EventBroadcaster;
import com.keer.seating.broadcast.service.SseDeltaSink;
import com.keer.seating.broadcast.service.Subscription;
import com.keer.seating.event.service.EventService;
import com.keer.seating.seating.service.SeatingEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/public/events")
@RequiredArgsConstructor
@Slf4j
public class LiveSeatingController {

    private final EventService eventService;
    private final SeatingEngine seatingEngine;
    private final EventBroadcaster broadcaster;

    /**
     * Live seating updates. Reconnecting clients pass the last sequence they applied, either as
     * {@code lastSequence} or through the standard {@code Last-Event-ID} header.
     */
    @GetMapping(value = "/{publicCode}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String publicCode,
                             @RequestParam(required = false) Long lastSequence,
                             @RequestHeader(value = "Last-Event-ID", required = false) String lastEventId) {
        long eventId = eventService.resolvePublicCode(publicCode);
        Long checkpoint = lastSequence != null ? lastSequence : parseEventId(lastEventId);

        SseEmitter emitter = new SseEmitter(0L); // no timeout
        Subscription subscription = broadcaster.subscribe(eventId, checkpoint, new SseDeltaSink(emitter),
                () -> seatingEngine.snapshot(eventId));

        emitter.onCompletion(subscription::cancel);
        emitter.onTimeout(subscription::cancel);
        emitter.onError(e -> subscription.cancel());
        return emitter;
    }

    private static Long parseEventId(String lastEventId) {
        if (lastEventId == null || lastEventId.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(lastEventId.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Last-Event-ID '{}'", lastEventId);
            return null;
        }
    }
}
