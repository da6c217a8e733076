package com.marketpulse.backend.controller;

import com.marketpulse.backend.event.EventStreamService;
import com.marketpulse.backend.service.PulseQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Tag(name = "Events")
public class EventStreamController {

    private final EventStreamService eventStreamService;
    private final PulseQueryService queryService;

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Live event stream; resumes from since_id or Last-Event-ID")
    public SseEmitter stream(@RequestHeader(name = "Last-Event-ID", required = false) String lastEventId,
                             @RequestParam(name = "since_id", required = false) Long sinceId) {
        Long cursor = sinceId != null ? sinceId : parseCursor(lastEventId);
        return eventStreamService.open(cursor, queryService::currentState);
    }

    private static Long parseCursor(String lastEventId) {
        if (lastEventId == null || lastEventId.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(lastEventId.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Last-Event-ID must be numeric", ex);
        }
    }
}
