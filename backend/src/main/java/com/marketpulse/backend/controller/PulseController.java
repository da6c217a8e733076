package com.marketpulse.backend.controller;

import com.marketpulse.backend.dto.CommentaryResponse;
import com.marketpulse.backend.dto.ItemQuery;
import com.marketpulse.backend.dto.ItemView;
import com.marketpulse.backend.dto.MentionPoint;
import com.marketpulse.backend.dto.MetricsResponse;
import com.marketpulse.backend.dto.SignalView;
import com.marketpulse.backend.dto.StateResponse;
import com.marketpulse.backend.event.EventPage;
import com.marketpulse.backend.model.ItemSource;
import com.marketpulse.backend.service.CommentaryService;
import com.marketpulse.backend.service.PulseQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Pulse")
public class PulseController {

    private final PulseQueryService queryService;
    private final CommentaryService commentaryService;

    @GetMapping("/state")
    @Operation(summary = "Latest signal values with component health")
    public StateResponse state() {
        return queryService.currentState();
    }

    @GetMapping("/signals")
    @Operation(summary = "Signal history")
    public List<SignalView> signals(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String action,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant until,
            @RequestParam(defaultValue = "desc") String order) {
        return queryService.listSignals(limit, since, until, action, ascending(order));
    }

    @GetMapping("/items")
    @Operation(summary = "Persisted items with optional filters")
    public List<ItemView> items(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String label,
            @RequestParam(required = false) String q,
            @RequestParam(name = "min_score", required = false) Double minScore,
            @RequestParam(name = "max_score", required = false) Double maxScore,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant until,
            @RequestParam(required = false) Boolean relevant,
            @RequestParam(defaultValue = "desc") String order) {
        ItemQuery query = ItemQuery.builder()
                .limit(limit)
                .source(parseSource(source))
                .label(label)
                .text(q)
                .minScore(minScore)
                .maxScore(maxScore)
                .since(since)
                .until(until)
                .relevant(relevant)
                .ascending(ascending(order))
                .build();
        return queryService.listItems(query);
    }

    @GetMapping("/metrics")
    @Operation(summary = "Store totals and pipeline counters")
    public MetricsResponse metrics() {
        return queryService.metrics();
    }

    @GetMapping("/events")
    @Operation(summary = "Events after a cursor; gap=true when some were evicted")
    public EventPage events(@RequestParam(name = "since_id", required = false) Long sinceId,
                            @RequestParam(required = false) Integer limit) {
        return queryService.eventsSince(sinceId, limit);
    }

    @GetMapping("/impact/top")
    @Operation(summary = "Items with the largest realized 15m impact")
    public List<ItemView> topImpact(@RequestParam(defaultValue = "20") int limit,
                                    @RequestParam(defaultValue = "6") int hours,
                                    @RequestParam(required = false) String source) {
        return queryService.topImpact(hours, limit, parseSource(source));
    }

    @GetMapping("/series/mentions")
    @Operation(summary = "Items per minute")
    public List<MentionPoint> mentionSeries(@RequestParam(defaultValue = "240") int minutes) {
        return queryService.mentionSeries(minutes);
    }

    @GetMapping("/summary")
    @Operation(summary = "LLM market commentary")
    public CommentaryResponse summary() {
        return commentaryService.commentary();
    }

    private static boolean ascending(String order) {
        if ("asc".equalsIgnoreCase(order)) {
            return true;
        }
        if ("desc".equalsIgnoreCase(order)) {
            return false;
        }
        throw new IllegalArgumentException("order must be asc or desc");
    }

    private static ItemSource parseSource(String source) {
        if (source == null || source.isBlank()) {
            return null;
        }
        try {
            return ItemSource.valueOf(source.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown source: " + source, ex);
        }
    }
}
