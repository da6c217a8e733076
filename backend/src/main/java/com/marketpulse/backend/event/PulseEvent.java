package com.marketpulse.backend.event;

import java.time.Instant;
import java.util.Map;

public record PulseEvent(
        long id,
        EventType type,
        Instant timestamp,
        String summary,
        Map<String, Object> payload
) {
}
