package com.marketpulse.backend.event;

import java.util.List;

/**
 * Result of a cursor read. {@code gap} is true when events after the cursor were already
 * evicted from the ring buffer, so the consumer cannot resume without loss.
 */
public record EventPage(
        List<PulseEvent> events,
        boolean gap,
        boolean hasMore,
        Long oldestId,
        long latestId
) {
}
