package com.marketpulse.backend.service.loop;

import java.time.Instant;

public record LoopStatus(
        String name,
        boolean running,
        long iterations,
        long failures,
        Instant lastRunAt,
        Instant lastSuccessAt,
        String lastError
) {
}
