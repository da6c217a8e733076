package com.marketpulse.backend.dto;

import java.time.Instant;
import java.util.Map;

/**
 * @param stale true when the LLM could not refresh and an older commentary is returned
 * @param error set only when no commentary at all is available
 */
public record CommentaryResponse(
        String commentary,
        Map<String, Object> facts,
        String model,
        Instant generatedAt,
        boolean stale,
        String error
) {

    public CommentaryResponse asStale() {
        return new CommentaryResponse(commentary, facts, model, generatedAt, true, error);
    }
}
