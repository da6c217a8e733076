package com.marketpulse.backend.dto;

import java.util.Map;

public record IngestReport(String source,
                           int seen,
                           int persisted,
                           int duplicates,
                           int rejected,
                           Map<String, Integer> rejectReasons,
                           int unscored,
                           int classifierSkipped,
                           int lowRelevance,
                           int failed) {

    public boolean idle() {
        return persisted == 0;
    }
}
