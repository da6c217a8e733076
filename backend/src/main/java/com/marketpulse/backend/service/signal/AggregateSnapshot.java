package com.marketpulse.backend.service.signal;

public record AggregateSnapshot(
        double ema15,
        int mentions,
        double baselineMean,
        double baselineStddev,
        double mentionsZ,
        int scoredItems
) {
}
