package com.marketpulse.backend.dto;

import java.util.Map;

public record CounterSnapshot(
        Map<String, Long> itemsPersisted,
        Map<String, Long> itemsDuplicate,
        Map<String, Long> rejectsByReason,
        Map<String, Long> classifierSkips,
        Map<String, Long> loopFailures,
        long oracleFailures,
        long tickOverlaps,
        long signalsComputed,
        long eventsPublished,
        long impactsWritten,
        long impactDeferrals,
        long notificationFailures
) {}
