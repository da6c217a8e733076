package com.marketpulse.backend.event;

/**
 * Reported to a replaying subscriber whose cursor is older than the oldest retained event.
 */
public record ReplayGap(long sinceId, Long oldestId, long latestId) {
}
