package com.marketpulse.backend.service.ingest;

import com.marketpulse.backend.config.PulseProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded, time-expiring memory of recently handled dedup hashes. It only saves oracle calls
 * for repeats; the items primary key decides what is a duplicate. A hit renews the entry, so
 * an item a feed keeps returning stays remembered.
 */
@Component
public class RecentHashCache {

    private final int maxEntries;
    private final Duration window;
    private final Clock clock;
    private final LinkedHashMap<String, Instant> entries;

    public RecentHashCache(PulseProperties properties, Clock clock) {
        this.maxEntries = properties.getIngest().getDedupCacheSize();
        this.window = Duration.ofMinutes(properties.getIngest().getDedupWindowMinutes());
        this.clock = clock;
        this.entries = new LinkedHashMap<>(256, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Instant> eldest) {
                return size() > maxEntries;
            }
        };
    }

    public synchronized boolean seenRecently(String hash) {
        if (maxEntries == 0) {
            return false;
        }
        Instant seenAt = entries.get(hash);
        if (seenAt == null) {
            return false;
        }
        Instant now = clock.instant();
        entries.remove(hash);
        if (seenAt.plus(window).isBefore(now)) {
            return false;
        }
        entries.put(hash, now);
        return true;
    }

    public synchronized void remember(String hash) {
        if (maxEntries == 0) {
            return;
        }
        entries.remove(hash);
        entries.put(hash, clock.instant());
    }

    public synchronized int size() {
        return entries.size();
    }
}
