package com.marketpulse.backend.dto;

import com.marketpulse.backend.model.ItemSource;

import java.time.Instant;

/**
 * An item as delivered by a source connector, before normalization and scoring.
 * Engagement counters are null when the source does not report them.
 */
public record RawItem(ItemSource source,
                      String asset,
                      Instant timestamp,
                      String text,
                      String url,
                      Integer likes,
                      Integer reposts,
                      Integer replies) {

    public static RawItem of(ItemSource source, String asset, Instant timestamp, String text, String url) {
        return new RawItem(source, asset, timestamp, text, url, null, null, null);
    }

    public boolean hasEngagement() {
        return likes != null || reposts != null || replies != null;
    }
}
