package com.marketpulse.backend.dto;

import java.time.Instant;

public record MentionPoint(Instant bucketStart, int count) {
}
