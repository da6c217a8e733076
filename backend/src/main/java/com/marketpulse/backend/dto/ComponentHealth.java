package com.marketpulse.backend.dto;

import java.time.Instant;

public record ComponentHealth(Status status, String reason, Instant since) {

    public enum Status {
        OK,
        DEGRADED
    }
}
