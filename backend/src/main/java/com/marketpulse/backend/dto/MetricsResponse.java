package com.marketpulse.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class MetricsResponse {
    private long itemsTotal;
    private long signalsTotal;
    @JsonProperty("items_last_15m")
    private long itemsLast15m;
    @JsonProperty("avg_score_1h")
    private Double avgScore1h;
    private long eventsLatestId;
    private int eventSubscribers;
    private CounterSnapshot counters;
}
