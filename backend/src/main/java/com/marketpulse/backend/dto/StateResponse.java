package com.marketpulse.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketpulse.backend.service.loop.LoopStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
public class StateResponse {
    private String asset;
    private double ema15;
    @JsonProperty("mentions_15m")
    private int mentions15m;
    @JsonProperty("baseline_7d")
    private double baseline7d;
    private double mentionsZ;
    private double alpha;
    private String action;
    private Instant updatedAt;
    private Double priceClose;
    private Double rsi14;
    private Double atrPct;
    private Double priceBias;
    private String trendBias;
    private Map<String, ComponentHealth> health;
    private Map<String, LoopStatus> loops;
}
