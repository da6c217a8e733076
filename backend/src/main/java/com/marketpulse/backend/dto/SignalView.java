package com.marketpulse.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketpulse.backend.model.Signal;

import java.time.Instant;

public record SignalView(
        Long id,
        String asset,
        Instant ts,
        double ema15,
        int mentions,
        @JsonProperty("baseline_7d") double baseline7d,
        double mentionsZ,
        double alpha,
        String action,
        Double priceClose,
        Double rsi14,
        Double macd,
        Double macdSignal,
        Double atrPct,
        Double priceBias,
        String trendBias
) {

    public static SignalView from(Signal signal) {
        return new SignalView(signal.getId(), signal.getAsset(), signal.getTs(), signal.getEma15(),
                signal.getMentions(), signal.getBaseline7d(), signal.getMentionsZ(), signal.getAlpha(),
                signal.getAction().wireName(), signal.getPriceClose(), signal.getRsi14(), signal.getMacd(),
                signal.getMacdSignal(), signal.getAtrPct(), signal.getPriceBias(), signal.getTrendBias());
    }
}
