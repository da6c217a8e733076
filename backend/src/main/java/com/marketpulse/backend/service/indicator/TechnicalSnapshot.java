package com.marketpulse.backend.service.indicator;

import java.util.Locale;

/**
 * Price features at one tick. Individual fields are null when their indicator lacks history.
 */
public record TechnicalSnapshot(
        double close,
        Double rsi14,
        Double macd,
        Double macdSignal,
        Double macdHistogram,
        Double atrPct,
        Double vwap,
        Double priceBias,
        TrendBias trendBias,
        Double pctChange15m,
        Double pctChange1h,
        int breakout
) {

    public enum TrendBias {
        UP,
        DOWN,
        FLAT;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
