package com.marketpulse.backend.service.indicator;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.model.Candle;
import com.marketpulse.backend.model.PriceCandle;
import com.marketpulse.backend.service.PulseStore;
import com.marketpulse.backend.util.Timeframes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Derives the technical feature set from stored candles. Missing or short price history
 * yields no snapshot, and the signal is then computed from sentiment alone.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TechnicalIndicatorEngine {

    private final PulseProperties properties;
    private final PulseStore pulseStore;
    private final RsiService rsiService;
    private final MacdService macdService;
    private final AtrService atrService;
    private final VwapService vwapService;

    public Optional<TechnicalSnapshot> snapshotAt(Instant now) {
        PulseProperties.Prices prices = properties.getPrices();
        try {
            Instant from = now.minus(Duration.ofMinutes(prices.getLookbackMinutes()));
            List<Candle> candles = pulseStore.candles(prices.getSymbol(), prices.getTimeframe(), from, now).stream()
                    .map(PriceCandle::toCandle)
                    .toList();
            return compute(candles);
        } catch (RuntimeException ex) {
            log.warn("Technical indicators unavailable: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    public Optional<TechnicalSnapshot> compute(List<Candle> candles) {
        PulseProperties.Prices prices = properties.getPrices();
        if (candles == null || candles.size() < prices.getMinCandles()) {
            return Optional.empty();
        }
        PulseProperties.Indicators config = prices.getIndicators();
        double close = candles.get(candles.size() - 1).getClose();

        Optional<MacdService.MacdResult> macd = macdService.calculate(candles);
        Optional<VwapService.VwapResult> vwap = vwapService.calculate(candles);
        String timeframe = prices.getTimeframe();
        return Optional.of(new TechnicalSnapshot(
                close,
                rsiService.calculate(candles).map(RsiService.RsiResult::rsi).orElse(null),
                macd.map(MacdService.MacdResult::macdLine).orElse(null),
                macd.map(MacdService.MacdResult::signalLine).orElse(null),
                macd.map(MacdService.MacdResult::histogram).orElse(null),
                atrService.calculate(candles).map(AtrService.AtrResult::atrPercent).orElse(null),
                vwap.map(VwapService.VwapResult::vwap).orElse(null),
                vwap.map(VwapService.VwapResult::priceBiasPct).orElse(null),
                trendBias(candles, config),
                pctChange(candles, Timeframes.candlesIn(Duration.ofMinutes(15), timeframe)),
                pctChange(candles, Timeframes.candlesIn(Duration.ofHours(1), timeframe)),
                breakout(candles, config, Timeframes.candlesIn(Duration.ofMinutes(config.getBreakoutWindowMinutes()), timeframe))
        ));
    }

    /**
     * Slope of the trend EMA over its last five points, in percent.
     */
    TechnicalSnapshot.TrendBias trendBias(List<Candle> candles, PulseProperties.Indicators config) {
        List<Double> closes = candles.stream().map(Candle::getClose).toList();
        List<Double> ema = MacdService.emaSeries(closes, config.getTrendEmaPeriod());
        int last = ema.size() - 1;
        int back = last - 5;
        if (back < 0 || ema.get(back) == null || ema.get(last) == null || ema.get(back) == 0) {
            return TechnicalSnapshot.TrendBias.FLAT;
        }
        double slopePct = (ema.get(last) - ema.get(back)) / ema.get(back) * 100.0;
        if (slopePct >= config.getTrendSlopePct()) {
            return TechnicalSnapshot.TrendBias.UP;
        }
        if (slopePct <= -config.getTrendSlopePct()) {
            return TechnicalSnapshot.TrendBias.DOWN;
        }
        return TechnicalSnapshot.TrendBias.FLAT;
    }

    Double pctChange(List<Candle> candles, int steps) {
        int last = candles.size() - 1;
        if (last - steps < 0) {
            return null;
        }
        double reference = candles.get(last - steps).getClose();
        if (reference <= 0) {
            return null;
        }
        return (candles.get(last).getClose() - reference) / reference * 100.0;
    }

    /**
     * +1 when the last close clears the prior window's high by the margin, -1 below its low.
     */
    int breakout(List<Candle> candles, PulseProperties.Indicators config, int window) {
        int last = candles.size() - 1;
        int start = Math.max(0, last - window);
        if (start >= last) {
            return 0;
        }
        double high = Double.NEGATIVE_INFINITY;
        double low = Double.POSITIVE_INFINITY;
        for (int i = start; i < last; i++) {
            high = Math.max(high, candles.get(i).getHigh());
            low = Math.min(low, candles.get(i).getLow());
        }
        double close = candles.get(last).getClose();
        double margin = config.getBreakoutMarginPct() / 100.0;
        if (close > high * (1 + margin)) {
            return 1;
        }
        if (close < low * (1 - margin)) {
            return -1;
        }
        return 0;
    }
}
