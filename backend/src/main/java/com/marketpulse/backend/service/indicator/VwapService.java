package com.marketpulse.backend.service.indicator;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class VwapService {

    private final PulseProperties properties;

    /**
     * VWAP of the typical price over the trailing window ending at the last candle, and the
     * deviation of the last close from it in percent.
     */
    public Optional<VwapResult> calculate(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return Optional.empty();
        }
        Candle last = candles.get(candles.size() - 1);
        Instant from = last.getTimestamp()
                .minus(Duration.ofMinutes(properties.getPrices().getIndicators().getVwapWindowMinutes()));
        double priceVolume = 0.0;
        double volume = 0.0;
        for (int i = candles.size() - 1; i >= 0; i--) {
            Candle candle = candles.get(i);
            if (!candle.getTimestamp().isAfter(from)) {
                break;
            }
            priceVolume += candle.typicalPrice() * candle.getVolume();
            volume += candle.getVolume();
        }
        if (volume <= 0) {
            return Optional.empty();
        }
        double vwap = priceVolume / volume;
        return Optional.of(new VwapResult(vwap, (last.getClose() - vwap) / vwap * 100.0));
    }

    public record VwapResult(double vwap, double priceBiasPct) {}
}
