package com.marketpulse.backend.service.indicator;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class AtrService {

    private final PulseProperties properties;

    /**
     * Wilder ATR and ATR as a percentage of the last close.
     */
    public Optional<AtrResult> calculate(List<Candle> candles) {
        int period = properties.getPrices().getIndicators().getAtrPeriod();
        if (candles == null || candles.size() < period + 1) {
            return Optional.empty();
        }
        List<Double> tr = new ArrayList<>();
        for (int i = 1; i < candles.size(); i++) {
            Candle curr = candles.get(i);
            Candle prev = candles.get(i - 1);
            tr.add(Math.max(curr.getHigh() - curr.getLow(),
                    Math.max(Math.abs(curr.getHigh() - prev.getClose()), Math.abs(curr.getLow() - prev.getClose()))));
        }
        double atr = tr.subList(0, period).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        for (int i = period; i < tr.size(); i++) {
            atr = ((atr * (period - 1)) + tr.get(i)) / period;
        }
        double lastClose = candles.get(candles.size() - 1).getClose();
        if (lastClose <= 0) {
            return Optional.empty();
        }
        return Optional.of(new AtrResult(atr, atr / lastClose * 100.0));
    }

    public record AtrResult(double atr, double atrPercent) {}
}
