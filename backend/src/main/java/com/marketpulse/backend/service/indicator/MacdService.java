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
public class MacdService {

    private final PulseProperties properties;

    public Optional<MacdResult> calculate(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return Optional.empty();
        }
        PulseProperties.Indicators config = properties.getPrices().getIndicators();
        int fast = config.getMacdFast();
        int slow = config.getMacdSlow();
        int signal = config.getMacdSignal();

        List<Double> closes = candles.stream().map(Candle::getClose).toList();
        List<Double> fastSeries = emaSeries(closes, fast);
        List<Double> slowSeries = emaSeries(closes, slow);

        List<Double> macdSeries = new ArrayList<>();
        for (int i = 0; i < closes.size(); i++) {
            Double fastVal = fastSeries.get(i);
            Double slowVal = slowSeries.get(i);
            if (fastVal != null && slowVal != null) {
                macdSeries.add(fastVal - slowVal);
            }
        }

        if (macdSeries.size() < signal) {
            return Optional.empty();
        }

        List<Double> signalSeries = emaSeries(macdSeries, signal);
        double macdLine = macdSeries.get(macdSeries.size() - 1);
        double signalLine = signalSeries.get(signalSeries.size() - 1);
        return Optional.of(new MacdResult(macdLine, signalLine, macdLine - signalLine));
    }

    /**
     * EMA seeded with the SMA of the first {@code period} values; earlier positions are null.
     */
    static List<Double> emaSeries(List<Double> values, int period) {
        List<Double> emaSeries = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            emaSeries.add(null);
        }
        if (values.size() < period) {
            return emaSeries;
        }
        double sma = values.subList(0, period).stream().mapToDouble(d -> d).average().orElse(0.0);
        emaSeries.set(period - 1, sma);
        double k = 2.0 / (period + 1);
        double ema = sma;
        for (int i = period; i < values.size(); i++) {
            ema = (values.get(i) * k) + (ema * (1 - k));
            emaSeries.set(i, ema);
        }
        return emaSeries;
    }

    public record MacdResult(double macdLine, double signalLine, double histogram) {}
}
