package com.marketpulse.backend.service.indicator;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * RSI with Wilder smoothing: simple average over the first period, then
 * {@code avg = (avg * (n - 1) + x) / n}.
 */
@Service
@RequiredArgsConstructor
public class RsiService {

    private final PulseProperties properties;

    public Optional<RsiResult> calculate(List<Candle> candles) {
        int period = properties.getPrices().getIndicators().getRsiPeriod();
        if (candles == null || candles.size() < period + 1) {
            return Optional.empty();
        }

        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = candles.get(i).getClose() - candles.get(i - 1).getClose();
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss += Math.abs(change);
            }
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < candles.size(); i++) {
            double change = candles.get(i).getClose() - candles.get(i - 1).getClose();
            double gain = Math.max(change, 0.0);
            double loss = Math.max(-change, 0.0);
            avgGain = ((avgGain * (period - 1)) + gain) / period;
            avgLoss = ((avgLoss * (period - 1)) + loss) / period;
        }

        if (avgLoss == 0) {
            return Optional.of(new RsiResult(avgGain == 0 ? 50.0 : 100.0));
        }
        double rs = avgGain / avgLoss;
        return Optional.of(new RsiResult(100.0 - (100.0 / (1.0 + rs))));
    }

    public record RsiResult(double rsi) {}
}
