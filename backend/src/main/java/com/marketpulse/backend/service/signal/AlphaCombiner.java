package com.marketpulse.backend.service.signal;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.service.indicator.TechnicalSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Weighted combination of normalized features into alpha in [-1, 1]. Technical features that
 * are missing contribute nothing; the remaining weights are not rescaled.
 */
@Component
@RequiredArgsConstructor
public class AlphaCombiner {

    public static final String SENTIMENT = "sentiment";
    public static final String MENTIONS = "mentions";
    public static final String MOMENTUM = "momentum";
    public static final String RSI = "rsi";
    public static final String MACD = "macd";
    public static final String VWAP = "vwap";
    public static final String BREAKOUT = "breakout";
    public static final Set<String> FEATURES = Set.of(SENTIMENT, MENTIONS, MOMENTUM, RSI, MACD, VWAP, BREAKOUT);

    private final PulseProperties properties;

    public AlphaResult combine(FeatureVector features) {
        Map<String, Double> normalized = normalize(features);
        Map<String, Double> weights = properties.getSignal().getWeights();
        Map<String, Double> contributions = new LinkedHashMap<>();
        double raw = 0.0;
        for (Map.Entry<String, Double> entry : normalized.entrySet()) {
            double weight = weights.getOrDefault(entry.getKey(), 0.0);
            double contribution = weight * entry.getValue();
            contributions.put(entry.getKey(), contribution);
            raw += contribution;
        }
        double multiplier = multiplier(features.technical(), raw);
        double alpha = clamp(raw * multiplier);
        return new AlphaResult(alpha, raw, multiplier, contributions);
    }

    Map<String, Double> normalize(FeatureVector features) {
        PulseProperties.Scales scales = properties.getSignal().getScales();
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(SENTIMENT, clamp(features.ema15()));
        values.put(MENTIONS, clamp(features.mentionsZ() / scales.getMentionsZ()));
        TechnicalSnapshot technical = features.technical();
        if (technical == null) {
            return values;
        }
        if (technical.pctChange15m() != null || technical.pctChange1h() != null) {
            double m15 = technical.pctChange15m() == null ? 0.0 : technical.pctChange15m() / scales.getMomentum15mPct();
            double m1h = technical.pctChange1h() == null ? 0.0 : technical.pctChange1h() / scales.getMomentum1hPct();
            values.put(MOMENTUM, clamp(0.6 * m15 + 0.4 * m1h));
        }
        if (technical.rsi14() != null) {
            values.put(RSI, rsiScore(technical.rsi14()));
        }
        if (technical.macdHistogram() != null && technical.close() > 0) {
            double histogramPct = technical.macdHistogram() / technical.close() * 100.0;
            values.put(MACD, clamp(histogramPct / scales.getMacdHistogramPct()));
        }
        if (technical.priceBias() != null) {
            values.put(VWAP, clamp(technical.priceBias() / scales.getVwapBiasPct()));
        }
        values.put(BREAKOUT, (double) Integer.signum(technical.breakout()));
        return values;
    }

    /**
     * Mean-reversion reading: oversold is positive, overbought negative, neutral band is zero.
     */
    static double rsiScore(double rsi) {
        if (rsi < 30) {
            return (30 - rsi) / 30.0;
        }
        if (rsi > 70) {
            return -(rsi - 70) / 30.0;
        }
        return 0.0;
    }

    private double multiplier(TechnicalSnapshot technical, double raw) {
        if (technical == null) {
            return 1.0;
        }
        PulseProperties.Multipliers config = properties.getSignal().getMultipliers();
        double multiplier = 1.0;
        if (raw > 0 && technical.trendBias() == TechnicalSnapshot.TrendBias.UP) {
            multiplier *= config.getTrendUp();
        } else if (raw > 0 && technical.trendBias() == TechnicalSnapshot.TrendBias.DOWN) {
            multiplier *= config.getTrendDown();
        }
        Double atrPct = technical.atrPct();
        if (atrPct != null) {
            if (atrPct > config.getAtrExtremePct()) {
                multiplier *= config.getAtrExtreme();
            } else if (atrPct > config.getAtrHighPct()) {
                multiplier *= config.getAtrHigh();
            }
        }
        return multiplier;
    }

    private static double clamp(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, value));
    }
}
