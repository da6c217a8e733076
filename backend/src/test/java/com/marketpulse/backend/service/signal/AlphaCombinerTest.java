package com.marketpulse.backend.service.signal;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.model.SignalAction;
import com.marketpulse.backend.service.indicator.TechnicalSnapshot;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AlphaCombinerTest {

    private final PulseProperties properties = new PulseProperties();
    private final AlphaCombiner combiner = new AlphaCombiner(properties);

    @Test
    void sentimentOnlyCombination() {
        AlphaResult result = combiner.combine(FeatureVector.sentimentOnly(0.825, 2.0));

        assertThat(result.contributions()).containsOnlyKeys(AlphaCombiner.SENTIMENT, AlphaCombiner.MENTIONS);
        assertThat(result.alpha()).isCloseTo(0.30 * 0.825 + 0.35, within(1e-9));
        assertThat(result.multiplier()).isEqualTo(1.0);
        assertThat(new DecisionPolicy(properties).decide(result.alpha(), null)).isEqualTo(SignalAction.ACCUMULATE);
    }

    @Test
    void alphaIsMonotoneInSentimentAndMentions() {
        double previous = -2.0;
        for (double ema = -1.0; ema <= 1.0; ema += 0.1) {
            double alpha = combiner.combine(FeatureVector.sentimentOnly(ema, 0.0)).alpha();
            assertThat(alpha).isGreaterThanOrEqualTo(previous);
            previous = alpha;
        }
        previous = -2.0;
        for (double z = -4.0; z <= 4.0; z += 0.5) {
            double alpha = combiner.combine(FeatureVector.sentimentOnly(0.2, z)).alpha();
            assertThat(alpha).isGreaterThanOrEqualTo(previous);
            previous = alpha;
        }
    }

    @Test
    void uptrendAmplifiesOnlyPositiveAlpha() {
        AlphaResult bullish = combiner.combine(new FeatureVector(0.5, 0.0, technical(TechnicalSnapshot.TrendBias.UP, null)));
        AlphaResult bearish = combiner.combine(new FeatureVector(-0.5, 0.0, technical(TechnicalSnapshot.TrendBias.UP, null)));

        assertThat(bullish.multiplier()).isEqualTo(1.15);
        assertThat(bullish.alpha()).isCloseTo(0.15 * 1.15, within(1e-9));
        assertThat(bearish.multiplier()).isEqualTo(1.0);
        assertThat(bearish.alpha()).isCloseTo(-0.15, within(1e-9));
    }

    @Test
    void highVolatilityDampens() {
        AlphaResult high = combiner.combine(new FeatureVector(0.5, 0.0, technical(TechnicalSnapshot.TrendBias.FLAT, 2.5)));
        AlphaResult extreme = combiner.combine(new FeatureVector(0.5, 0.0, technical(TechnicalSnapshot.TrendBias.FLAT, 5.0)));

        assertThat(high.multiplier()).isEqualTo(0.85);
        assertThat(extreme.multiplier()).isEqualTo(0.7);
    }

    @Test
    void alphaIsClampedToUnitRange() {
        TechnicalSnapshot hot = new TechnicalSnapshot(100.0, 20.0, 1.0, 0.5, 0.5, 1.0, 98.0, 2.0,
                TechnicalSnapshot.TrendBias.UP, 1.0, 2.0, 1);

        AlphaResult result = combiner.combine(new FeatureVector(1.0, 4.0, hot));

        assertThat(result.raw()).isGreaterThan(0.9);
        assertThat(result.alpha()).isEqualTo(1.0);
        assertThat(result.contributions()).containsKeys(AlphaCombiner.MOMENTUM, AlphaCombiner.RSI,
                AlphaCombiner.MACD, AlphaCombiner.VWAP, AlphaCombiner.BREAKOUT);
    }

    @Test
    void missingTechnicalFieldsContributeNothing() {
        AlphaResult result = combiner.combine(new FeatureVector(0.0, 0.0, technical(TechnicalSnapshot.TrendBias.FLAT, null)));

        assertThat(result.contributions()).doesNotContainKeys(AlphaCombiner.MOMENTUM, AlphaCombiner.MACD, AlphaCombiner.VWAP);
        assertThat(result.alpha()).isZero();
    }

    @Test
    void rsiReadsAsMeanReversion() {
        assertThat(AlphaCombiner.rsiScore(15)).isCloseTo(0.5, within(1e-9));
        assertThat(AlphaCombiner.rsiScore(85)).isCloseTo(-0.5, within(1e-9));
        assertThat(AlphaCombiner.rsiScore(50)).isZero();
    }

    private static TechnicalSnapshot technical(TechnicalSnapshot.TrendBias trend, Double atrPct) {
        return new TechnicalSnapshot(100.0, 50.0, null, null, null, atrPct, null, null, trend, null, null, 0);
    }
}
