package com.marketpulse.backend.service.indicator;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.model.Candle;
import com.marketpulse.backend.service.PulseStore;
import com.marketpulse.backend.util.TestCandleFactory;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TechnicalIndicatorEngineTest {

    private final PulseProperties properties = new PulseProperties();
    private final PulseStore pulseStore = mock(PulseStore.class);
    private final TechnicalIndicatorEngine engine = new TechnicalIndicatorEngine(properties, pulseStore,
            new RsiService(properties), new MacdService(properties), new AtrService(properties), new VwapService(properties));

    @Test
    void uptrendProducesFullSnapshot() {
        List<Candle> candles = TestCandleFactory.trendingCandles(60, 100, 0.5);

        TechnicalSnapshot snapshot = engine.compute(candles).orElseThrow();

        assertThat(snapshot.close()).isEqualTo(130.0);
        assertThat(snapshot.rsi14()).isEqualTo(100.0);
        assertThat(snapshot.macdHistogram()).isNotNull();
        assertThat(snapshot.atrPct()).isPositive();
        assertThat(snapshot.priceBias()).isPositive();
        assertThat(snapshot.trendBias()).isEqualTo(TechnicalSnapshot.TrendBias.UP);
        assertThat(snapshot.pctChange15m()).isEqualTo((130.0 - 122.5) / 122.5 * 100.0);
        assertThat(snapshot.pctChange1h()).isNull();
        assertThat(snapshot.breakout()).isEqualTo(1);
    }

    @Test
    void downtrendBreaksDown() {
        TechnicalSnapshot snapshot = engine.compute(TestCandleFactory.trendingCandles(60, 200, -0.5)).orElseThrow();

        assertThat(snapshot.trendBias()).isEqualTo(TechnicalSnapshot.TrendBias.DOWN);
        assertThat(snapshot.breakout()).isEqualTo(-1);
        assertThat(snapshot.rsi14()).isLessThan(1.0);
    }

    @Test
    void flatMarketIsNeutral() {
        TechnicalSnapshot snapshot = engine.compute(TestCandleFactory.flatCandles(40, 100)).orElseThrow();

        assertThat(snapshot.trendBias()).isEqualTo(TechnicalSnapshot.TrendBias.FLAT);
        assertThat(snapshot.breakout()).isZero();
        assertThat(snapshot.priceBias()).isEqualTo(0.0);
    }

    @Test
    void shortHistoryYieldsNothing() {
        assertThat(engine.compute(TestCandleFactory.flatCandles(10, 100))).isEmpty();
    }

    @Test
    void storeFailureYieldsNothing() {
        when(pulseStore.candles(anyString(), anyString(), any(), any())).thenThrow(new IllegalStateException("db down"));

        assertThat(engine.snapshotAt(Instant.parse("2024-05-01T12:00:00Z"))).isEmpty();
    }
}
