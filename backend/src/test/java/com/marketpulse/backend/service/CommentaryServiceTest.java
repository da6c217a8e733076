package com.marketpulse.backend.service;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.dto.CommentaryResponse;
import com.marketpulse.backend.model.Item;
import com.marketpulse.backend.model.ItemSource;
import com.marketpulse.backend.model.PriceCandle;
import com.marketpulse.backend.model.Signal;
import com.marketpulse.backend.model.SignalAction;
import com.marketpulse.backend.service.oracle.LlmGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CommentaryServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private PulseProperties properties;
    private PulseStore pulseStore;
    private LlmGateway llmGateway;
    private MutableClock clock;
    private CommentaryService service;

    @BeforeEach
    void setUp() {
        properties = new PulseProperties();
        pulseStore = mock(PulseStore.class);
        llmGateway = mock(LlmGateway.class);
        clock = new MutableClock(NOW);
        service = new CommentaryService(properties, pulseStore, llmGateway, clock);

        Signal signal = Signal.builder().asset("ETH-USD").ts(NOW.minusSeconds(30)).ema15(0.41).mentions(9)
                .mentionsZ(1.8).alpha(0.37).action(SignalAction.ACCUMULATE).build();
        when(pulseStore.latestSignal("ETH-USD")).thenReturn(Optional.of(signal));
        when(pulseStore.candles(eq("ETHUSDT"), eq("1m"), any(), any())).thenReturn(List.of(
                PriceCandle.builder().close(3000).build(),
                PriceCandle.builder().close(3030).build()));
        when(pulseStore.recentRelevantItems(eq("ETH-USD"), any(), anyInt())).thenReturn(List.of(
                Item.builder().id("a").source(ItemSource.SOCIAL).ts(NOW.minusSeconds(120))
                        .text("x".repeat(300)).score(0.6).llmLabels("staking").build()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void factsSummarizeSignalPriceAndItems() {
        Map<String, Object> facts = service.loadFacts(NOW);

        assertThat(facts).containsEntry("asset", "ETH-USD").containsEntry("now_utc", "2024-05-01T12:00:00Z");
        assertThat((Map<String, Object>) facts.get("signal"))
                .containsEntry("action", "accumulate")
                .containsEntry("mentions_15m", 9);
        assertThat((Map<String, Object>) facts.get("price"))
                .containsEntry("last_close", 3030.0)
                .hasEntrySatisfying("pct_change_60m", value -> assertThat((Double) value).isCloseTo(1.0, within(1e-9)));
        List<Map<String, Object>> sample = (List<Map<String, Object>>) facts.get("items_sample");
        assertThat(sample).singleElement().satisfies(item -> {
            assertThat(item).containsEntry("source", "social").containsEntry("labels", "staking");
            assertThat((String) item.get("text")).hasSize(220);
        });
    }

    @Test
    void promptCarriesTheFacts() {
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        when(llmGateway.complete(eq("commentary"), prompt.capture(), eq(false))).thenReturn(Optional.of(" - bullish "));

        CommentaryResponse response = service.commentary();

        assertThat(response.commentary()).isEqualTo("- bullish");
        assertThat(response.stale()).isFalse();
        assertThat(response.error()).isNull();
        assertThat(prompt.getValue())
                .contains("asset: ETH-USD")
                .contains("signal: action=accumulate ema15=0.41 mentions_15m=9 z=1.80")
                .contains("price: pct_change_60m=1.00% last=3030.00");
    }

    @Test
    void answerIsReusedWithinRefreshInterval() {
        when(llmGateway.complete(anyString(), anyString(), anyBoolean())).thenReturn(Optional.of("first"));

        service.commentary();
        clock.advanceSeconds(30);
        CommentaryResponse second = service.commentary();

        assertThat(second.commentary()).isEqualTo("first");
        verify(llmGateway, times(1)).complete(anyString(), anyString(), anyBoolean());
    }

    @Test
    void failedRefreshServesStaleAnswer() {
        when(llmGateway.complete(anyString(), anyString(), anyBoolean()))
                .thenReturn(Optional.of("first"))
                .thenReturn(Optional.empty());

        service.commentary();
        clock.advanceSeconds(120);
        CommentaryResponse stale = service.commentary();

        assertThat(stale.commentary()).isEqualTo("first");
        assertThat(stale.stale()).isTrue();
        assertThat(stale.generatedAt()).isEqualTo(NOW);
    }

    @Test
    void nothingCachedReportsUnavailable() {
        when(llmGateway.complete(anyString(), anyString(), anyBoolean())).thenReturn(Optional.of("   "));

        CommentaryResponse response = service.commentary();

        assertThat(response.commentary()).isEmpty();
        assertThat(response.stale()).isTrue();
        assertThat(response.error()).isEqualTo("llm_unavailable");
    }

    @Test
    void disabledCommentarySkipsTheLlm() {
        properties.getCommentary().setEnabled(false);

        CommentaryResponse response = service.commentary();

        assertThat(response.error()).isEqualTo("disabled");
        assertThat(response.facts()).containsKey("signal");
        verify(llmGateway, never()).complete(anyString(), anyString(), anyBoolean());
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advanceSeconds(long seconds) {
            now = now.plusSeconds(seconds);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
