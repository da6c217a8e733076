package com.marketpulse.backend.service.ingest;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.dto.RawItem;
import com.marketpulse.backend.model.ItemSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class SpamRuleEvaluatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private PulseProperties properties;
    private SpamRuleEvaluator evaluator;

    @BeforeEach
    void setUp() {
        properties = new PulseProperties();
        evaluator = new SpamRuleEvaluator(properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void acceptsOrdinarySocialPost() {
        RawItem item = social("Ethereum staking inflows keep rising after the upgrade, $ETH looks strong", 10);

        SpamRuleEvaluator.SpamVerdict verdict = evaluator.evaluate(item, item.text());

        assertThat(verdict.accepted()).isTrue();
        assertThat(verdict.reasons()).isEmpty();
    }

    @Test
    void rejectsShillWithEveryMatchingReason() {
        String text = "HUGE $ETH AIRDROP GIVEAWAY JOIN TELEGRAM NOW $PEPE $DOGE #eth #crypto #moon";
        RawItem item = social(text, 0);

        SpamRuleEvaluator.SpamVerdict verdict = evaluator.evaluate(item, text);

        assertThat(verdict.accepted()).isFalse();
        assertThat(verdict.reasons()).contains("low_likes", "foreign_cashtag", "shouting");
        assertThat(verdict.reasons()).anyMatch(reason -> reason.startsWith("banned_keyword:"));
    }

    @Test
    void rejectsStaleOffTopicAndRepetitiveText() {
        RawItem stale = new RawItem(ItemSource.SOCIAL, "ETH-USD", NOW.minus(Duration.ofHours(5)),
                "Ethereum fees dropped sharply this week according to on-chain data", null, 50, 5, 5);
        assertThat(evaluator.evaluate(stale, stale.text()).reasons()).contains("stale");

        RawItem offTopic = social("Bitcoin miners are selling into the rally again this morning", 50);
        assertThat(evaluator.evaluate(offTopic, offTopic.text()).reasons()).contains("off_topic");

        RawItem repetitive = social("eth eth eth eth eth eth eth eth to the top guys", 50);
        assertThat(evaluator.evaluate(repetitive, repetitive.text()).reasons()).contains("repetitive_tokens");

        RawItem runs = social("Ethereum is going upppppppppppp today", 50);
        assertThat(evaluator.evaluate(runs, runs.text()).reasons()).contains("repeated_chars");
    }

    @Test
    void feedProfileIsLaxButStillChecksLength() {
        RawItem article = RawItem.of(ItemSource.FEED, "ETH-USD", NOW,
                "Bitcoin and Ether ETFs see record inflows as $BTC nears highs", "https://example.com/a");
        assertThat(evaluator.evaluate(article, article.text()).accepted()).isTrue();

        RawItem tiny = RawItem.of(ItemSource.FEED, "ETH-USD", NOW, "ETH up", null);
        assertThat(evaluator.evaluate(tiny, tiny.text()).reasons()).containsExactly("too_short");
    }

    @Test
    void thresholdsComeFromConfiguration() {
        properties.getSpam().getSocial().setMinLikes(0);
        properties.getSpam().getSocial().getBannedKeywords().clear();
        RawItem item = social("Ethereum giveaway results are in, thanks for joining everyone", 0);

        assertThat(evaluator.evaluate(item, item.text()).accepted()).isTrue();
    }

    @Test
    void baseSymbolStripsQuoteCurrency() {
        assertThat(SpamRuleEvaluator.baseSymbol("eth-usd")).isEqualTo("ETH");
        assertThat(SpamRuleEvaluator.baseSymbol("SOL")).isEqualTo("SOL");
    }

    private static RawItem social(String text, int likes) {
        return new RawItem(ItemSource.SOCIAL, "ETH-USD", NOW.minus(Duration.ofMinutes(5)), text, null, likes, 1, 1);
    }
}
