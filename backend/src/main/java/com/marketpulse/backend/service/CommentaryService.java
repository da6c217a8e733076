package com.marketpulse.backend.service;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.dto.CommentaryResponse;
import com.marketpulse.backend.model.Item;
import com.marketpulse.backend.model.PriceCandle;
import com.marketpulse.backend.model.Signal;
import com.marketpulse.backend.service.oracle.LlmGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Short market commentary written by the LLM from current facts. A successful answer is
 * reused for the minimum refresh interval; when the LLM fails the last answer is served stale.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CommentaryService {

    private static final int MAX_ITEM_TEXT = 220;

    private final PulseProperties properties;
    private final PulseStore pulseStore;
    private final LlmGateway llmGateway;
    private final Clock clock;

    private CommentaryResponse cached;
    private Instant cachedAt;

    public synchronized CommentaryResponse commentary() {
        Instant now = clock.instant();
        Duration ttl = Duration.ofSeconds(properties.getCommentary().getMinRefreshSeconds());
        if (cached != null && cachedAt.plus(ttl).isAfter(now)) {
            return cached;
        }
        Map<String, Object> facts = loadFacts(now);
        String model = properties.getClassifier().getModel();
        if (!properties.getCommentary().isEnabled()) {
            return new CommentaryResponse("", facts, model, now, true, "disabled");
        }

        Optional<String> text = llmGateway.complete("commentary", prompt(facts), false)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
        if (text.isPresent()) {
            cached = new CommentaryResponse(text.get(), facts, model, now, false, null);
            cachedAt = now;
            return cached;
        }
        if (cached != null) {
            log.warn("Commentary refresh failed, serving the one from {}", cachedAt);
            return cached.asStale();
        }
        log.warn("Commentary unavailable and nothing cached");
        return new CommentaryResponse("", facts, model, now, true, "llm_unavailable");
    }

    Map<String, Object> loadFacts(Instant now) {
        Map<String, Object> facts = new LinkedHashMap<>();
        facts.put("now_utc", now.truncatedTo(ChronoUnit.SECONDS).toString());
        facts.put("asset", properties.getAsset());

        Optional<Signal> last = pulseStore.latestSignal(properties.getAsset());
        Map<String, Object> signal = new LinkedHashMap<>();
        signal.put("action", last.map(s -> s.getAction().wireName()).orElse("hold"));
        signal.put("ema15", last.map(Signal::getEma15).orElse(0.0));
        signal.put("mentions_15m", last.map(Signal::getMentions).orElse(0));
        signal.put("mentions_z", last.map(Signal::getMentionsZ).orElse(0.0));
        signal.put("alpha", last.map(Signal::getAlpha).orElse(0.0));
        signal.put("ts", last.map(s -> s.getTs().toString()).orElse(null));
        facts.put("signal", signal);

        PulseProperties.Prices prices = properties.getPrices();
        List<PriceCandle> candles = pulseStore.candles(prices.getSymbol(), prices.getTimeframe(),
                now.minus(Duration.ofMinutes(60)), now);
        Map<String, Object> price = new LinkedHashMap<>();
        if (candles.size() >= 2 && candles.get(0).getClose() > 0) {
            double first = candles.get(0).getClose();
            double lastClose = candles.get(candles.size() - 1).getClose();
            price.put("pct_change_60m", (lastClose / first - 1.0) * 100.0);
            price.put("last_close", lastClose);
        }
        facts.put("price", price);

        List<Map<String, Object>> sample = new ArrayList<>();
        for (Item item : pulseStore.recentRelevantItems(properties.getAsset(), now.minus(Duration.ofHours(6)),
                properties.getCommentary().getSampleItems())) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("ts", item.getTs().toString());
            entry.put("source", item.getSource().name().toLowerCase(Locale.ROOT));
            entry.put("score", item.getScore());
            entry.put("labels", item.getLlmLabels() == null ? "" : item.getLlmLabels());
            String text = item.getText() == null ? "" : item.getText();
            entry.put("text", text.length() > MAX_ITEM_TEXT ? text.substring(0, MAX_ITEM_TEXT) : text);
            sample.add(entry);
        }
        facts.put("items_sample", sample);
        return facts;
    }

    @SuppressWarnings("unchecked")
    static String prompt(Map<String, Object> facts) {
        StringBuilder context = new StringBuilder();
        context.append("now_utc: ").append(facts.get("now_utc")).append('\n');
        context.append("asset: ").append(facts.get("asset")).append('\n');
        Map<String, Object> signal = (Map<String, Object>) facts.get("signal");
        context.append(String.format(Locale.ROOT, "signal: action=%s ema15=%.2f mentions_15m=%s z=%.2f%n",
                signal.get("action"), ((Number) signal.get("ema15")).doubleValue(), signal.get("mentions_15m"),
                ((Number) signal.get("mentions_z")).doubleValue()));
        Map<String, Object> price = (Map<String, Object>) facts.get("price");
        if (price.containsKey("pct_change_60m")) {
            context.append(String.format(Locale.ROOT, "price: pct_change_60m=%.2f%% last=%.2f%n",
                    ((Number) price.get("pct_change_60m")).doubleValue(), ((Number) price.get("last_close")).doubleValue()));
        }
        for (Map<String, Object> item : (List<Map<String, Object>>) facts.get("items_sample")) {
            context.append(String.format(Locale.ROOT, "- [%s %s] score=%.2f labels=%s text=%s%n",
                    item.get("ts"), item.get("source"), ((Number) item.get("score")).doubleValue(),
                    item.get("labels"), item.get("text")));
        }
        return "You are a crypto market assistant. Summarize the current state of the asset in at most 5 "
                + "bullet points, combining sentiment, momentum and news flow. Be specific and concise. "
                + "End with one line stating the current bias (bullish/neutral/bearish). Answer in Markdown "
                + "only, without preamble.\n\nContext:\n" + context;
    }
}
