package com.marketpulse.backend.service.impact;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.event.EventBusService;
import com.marketpulse.backend.event.EventType;
import com.marketpulse.backend.exception.InsufficientPriceHistoryException;
import com.marketpulse.backend.model.Candle;
import com.marketpulse.backend.model.Item;
import com.marketpulse.backend.model.PriceCandle;
import com.marketpulse.backend.service.MetricsService;
import com.marketpulse.backend.service.PulseStore;
import com.marketpulse.backend.util.Timeframes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores how the price moved after each item, at +15m and +60m, normalized by recent
 * volatility. Each horizon is written at most once; items whose future candles are not
 * there yet, or fall in a hole of the price history, stay pending for a later run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ImpactService {

    static final Duration HORIZON_15M = Duration.ofMinutes(15);
    static final Duration HORIZON_60M = Duration.ofMinutes(60);

    private static final TypeReference<LinkedHashMap<String, Object>> META_TYPE = new TypeReference<>() {
    };

    private final PulseProperties properties;
    private final PulseStore pulseStore;
    private final EventBusService eventBusService;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @return number of horizon values written in this run
     */
    public int runOnce() {
        try {
            return process();
        } catch (InsufficientPriceHistoryException ex) {
            metricsService.recordImpactDeferred();
            log.info("Impact deferred: {}", ex.getMessage());
            return 0;
        }
    }

    int process() {
        PulseProperties.Impact config = properties.getImpact();
        Instant now = clock.instant();
        List<Item> pending = pulseStore.pendingImpact(properties.getAsset(),
                now.minus(Duration.ofHours(config.getMaxAgeHours())), now.minus(HORIZON_15M), config.getBatchSize());
        if (pending.isEmpty()) {
            return 0;
        }

        PulseProperties.Prices prices = properties.getPrices();
        Instant from = pending.get(0).getTs().minus(Duration.ofHours(6));
        Instant to = pending.get(pending.size() - 1).getTs().plus(Duration.ofHours(3));
        List<Candle> candles = pulseStore.candles(prices.getSymbol(), prices.getTimeframe(), from, to).stream()
                .map(PriceCandle::toCandle)
                .toList();
        if (candles.size() < config.getMinCandles()) {
            throw new InsufficientPriceHistoryException(candles.size(), config.getMinCandles());
        }

        int written = 0;
        for (Item item : pending) {
            written += scoreItem(item, candles);
        }
        if (written > 0) {
            eventBusService.publish(EventType.ITEM, written + " impacts computed",
                    Map.of("count", written, "source", "impact"));
        }
        log.info("Impact run pending={} written={}", pending.size(), written);
        return written;
    }

    private int scoreItem(Item item, List<Candle> candles) {
        String timeframe = properties.getPrices().getTimeframe();
        int anchor = anchorIndex(candles, item.getTs());
        // the anchor must be the candle covering the item, not one after a hole in the history
        if (anchor < 0 || !candles.get(anchor).getTimestamp().isBefore(item.getTs().plus(Timeframes.parse(timeframe)))) {
            return 0;
        }
        PulseProperties.Impact config = properties.getImpact();
        Map<String, Object> meta = readMeta(item.getImpactMeta());
        double p0 = candles.get(anchor).getClose();
        int written = 0;

        if (item.getImpact() == null) {
            Horizon h15 = horizon(candles, anchor, HORIZON_15M, config.getFallbackSigma15());
            if (h15 != null) {
                meta.put("symbol", properties.getPrices().getSymbol());
                meta.put("timeframe", timeframe);
                meta.put("p0", p0);
                meta.put("p15", h15.price());
                meta.put("ret_15m", h15.ret());
                meta.put("sigma15", h15.sigma());
                meta.put("norm_15m", h15.norm());
                if (pulseStore.writeImpact15m(item.getId(), h15.norm(), writeMeta(meta))) {
                    metricsService.recordImpactWritten("15m");
                    written++;
                }
            }
        }
        if (item.getImpact60m() == null) {
            Horizon h60 = horizon(candles, anchor, HORIZON_60M, config.getFallbackSigma60());
            if (h60 != null) {
                meta.put("p0", p0);
                meta.put("p60", h60.price());
                meta.put("ret_60m", h60.ret());
                meta.put("sigma60", h60.sigma());
                meta.put("norm60", h60.norm());
                meta.put("computed_at", clock.instant().toString());
                if (pulseStore.writeImpact60m(item.getId(), h60.norm(), writeMeta(meta))) {
                    metricsService.recordImpactWritten("60m");
                    written++;
                }
            }
        }
        return written;
    }

    /**
     * Return and normalized impact between the anchor and the candle exactly {@code span} later,
     * or null while that candle is missing or still forming.
     */
    Horizon horizon(List<Candle> candles, int anchor, Duration span, double fallbackSigma) {
        String timeframe = properties.getPrices().getTimeframe();
        Duration step = Timeframes.parse(timeframe);
        int steps = Timeframes.candlesIn(span, timeframe);
        Instant targetTs = candles.get(anchor).getTimestamp().plus(step.multipliedBy(steps));
        int target = anchorIndex(candles, targetTs);
        if (target < 0 || !candles.get(target).getTimestamp().equals(targetTs)) {
            return null;
        }
        if (targetTs.plus(step).isAfter(clock.instant())) {
            return null;
        }
        double p0 = candles.get(anchor).getClose();
        double ph = candles.get(target).getClose();
        if (p0 <= 0 || ph <= 0) {
            return null;
        }
        double ret = ph / p0 - 1.0;
        double sigma = sigma(candles, anchor, steps, properties.getImpact().getVolatilityWindowCandles());
        if (!(sigma > 0)) {
            sigma = fallbackSigma;
        }
        double norm = Math.max(-1.0, Math.min(1.0, ret / (2.0 * sigma)));
        return new Horizon(ph, ret, sigma, norm);
    }

    /**
     * Sample stddev of {@code steps}-candle returns inside the window that ends at the anchor.
     */
    static double sigma(List<Candle> candles, int anchor, int steps, int window) {
        int start = Math.max(0, anchor - window);
        List<Double> returns = new ArrayList<>();
        for (int i = start; i + steps <= anchor; i++) {
            double a = candles.get(i).getClose();
            double b = candles.get(i + steps).getClose();
            if (a > 0 && b > 0) {
                returns.add(b / a - 1.0);
            }
        }
        if (returns.size() < 2) {
            return 0.0;
        }
        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = 0.0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        return Math.sqrt(variance / (returns.size() - 1));
    }

    /**
     * Index of the first candle at or after {@code ts}, or -1.
     */
    static int anchorIndex(List<Candle> candles, Instant ts) {
        int low = 0;
        int high = candles.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (candles.get(mid).getTimestamp().isBefore(ts)) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low < candles.size() ? low : -1;
    }

    private Map<String, Object> readMeta(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, META_TYPE);
        } catch (JsonProcessingException ex) {
            log.warn("Unreadable impact_meta, keeping it under 'previous': {}", ex.getOriginalMessage());
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("previous", json);
            return meta;
        }
    }

    private String writeMeta(Map<String, Object> meta) {
        try {
            return objectMapper.writeValueAsString(meta);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize impact meta", ex);
        }
    }

    record Horizon(double price, double ret, double sigma, double norm) {
    }
}
