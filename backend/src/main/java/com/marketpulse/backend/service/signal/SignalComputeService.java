package com.marketpulse.backend.service.signal;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.event.EventBusService;
import com.marketpulse.backend.event.EventType;
import com.marketpulse.backend.model.Signal;
import com.marketpulse.backend.model.SignalAction;
import com.marketpulse.backend.service.MetricsService;
import com.marketpulse.backend.service.PulseStore;
import com.marketpulse.backend.service.indicator.TechnicalIndicatorEngine;
import com.marketpulse.backend.service.indicator.TechnicalSnapshot;
import com.marketpulse.backend.service.notify.NotificationSink;
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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One signal tick per asset: aggregate, indicators, combine, decide, persist, publish.
 * Ticks for the same asset never overlap; a tick that finds the asset busy is skipped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SignalComputeService {

    private final PulseProperties properties;
    private final RollingAggregator rollingAggregator;
    private final TechnicalIndicatorEngine technicalIndicatorEngine;
    private final AlphaCombiner alphaCombiner;
    private final DecisionPolicy decisionPolicy;
    private final PulseStore pulseStore;
    private final EventBusService eventBusService;
    private final NotificationSink notificationSink;
    private final MetricsService metricsService;
    private final Clock clock;

    private final Map<String, ReentrantLock> tickLocks = new ConcurrentHashMap<>();
    private final Map<String, SignalAction> lastActions = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastEmitted = new ConcurrentHashMap<>();

    public Optional<SignalTick> computeTick(String asset, Instant now) {
        ReentrantLock lock = tickLocks.computeIfAbsent(asset, key -> new ReentrantLock());
        if (!lock.tryLock()) {
            log.warn("Signal tick for {} still running, skipping this one", asset);
            metricsService.recordTickOverlap();
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(runTick(asset, now.truncatedTo(ChronoUnit.SECONDS)));
        } finally {
            lock.unlock();
        }
    }

    public Optional<SignalTick> computeTick() {
        return computeTick(properties.getAsset(), clock.instant());
    }

    private SignalTick runTick(String asset, Instant ts) {
        AggregateSnapshot aggregate = rollingAggregator.aggregate(asset, ts);
        TechnicalSnapshot technical = properties.getPrices().isEnabled()
                ? technicalIndicatorEngine.snapshotAt(ts).orElse(null)
                : null;
        AlphaResult alpha = alphaCombiner.combine(new FeatureVector(aggregate.ema15(), aggregate.mentionsZ(), technical));

        SignalAction previous = previousAction(asset);
        SignalAction action = decisionPolicy.decide(alpha.alpha(), previous);

        Signal signal = Signal.builder()
                .asset(asset)
                .ts(ts)
                .ema15(aggregate.ema15())
                .mentions(aggregate.mentions())
                .baseline7d(aggregate.baselineMean())
                .mentionsZ(aggregate.mentionsZ())
                .alpha(alpha.alpha())
                .action(action)
                .priceClose(technical == null ? null : technical.close())
                .rsi14(technical == null ? null : technical.rsi14())
                .macd(technical == null ? null : technical.macd())
                .macdSignal(technical == null ? null : technical.macdSignal())
                .atrPct(technical == null ? null : technical.atrPct())
                .priceBias(technical == null ? null : technical.priceBias())
                .trendBias(technical == null || technical.trendBias() == null ? null : technical.trendBias().wireName())
                .createdAt(clock.instant())
                .build();

        if (pulseStore.appendSignal(signal) == PulseStore.AppendOutcome.DUPLICATE) {
            log.debug("Signal for {} at {} already recorded", asset, ts);
            return null;
        }
        lastActions.put(asset, action);
        metricsService.recordSignal(alpha.alpha());
        SignalTick tick = new SignalTick(signal, aggregate, alpha, technical);
        log.info("Signal asset={} ema15={} mentions={} z={} alpha={} action={}", asset,
                format(aggregate.ema15()), aggregate.mentions(), format(aggregate.mentionsZ()),
                format(alpha.alpha()), action.wireName());

        boolean changed = previous != null && previous != action;
        if (shouldEmit(asset, ts, changed, alpha.alpha())) {
            eventBusService.publish(EventType.SIGNAL, summary(signal), payload(tick, previous));
            lastEmitted.put(asset, ts);
        }
        if (changed) {
            notifyChange(previous, action, tick);
        }
        return tick;
    }

    private SignalAction previousAction(String asset) {
        SignalAction cached = lastActions.get(asset);
        if (cached != null) {
            return cached;
        }
        return pulseStore.latestSignal(asset).map(Signal::getAction).orElse(null);
    }

    /**
     * Emission is rate limited per asset unless the action changed or alpha is in the strong band.
     */
    boolean shouldEmit(String asset, Instant ts, boolean actionChanged, double alpha) {
        if (actionChanged || Math.abs(alpha) >= properties.getSignal().getEmit().getStrongAlpha()) {
            return true;
        }
        Instant last = lastEmitted.get(asset);
        Duration minInterval = Duration.ofSeconds(properties.getSignal().getEmit().getMinIntervalSeconds());
        return last == null || !ts.isBefore(last.plus(minInterval));
    }

    private void notifyChange(SignalAction previous, SignalAction current, SignalTick tick) {
        try {
            notificationSink.notifyActionChange(previous, current, tick);
        } catch (RuntimeException ex) {
            metricsService.recordNotificationFailure();
            log.warn("Notification for {} -> {} failed: {}", previous, current, ex.getMessage());
        }
    }

    private static String summary(Signal signal) {
        return String.format(Locale.ROOT, "%s %s alpha=%.2f ema15=%.2f mentions=%d",
                signal.getAsset(), signal.getAction().wireName(), signal.getAlpha(), signal.getEma15(),
                signal.getMentions());
    }

    private static Map<String, Object> payload(SignalTick tick, SignalAction previous) {
        Signal signal = tick.signal();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("asset", signal.getAsset());
        payload.put("ts", signal.getTs().toString());
        payload.put("ema15", signal.getEma15());
        payload.put("mentions", signal.getMentions());
        payload.put("baseline_7d", signal.getBaseline7d());
        payload.put("mentions_z", signal.getMentionsZ());
        payload.put("alpha", signal.getAlpha());
        payload.put("action", signal.getAction().wireName());
        payload.put("previous_action", previous == null ? null : previous.wireName());
        payload.put("contributions", tick.alpha().contributions());
        payload.put("multiplier", tick.alpha().multiplier());
        payload.put("reasons", reasons(tick));
        TechnicalSnapshot technical = tick.technical();
        if (technical != null) {
            payload.put("price_close", technical.close());
            payload.put("rsi14", technical.rsi14());
            payload.put("macd", technical.macd());
            payload.put("macd_signal", technical.macdSignal());
            payload.put("atr_pct", technical.atrPct());
            payload.put("price_bias", technical.priceBias());
            payload.put("trend_bias", technical.trendBias() == null ? null : technical.trendBias().wireName());
            payload.put("breakout", technical.breakout());
        }
        return payload;
    }

    /**
     * Names of the features that pushed alpha the most, strongest first.
     */
    static List<String> reasons(SignalTick tick) {
        List<Map.Entry<String, Double>> entries = new ArrayList<>(tick.alpha().contributions().entrySet());
        entries.sort((a, b) -> Double.compare(Math.abs(b.getValue()), Math.abs(a.getValue())));
        List<String> reasons = new ArrayList<>();
        for (Map.Entry<String, Double> entry : entries) {
            if (reasons.size() == 3 || Math.abs(entry.getValue()) < 0.01) {
                break;
            }
            reasons.add(entry.getKey() + (entry.getValue() > 0 ? "+" : "-"));
        }
        return reasons;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
