package com.marketpulse.backend.service;

import com.marketpulse.backend.dto.CounterSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final ConcurrentHashMap<String, AtomicLong> itemsPersisted = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> itemsDuplicate = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> rejectsByReason = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> classifierSkips = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> loopFailures = new ConcurrentHashMap<>();
    private final AtomicLong oracleFailures = new AtomicLong();
    private final AtomicLong tickOverlaps = new AtomicLong();
    private final AtomicLong signalsComputed = new AtomicLong();
    private final AtomicLong eventsPublished = new AtomicLong();
    private final AtomicLong impactsWritten = new AtomicLong();
    private final AtomicLong impactDeferrals = new AtomicLong();
    private final AtomicLong notificationFailures = new AtomicLong();
    private final AtomicReference<Double> lastAlpha = new AtomicReference<>(0.0);

    private Counter oracleFailuresCounter;
    private Counter tickOverlapsCounter;
    private Counter signalsCounter;
    private Counter eventsCounter;
    private Counter impactDeferralsCounter;
    private Counter notificationFailuresCounter;

    @PostConstruct
    void init() {
        oracleFailuresCounter = Counter.builder("pulse_oracle_failures_total").register(meterRegistry);
        tickOverlapsCounter = Counter.builder("pulse_tick_overlaps_total").register(meterRegistry);
        signalsCounter = Counter.builder("pulse_signals_total").register(meterRegistry);
        eventsCounter = Counter.builder("pulse_events_published_total").register(meterRegistry);
        impactDeferralsCounter = Counter.builder("pulse_impact_deferred_total").register(meterRegistry);
        notificationFailuresCounter = Counter.builder("pulse_notification_failures_total").register(meterRegistry);
        Gauge.builder("pulse_alpha_last", lastAlpha, AtomicReference::get).register(meterRegistry);
    }

    public void recordItemPersisted(String source) {
        increment(itemsPersisted, source, "pulse_items_persisted_total", "source");
    }

    public void recordDuplicate(String source) {
        increment(itemsDuplicate, source, "pulse_items_duplicate_total", "source");
    }

    public void recordReject(String reason) {
        increment(rejectsByReason, reason, "pulse_items_rejected_total", "reason");
    }

    public void recordClassifierSkip(String reason) {
        increment(classifierSkips, reason, "pulse_classifier_skipped_total", "reason");
    }

    public void recordLoopFailure(String loop) {
        increment(loopFailures, loop, "pulse_loop_failures_total", "loop");
    }

    public void recordOracleFailure() {
        oracleFailures.incrementAndGet();
        if (oracleFailuresCounter != null) {
            oracleFailuresCounter.increment();
        }
    }

    public void recordTickOverlap() {
        tickOverlaps.incrementAndGet();
        if (tickOverlapsCounter != null) {
            tickOverlapsCounter.increment();
        }
    }

    public void recordSignal(double alpha) {
        signalsComputed.incrementAndGet();
        lastAlpha.set(alpha);
        if (signalsCounter != null) {
            signalsCounter.increment();
        }
    }

    public void recordEventPublished() {
        eventsPublished.incrementAndGet();
        if (eventsCounter != null) {
            eventsCounter.increment();
        }
    }

    public void recordImpactWritten(String horizon) {
        impactsWritten.incrementAndGet();
        Counter.builder("pulse_impact_written_total")
                .tag("horizon", horizon)
                .register(meterRegistry)
                .increment();
    }

    public void recordImpactDeferred() {
        impactDeferrals.incrementAndGet();
        if (impactDeferralsCounter != null) {
            impactDeferralsCounter.increment();
        }
    }

    public void recordNotificationFailure() {
        notificationFailures.incrementAndGet();
        if (notificationFailuresCounter != null) {
            notificationFailuresCounter.increment();
        }
    }

    public CounterSnapshot snapshot() {
        return new CounterSnapshot(
                copy(itemsPersisted),
                copy(itemsDuplicate),
                copy(rejectsByReason),
                copy(classifierSkips),
                copy(loopFailures),
                oracleFailures.get(),
                tickOverlaps.get(),
                signalsComputed.get(),
                eventsPublished.get(),
                impactsWritten.get(),
                impactDeferrals.get(),
                notificationFailures.get()
        );
    }

    private void increment(ConcurrentHashMap<String, AtomicLong> counts, String key, String meter, String tag) {
        String value = key == null ? "unknown" : key;
        counts.computeIfAbsent(value, k -> new AtomicLong()).incrementAndGet();
        Counter.builder(meter)
                .tag(tag, value)
                .register(meterRegistry)
                .increment();
    }

    private Map<String, Long> copy(Map<String, AtomicLong> counts) {
        Map<String, Long> result = new TreeMap<>();
        counts.forEach((key, value) -> result.put(key, value.get()));
        return result;
    }
}
