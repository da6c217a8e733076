package com.marketpulse.backend.service;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.dto.ItemQuery;
import com.marketpulse.backend.dto.ItemView;
import com.marketpulse.backend.dto.MentionPoint;
import com.marketpulse.backend.dto.MetricsResponse;
import com.marketpulse.backend.dto.SignalView;
import com.marketpulse.backend.dto.StateResponse;
import com.marketpulse.backend.event.EventBusService;
import com.marketpulse.backend.event.EventPage;
import com.marketpulse.backend.model.Item;
import com.marketpulse.backend.model.ItemSource;
import com.marketpulse.backend.model.Signal;
import com.marketpulse.backend.model.SignalAction;
import com.marketpulse.backend.repository.ItemRepository;
import com.marketpulse.backend.repository.SignalRepository;
import com.marketpulse.backend.service.loop.LoopOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-only views over the store, the event log and the health flags for the HTTP layer.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PulseQueryService {

    static final int MAX_LIST_LIMIT = 2000;
    static final int MAX_SERIES_MINUTES = 7 * 24 * 60;

    private final PulseProperties properties;
    private final PulseStore pulseStore;
    private final ItemRepository itemRepository;
    private final SignalRepository signalRepository;
    private final EventBusService eventBusService;
    private final HealthStatusService healthStatusService;
    private final MetricsService metricsService;
    private final LoopOrchestrator loopOrchestrator;
    private final Clock clock;

    public StateResponse currentState() {
        String asset = properties.getAsset();
        Instant now = clock.instant();
        Optional<Signal> last = pulseStore.latestSignal(asset);
        StateResponse.StateResponseBuilder state = StateResponse.builder()
                .asset(asset)
                .health(healthStatusService.snapshot())
                .loops(loopOrchestrator.status());
        if (last.isEmpty()) {
            long mentions = itemRepository.countByAssetAndTsAfter(asset, now.minus(Duration.ofMinutes(15)));
            return state.mentions15m((int) mentions)
                    .action(SignalAction.HOLD.wireName())
                    .updatedAt(now)
                    .build();
        }
        Signal signal = last.get();
        return state.ema15(signal.getEma15())
                .mentions15m(signal.getMentions())
                .baseline7d(signal.getBaseline7d())
                .mentionsZ(signal.getMentionsZ())
                .alpha(signal.getAlpha())
                .action(signal.getAction().wireName())
                .updatedAt(signal.getTs())
                .priceClose(signal.getPriceClose())
                .rsi14(signal.getRsi14())
                .atrPct(signal.getAtrPct())
                .priceBias(signal.getPriceBias())
                .trendBias(signal.getTrendBias())
                .build();
    }

    public List<SignalView> listSignals(Integer limit, Instant since, Instant until, String action, boolean ascending) {
        Specification<Signal> spec = (root, query, cb) -> cb.equal(root.get("asset"), properties.getAsset());
        if (since != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.<Instant>get("ts"), since));
        }
        if (until != null) {
            spec = spec.and((root, query, cb) -> cb.lessThanOrEqualTo(root.<Instant>get("ts"), until));
        }
        if (action != null && !action.isBlank()) {
            SignalAction parsed = parseAction(action);
            spec = spec.and((root, query, cb) -> cb.equal(root.get("action"), parsed));
        }
        Pageable page = PageRequest.of(0, clamp(limit, 200), sortByTs(ascending));
        return signalRepository.findAll(spec, page).stream().map(SignalView::from).toList();
    }

    public List<ItemView> listItems(ItemQuery filter) {
        Specification<Item> spec = (root, query, cb) -> cb.equal(root.get("asset"), properties.getAsset());
        if (filter.getSource() != null) {
            ItemSource source = filter.getSource();
            spec = spec.and((root, query, cb) -> cb.equal(root.get("source"), source));
        }
        if (filter.getLabel() != null && !filter.getLabel().isBlank()) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("label"), filter.getLabel()));
        }
        if (filter.getText() != null && !filter.getText().isBlank()) {
            String pattern = "%" + filter.getText().toLowerCase(Locale.ROOT) + "%";
            spec = spec.and((root, query, cb) -> cb.like(cb.lower(root.<String>get("text")), pattern));
        }
        if (filter.getMinScore() != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.<Double>get("score"), filter.getMinScore()));
        }
        if (filter.getMaxScore() != null) {
            spec = spec.and((root, query, cb) -> cb.lessThanOrEqualTo(root.<Double>get("score"), filter.getMaxScore()));
        }
        if (filter.getSince() != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.<Instant>get("ts"), filter.getSince()));
        }
        if (filter.getUntil() != null) {
            spec = spec.and((root, query, cb) -> cb.lessThanOrEqualTo(root.<Instant>get("ts"), filter.getUntil()));
        }
        if (Boolean.TRUE.equals(filter.getRelevant())) {
            spec = spec.and((root, query, cb) -> cb.isTrue(root.<Boolean>get("llmRelevant")));
        } else if (Boolean.FALSE.equals(filter.getRelevant())) {
            spec = spec.and((root, query, cb) -> cb.or(cb.isFalse(root.<Boolean>get("llmRelevant")), cb.isNull(root.get("llmRelevant"))));
        }
        Pageable page = PageRequest.of(0, clamp(filter.getLimit(), 100), sortByTs(filter.isAscending()));
        return itemRepository.findAll(spec, page).stream().map(ItemView::from).toList();
    }

    public MetricsResponse metrics() {
        String asset = properties.getAsset();
        Instant now = clock.instant();
        return MetricsResponse.builder()
                .itemsTotal(itemRepository.count())
                .signalsTotal(signalRepository.count())
                .itemsLast15m(itemRepository.countByAssetAndTsAfter(asset, now.minus(Duration.ofMinutes(15))))
                .avgScore1h(itemRepository.averageScoreSince(asset, now.minus(Duration.ofHours(1))))
                .eventsLatestId(eventBusService.latestId())
                .eventSubscribers(eventBusService.subscriberCount())
                .counters(metricsService.snapshot())
                .build();
    }

    public EventPage eventsSince(Long sinceId, Integer limit) {
        return eventBusService.eventsSince(sinceId, limit);
    }

    public List<ItemView> topImpact(int hours, int limit, ItemSource source) {
        if (hours < 1 || hours > 168) {
            throw new IllegalArgumentException("hours must be between 1 and 168");
        }
        Instant since = clock.instant().minus(Duration.ofHours(hours));
        Pageable page = PageRequest.of(0, Math.max(1, Math.min(200, limit)));
        List<Item> items = source == null
                ? itemRepository.findTopImpact(properties.getAsset(), since, page)
                : itemRepository.findTopImpactBySource(properties.getAsset(), source, since, page);
        return items.stream().map(ItemView::from).toList();
    }

    /**
     * Items per minute over the last {@code minutes}, with empty minutes filled with zero.
     */
    public List<MentionPoint> mentionSeries(int minutes) {
        if (minutes < 1 || minutes > MAX_SERIES_MINUTES) {
            throw new IllegalArgumentException("minutes must be between 1 and " + MAX_SERIES_MINUTES);
        }
        Instant now = clock.instant();
        Instant end = now.truncatedTo(ChronoUnit.MINUTES);
        Instant start = end.minus(Duration.ofMinutes(minutes - 1L));
        int[] counts = new int[minutes];
        for (Instant ts : pulseStore.itemTimestamps(properties.getAsset(), start.minusNanos(1), now, true)) {
            int index = (int) Duration.between(start, ts.truncatedTo(ChronoUnit.MINUTES)).toMinutes();
            if (index >= 0 && index < minutes) {
                counts[index]++;
            }
        }
        List<MentionPoint> points = new ArrayList<>(minutes);
        for (int i = 0; i < minutes; i++) {
            points.add(new MentionPoint(start.plus(Duration.ofMinutes(i)), counts[i]));
        }
        return points;
    }

    private static SignalAction parseAction(String action) {
        try {
            return SignalAction.valueOf(action.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown action: " + action, ex);
        }
    }

    private static Sort sortByTs(boolean ascending) {
        return ascending ? Sort.by("ts").ascending() : Sort.by("ts").descending();
    }

    private static int clamp(Integer limit, int defaultLimit) {
        int value = limit == null ? defaultLimit : limit;
        if (value < 1 || value > MAX_LIST_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        return value;
    }
}
