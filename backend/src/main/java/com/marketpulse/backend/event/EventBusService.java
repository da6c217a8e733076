package com.marketpulse.backend.event;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Bounded in-process event log. Ids are assigned, retained and delivered to live subscribers
 * under one monitor, so every subscriber sees events in id order and a cursor read never
 * skips an id that is still retained.
 */
@Service
@Slf4j
public class EventBusService {

    private static final int DEFAULT_PAGE_SIZE = 50;

    private final int capacity;
    private final int maxPageSize;
    private final Clock clock;
    private final MetricsService metricsService;

    private final Object lock = new Object();
    private final ArrayDeque<PulseEvent> buffer;
    private final List<Subscription> subscribers = new CopyOnWriteArrayList<>();
    private long lastId;
    private long lastEvictedId;

    public EventBusService(PulseProperties properties, Clock clock, MetricsService metricsService) {
        this.capacity = properties.getEvents().getCapacity();
        this.maxPageSize = properties.getEvents().getMaxPageSize();
        this.clock = clock;
        this.metricsService = metricsService;
        this.buffer = new ArrayDeque<>(capacity);
    }

    public PulseEvent publish(EventType type, String summary, Map<String, Object> payload) {
        Map<String, Object> copy = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        PulseEvent event;
        synchronized (lock) {
            event = new PulseEvent(++lastId, type, clock.instant(), summary, copy);
            buffer.addLast(event);
            if (buffer.size() > capacity) {
                lastEvictedId = buffer.removeFirst().id();
            }
            for (Subscription subscription : subscribers) {
                deliver(subscription, event);
            }
        }
        metricsService.recordEventPublished();
        return event;
    }

    /**
     * Events with id greater than {@code sinceId}, ascending, at most {@code limit}. A null cursor
     * returns the most recent {@code limit} events.
     */
    public EventPage eventsSince(Long sinceId, Integer limit) {
        int size = clampLimit(limit);
        synchronized (lock) {
            Long oldestId = buffer.isEmpty() ? null : buffer.peekFirst().id();
            if (sinceId == null) {
                List<PulseEvent> tail = new ArrayList<>(size);
                Iterator<PulseEvent> descending = buffer.descendingIterator();
                while (descending.hasNext() && tail.size() < size) {
                    tail.add(descending.next());
                }
                Collections.reverse(tail);
                return new EventPage(List.copyOf(tail), false, false, oldestId, lastId);
            }
            List<PulseEvent> page = new ArrayList<>(size);
            boolean hasMore = false;
            for (PulseEvent event : buffer) {
                if (event.id() <= sinceId) {
                    continue;
                }
                if (page.size() == size) {
                    hasMore = true;
                    break;
                }
                page.add(event);
            }
            boolean gap = sinceId < lastEvictedId;
            return new EventPage(List.copyOf(page), gap, hasMore, oldestId, lastId);
        }
    }

    public Subscription subscribe(Consumer<PulseEvent> listener) {
        Subscription subscription = new Subscription(this, listener, false);
        subscribers.add(subscription);
        return subscription;
    }

    public Subscription subscribeFrom(long sinceId, Consumer<PulseEvent> listener) {
        return subscribeFrom(sinceId, gap -> { }, listener);
    }

    /**
     * Replays every retained event after {@code sinceId} to the listener and then registers it,
     * atomically with respect to publishers. When events after the cursor were already evicted,
     * {@code onGap} runs first, under the same lock, so it sees the buffer the replay uses.
     */
    public Subscription subscribeFrom(long sinceId, Consumer<ReplayGap> onGap, Consumer<PulseEvent> listener) {
        synchronized (lock) {
            boolean gap = sinceId < lastEvictedId;
            Subscription subscription = new Subscription(this, listener, gap);
            if (gap) {
                onGap.accept(new ReplayGap(sinceId, buffer.isEmpty() ? null : buffer.peekFirst().id(), lastId));
            }
            for (PulseEvent event : buffer) {
                if (event.id() > sinceId) {
                    deliver(subscription, event);
                }
            }
            if (subscription.isOpen()) {
                subscribers.add(subscription);
            }
            return subscription;
        }
    }

    public long latestId() {
        synchronized (lock) {
            return lastId;
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    void unsubscribe(Subscription subscription) {
        subscribers.remove(subscription);
    }

    private void deliver(Subscription subscription, PulseEvent event) {
        try {
            subscription.listener().accept(event);
        } catch (RuntimeException ex) {
            log.warn("Event subscriber failed, removing it: {}", ex.getMessage());
            subscription.close();
        }
    }

    private int clampLimit(Integer limit) {
        int requested = limit == null ? DEFAULT_PAGE_SIZE : limit;
        return Math.max(1, Math.min(maxPageSize, requested));
    }
}
