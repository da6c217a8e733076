package com.marketpulse.backend.service;

import com.marketpulse.backend.dto.ComponentHealth;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory health flags per collaborator. Degraded states surface in the state snapshot
 * instead of failing requests.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HealthStatusService {

    public static final String ORACLE = "scoring-oracle";
    public static final String CLASSIFIER = "relevance-classifier";
    public static final String PRICE_FEED = "price-feed";
    public static final String FEED_SOURCE = "feed-source";
    public static final String SOCIAL_SOURCE = "social-source";
    public static final String NOTIFICATIONS = "notifications";

    private final Clock clock;

    private final ConcurrentHashMap<String, ComponentHealth> components = new ConcurrentHashMap<>();

    public void markDegraded(String component, String reason) {
        ComponentHealth previous = components.get(component);
        if (previous == null || previous.status() != ComponentHealth.Status.DEGRADED) {
            log.warn("Component degraded component={} reason={}", component, reason);
        }
        components.put(component, new ComponentHealth(ComponentHealth.Status.DEGRADED, reason, clock.instant()));
    }

    public void markOk(String component) {
        ComponentHealth previous = components.get(component);
        if (previous != null && previous.status() == ComponentHealth.Status.DEGRADED) {
            log.info("Component recovered component={}", component);
        }
        if (previous == null || previous.status() != ComponentHealth.Status.OK) {
            components.put(component, new ComponentHealth(ComponentHealth.Status.OK, null, clock.instant()));
        }
    }

    public boolean isDegraded(String component) {
        ComponentHealth health = components.get(component);
        return health != null && health.status() == ComponentHealth.Status.DEGRADED;
    }

    public Map<String, ComponentHealth> snapshot() {
        return new TreeMap<>(components);
    }
}
