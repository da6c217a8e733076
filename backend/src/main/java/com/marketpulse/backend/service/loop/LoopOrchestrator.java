package com.marketpulse.backend.service.loop;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.event.EventBusService;
import com.marketpulse.backend.event.EventType;
import com.marketpulse.backend.service.MetricsService;
import com.marketpulse.backend.service.impact.ImpactService;
import com.marketpulse.backend.service.ingest.IngestPipeline;
import com.marketpulse.backend.service.price.PriceIngestService;
import com.marketpulse.backend.service.signal.SignalComputeService;
import com.marketpulse.backend.service.source.RssFeedClient;
import com.marketpulse.backend.service.source.SocialSearchClient;
import io.github.resilience4j.retry.RetryConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the background loops. They start once the application is ready, after the startup
 * configuration check, and stop with the context.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LoopOrchestrator implements SmartLifecycle {

    public static final String FEED_INGEST = "feed-ingest";
    public static final String SOCIAL_INGEST = "social-ingest";
    public static final String SIGNAL_COMPUTE = "signal-compute";
    public static final String PRICE_FEED = "price-feed";
    public static final String IMPACT = "impact";

    private final PulseProperties properties;
    private final RssFeedClient rssFeedClient;
    private final SocialSearchClient socialSearchClient;
    private final IngestPipeline ingestPipeline;
    private final SignalComputeService signalComputeService;
    private final PriceIngestService priceIngestService;
    private final ImpactService impactService;
    private final EventBusService eventBusService;
    private final MetricsService metricsService;
    private final RetryConfig loopRetryConfig;
    private final Clock clock;

    private final List<LoopWorker> workers = new ArrayList<>();
    private volatile boolean running;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (properties.getLoops().isAutoStart()) {
            start();
        } else {
            log.info("Loop auto-start disabled");
        }
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        workers.clear();
        workers.addAll(buildWorkers());
        workers.forEach(LoopWorker::start);
        running = true;
        eventBusService.publish(EventType.STATE, "backend ready",
                Map.of("asset", properties.getAsset(), "loops", workers.stream().map(LoopWorker::getName).toList()));
        log.info("Started {} loops", workers.size());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        Duration timeout = Duration.ofSeconds(properties.getLoops().getStopTimeoutSeconds());
        workers.forEach(LoopWorker::requestStop);
        for (LoopWorker worker : workers) {
            worker.join(timeout);
        }
        running = false;
        log.info("All loops stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return false;
    }

    public synchronized Map<String, LoopStatus> status() {
        Map<String, LoopStatus> result = new LinkedHashMap<>();
        for (LoopWorker worker : workers) {
            result.put(worker.getName(), worker.status());
        }
        return result;
    }

    List<LoopWorker> buildWorkers() {
        PulseProperties.Loops loops = properties.getLoops();
        Duration startupDelay = Duration.ofSeconds(loops.getStartupDelaySeconds());
        List<LoopWorker> result = new ArrayList<>();
        if (properties.getFeed().isEnabled()) {
            Duration cadence = Duration.ofSeconds(properties.getFeed().getPollSeconds());
            result.add(worker(FEED_INGEST, cadence, startupDelay, cadence,
                    () -> ingestPipeline.ingest("feed", rssFeedClient.fetchAll()).idle() ? LoopOutcome.IDLE : LoopOutcome.WORKED));
        }
        if (properties.getSocial().isEnabled()) {
            Duration cadence = Duration.ofSeconds(properties.getSocial().getPollSeconds());
            result.add(worker(SOCIAL_INGEST, cadence, startupDelay,
                    Duration.ofSeconds(properties.getSocial().getIdleBackoffMaxSeconds()),
                    () -> ingestPipeline.ingest("social", socialSearchClient.search()).idle() ? LoopOutcome.IDLE : LoopOutcome.WORKED));
        }
        if (properties.getPrices().isEnabled()) {
            Duration cadence = Duration.ofSeconds(properties.getPrices().getPollSeconds());
            result.add(worker(PRICE_FEED, cadence, Duration.ZERO, cadence,
                    () -> priceIngestService.poll() > 0 ? LoopOutcome.WORKED : LoopOutcome.IDLE));
        }
        if (properties.getSignal().isEnabled()) {
            Duration cadence = Duration.ofSeconds(properties.getSignal().getTickSeconds());
            result.add(worker(SIGNAL_COMPUTE, cadence, startupDelay, cadence,
                    () -> signalComputeService.computeTick().isPresent() ? LoopOutcome.WORKED : LoopOutcome.IDLE));
        }
        if (properties.getImpact().isEnabled()) {
            Duration cadence = Duration.ofSeconds(properties.getImpact().getPollSeconds());
            result.add(worker(IMPACT, cadence, startupDelay.multipliedBy(2), cadence,
                    () -> impactService.runOnce() > 0 ? LoopOutcome.WORKED : LoopOutcome.IDLE));
        }
        return result;
    }

    private LoopWorker worker(String name, Duration cadence, Duration initialDelay, Duration idleMax, LoopTask task) {
        return new LoopWorker(name, cadence, initialDelay, idleMax, task, loopRetryConfig, metricsService, clock);
    }
}
