package com.marketpulse.backend.service.loop;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.event.EventBusService;
import com.marketpulse.backend.event.EventType;
import com.marketpulse.backend.event.PulseEvent;
import com.marketpulse.backend.service.MetricsService;
import com.marketpulse.backend.service.impact.ImpactService;
import com.marketpulse.backend.service.ingest.IngestPipeline;
import com.marketpulse.backend.service.price.PriceIngestService;
import com.marketpulse.backend.service.signal.SignalComputeService;
import com.marketpulse.backend.service.source.RssFeedClient;
import com.marketpulse.backend.service.source.SocialSearchClient;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LoopOrchestratorTest {

    private PulseProperties properties;
    private SignalComputeService signalComputeService;
    private EventBusService eventBus;
    private LoopOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new PulseProperties();
        properties.getLoops().setStartupDelaySeconds(0);
        MetricsService metrics = new MetricsService(new SimpleMeterRegistry());
        signalComputeService = mock(SignalComputeService.class);
        eventBus = new EventBusService(properties, Clock.systemUTC(), metrics);
        orchestrator = new LoopOrchestrator(properties, mock(RssFeedClient.class), mock(SocialSearchClient.class),
                mock(IngestPipeline.class), signalComputeService, mock(PriceIngestService.class),
                mock(ImpactService.class), eventBus, metrics, RetryConfig.ofDefaults(), Clock.systemUTC());
    }

    @Test
    void buildsOneWorkerPerEnabledLoop() {
        properties.getSocial().setEnabled(true);

        List<String> names = orchestrator.buildWorkers().stream().map(LoopWorker::getName).toList();

        assertThat(names).containsExactly(LoopOrchestrator.FEED_INGEST, LoopOrchestrator.SOCIAL_INGEST,
                LoopOrchestrator.PRICE_FEED, LoopOrchestrator.SIGNAL_COMPUTE, LoopOrchestrator.IMPACT);
    }

    @Test
    void disabledLoopsAreNotBuilt() {
        properties.getFeed().setEnabled(false);
        properties.getPrices().setEnabled(false);
        properties.getImpact().setEnabled(false);

        assertThat(orchestrator.buildWorkers()).extracting(LoopWorker::getName)
                .containsExactly(LoopOrchestrator.SIGNAL_COMPUTE);
    }

    @Test
    void startAnnouncesReadinessAndStopJoinsWorkers() {
        properties.getFeed().setEnabled(false);
        properties.getPrices().setEnabled(false);
        properties.getImpact().setEnabled(false);
        properties.getSignal().setTickSeconds(1);
        properties.getLoops().setStopTimeoutSeconds(5);
        when(signalComputeService.computeTick()).thenReturn(Optional.empty());

        orchestrator.start();
        assertThat(orchestrator.isRunning()).isTrue();
        assertThat(orchestrator.status()).containsKey(LoopOrchestrator.SIGNAL_COMPUTE);
        PulseEvent ready = eventBus.eventsSince(0L, 10).events().get(0);
        assertThat(ready.type()).isEqualTo(EventType.STATE);
        assertThat(ready.summary()).isEqualTo("backend ready");

        orchestrator.stop();
        assertThat(orchestrator.isRunning()).isFalse();
        assertThat(orchestrator.status().get(LoopOrchestrator.SIGNAL_COMPUTE).running()).isFalse();
    }

    @Test
    void autoStartCanBeDisabled() {
        properties.getLoops().setAutoStart(false);

        orchestrator.onReady();

        assertThat(orchestrator.isRunning()).isFalse();
        assertThat(eventBus.latestId()).isZero();
    }
}
