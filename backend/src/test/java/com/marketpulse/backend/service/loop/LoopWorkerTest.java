package com.marketpulse.backend.service.loop;

import com.marketpulse.backend.exception.TransientIngestException;
import com.marketpulse.backend.service.MetricsService;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoopWorkerTest {

    private final MetricsService metrics = new MetricsService(new SimpleMeterRegistry());
    private final RetryConfig retryConfig = RetryConfig.custom()
            .maxAttempts(3)
            .waitDuration(Duration.ofMillis(1))
            .retryExceptions(TransientIngestException.class)
            .build();

    @Test
    void failedIterationIsRecordedAndTheNextOneStillRuns() {
        AtomicInteger calls = new AtomicInteger();
        LoopWorker worker = worker(Duration.ofSeconds(10), () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("feed returned garbage");
            }
            return LoopOutcome.WORKED;
        });

        assertThat(worker.runIteration()).isEqualTo(Duration.ofSeconds(10));
        assertThat(worker.status().failures()).isEqualTo(1);
        assertThat(worker.status().lastError()).contains("feed returned garbage");
        assertThat(metrics.snapshot().loopFailures()).containsEntry("test", 1L);

        worker.runIteration();
        assertThat(worker.status().iterations()).isEqualTo(2);
        assertThat(worker.status().lastError()).isNull();
        assertThat(worker.status().lastSuccessAt()).isNotNull();
    }

    @Test
    void transientErrorsAreRetriedWithinTheIteration() {
        AtomicInteger calls = new AtomicInteger();
        LoopWorker worker = worker(Duration.ofSeconds(10), () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientIngestException("HTTP 503");
            }
            return LoopOutcome.WORKED;
        });

        worker.runIteration();

        assertThat(calls.get()).isEqualTo(3);
        assertThat(worker.status().failures()).isZero();
    }

    @Test
    void idleRunsBackOffUpToTheMaximum() {
        AtomicInteger idleRuns = new AtomicInteger(4);
        LoopWorker worker = new LoopWorker("test", Duration.ofSeconds(10), Duration.ZERO, Duration.ofSeconds(60),
                () -> idleRuns.getAndDecrement() > 0 ? LoopOutcome.IDLE : LoopOutcome.WORKED,
                retryConfig, metrics, Clock.systemUTC());

        assertThat(worker.runIteration()).isEqualTo(Duration.ofSeconds(10));
        assertThat(worker.runIteration()).isEqualTo(Duration.ofSeconds(20));
        assertThat(worker.runIteration()).isEqualTo(Duration.ofSeconds(40));
        assertThat(worker.runIteration()).isEqualTo(Duration.ofSeconds(60));
        assertThat(worker.runIteration()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void stopWakesTheWorkerBetweenIterations() throws InterruptedException {
        CountDownLatch ranTwice = new CountDownLatch(2);
        LoopWorker worker = worker(Duration.ofMillis(20), () -> {
            ranTwice.countDown();
            return LoopOutcome.WORKED;
        });

        worker.start();
        assertThat(ranTwice.await(5, TimeUnit.SECONDS)).isTrue();
        worker.requestStop();

        assertThat(worker.join(Duration.ofSeconds(5))).isTrue();
        assertThat(worker.isRunning()).isFalse();
        assertThatThrownBy(worker::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsNonPositiveCadence() {
        assertThatThrownBy(() -> worker(Duration.ZERO, () -> LoopOutcome.WORKED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private LoopWorker worker(Duration cadence, LoopTask task) {
        return new LoopWorker("test", cadence, Duration.ZERO, cadence, task, retryConfig, metrics, Clock.systemUTC());
    }
}
