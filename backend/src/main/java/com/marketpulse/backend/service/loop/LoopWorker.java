package com.marketpulse.backend.service.loop;

import com.marketpulse.backend.service.MetricsService;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Runs one task on its own thread at a fixed cadence. Transient failures are retried inside
 * the iteration; anything else is logged and the worker carries on at the next cadence. Stop
 * is cooperative: the latch wakes the worker between iterations.
 */
@Slf4j
public class LoopWorker implements Runnable {

    private final String name;
    private final Duration cadence;
    private final Duration initialDelay;
    private final Duration idleBackoffMax;
    private final LoopTask task;
    private final Retry retry;
    private final MetricsService metricsService;
    private final Clock clock;

    private final CountDownLatch stopLatch = new CountDownLatch(1);
    private final AtomicLong iterations = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private volatile boolean running;
    private volatile Thread thread;
    private volatile Instant lastRunAt;
    private volatile Instant lastSuccessAt;
    private volatile String lastError;
    private int idleStreak;

    public LoopWorker(String name, Duration cadence, Duration initialDelay, Duration idleBackoffMax,
                      LoopTask task, RetryConfig retryConfig, MetricsService metricsService, Clock clock) {
        if (cadence.isZero() || cadence.isNegative()) {
            throw new IllegalArgumentException("Loop " + name + " needs a positive cadence");
        }
        this.name = name;
        this.cadence = cadence;
        this.initialDelay = initialDelay;
        this.idleBackoffMax = idleBackoffMax.compareTo(cadence) < 0 ? cadence : idleBackoffMax;
        this.task = task;
        this.retry = Retry.of(name, retryConfig);
        this.metricsService = metricsService;
        this.clock = clock;
        this.retry.getEventPublisher().onRetry(event -> log.warn("Loop {} retry #{} in {}ms: {}", name,
                event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
    }

    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException("Loop " + name + " already started");
        }
        running = true;
        thread = new Thread(this, "loop-" + name);
        thread.setDaemon(true);
        thread.start();
        log.info("Loop {} started cadence={}s", name, cadence.toSeconds());
    }

    @Override
    public void run() {
        MDC.put("loop", name);
        try {
            if (awaitStop(initialDelay)) {
                return;
            }
            while (stopLatch.getCount() > 0) {
                Duration wait = runIteration();
                if (awaitStop(wait)) {
                    break;
                }
            }
        } finally {
            running = false;
            log.info("Loop {} stopped after {} iterations", name, iterations.get());
            MDC.remove("loop");
        }
    }

    /**
     * One guarded run of the task.
     *
     * @return how long to wait before the next run
     */
    Duration runIteration() {
        iterations.incrementAndGet();
        lastRunAt = clock.instant();
        try {
            Supplier<LoopOutcome> guarded = Retry.decorateSupplier(retry, task::run);
            LoopOutcome outcome = guarded.get();
            lastSuccessAt = clock.instant();
            lastError = null;
            if (outcome == LoopOutcome.IDLE) {
                idleStreak = Math.min(idleStreak + 1, 16);
                return idleWait();
            }
            idleStreak = 0;
            return cadence;
        } catch (RuntimeException ex) {
            failures.incrementAndGet();
            lastError = ex.getClass().getSimpleName() + ": " + ex.getMessage();
            metricsService.recordLoopFailure(name);
            log.error("Loop {} iteration failed: {}", name, ex.getMessage(), ex);
            return cadence;
        }
    }

    /**
     * Cadence doubled for every consecutive idle run past the first, capped at the idle maximum.
     */
    Duration idleWait() {
        Duration wait = cadence;
        for (int i = 1; i < idleStreak && wait.compareTo(idleBackoffMax) < 0; i++) {
            wait = wait.multipliedBy(2);
        }
        return wait.compareTo(idleBackoffMax) > 0 ? idleBackoffMax : wait;
    }

    public void requestStop() {
        stopLatch.countDown();
    }

    /**
     * Waits for the worker to finish its current iteration. Interrupts it when the timeout passes.
     *
     * @return true when the thread ended in time
     */
    public boolean join(Duration timeout) {
        Thread current = thread;
        if (current == null) {
            return true;
        }
        try {
            current.join(timeout.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
        if (current.isAlive()) {
            log.warn("Loop {} did not stop within {}s, interrupting", name, timeout.toSeconds());
            current.interrupt();
            return false;
        }
        return true;
    }

    private boolean awaitStop(Duration wait) {
        try {
            return stopLatch.await(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    public String getName() {
        return name;
    }

    public boolean isRunning() {
        return running;
    }

    public LoopStatus status() {
        return new LoopStatus(name, running, iterations.get(), failures.get(), lastRunAt, lastSuccessAt, lastError);
    }
}
