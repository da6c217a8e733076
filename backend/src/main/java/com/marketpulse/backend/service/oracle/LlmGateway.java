package com.marketpulse.backend.service.oracle;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.exception.ClassifierTimeoutException;
import com.marketpulse.backend.service.HealthStatusService;
import com.marketpulse.backend.service.MetricsService;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Every LLM call goes through here: one shared token bucket, then a hard timeout on the call
 * itself. Skips come back as an empty result and never as an exception.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LlmGateway {

    private static final int DEGRADED_AFTER = 3;

    private final PulseProperties properties;
    private final LlmClient llmClient;
    private final RateLimiter classifierRateLimiter;
    @Qualifier("classifierExecutor")
    private final Executor classifierExecutor;
    private final MetricsService metricsService;
    private final HealthStatusService healthStatusService;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    public Optional<String> complete(String purpose, String prompt) {
        return complete(purpose, prompt, true);
    }

    /**
     * @param jsonMode ask the model for a JSON object instead of free text
     */
    public Optional<String> complete(String purpose, String prompt, boolean jsonMode) {
        if (!classifierRateLimiter.acquirePermission()) {
            log.debug("LLM rate limit exhausted purpose={}", purpose);
            metricsService.recordClassifierSkip("rate_limited");
            return Optional.empty();
        }
        try {
            String response = callWithTimeout(prompt, jsonMode);
            consecutiveFailures.set(0);
            healthStatusService.markOk(HealthStatusService.CLASSIFIER);
            return Optional.of(response);
        } catch (ClassifierTimeoutException ex) {
            log.warn("LLM call timed out purpose={} : {}", purpose, ex.getMessage());
            metricsService.recordClassifierSkip("timeout");
            recordFailure("timeout");
        } catch (RuntimeException ex) {
            log.warn("LLM call failed purpose={} : {}", purpose, ex.getMessage());
            metricsService.recordClassifierSkip("error");
            recordFailure("error");
        }
        return Optional.empty();
    }

    private String callWithTimeout(String prompt, boolean jsonMode) {
        long timeoutMs = properties.getClassifier().getTimeoutMs();
        CompletableFuture<String> future = CompletableFuture.supplyAsync(
                () -> llmClient.generate(prompt, jsonMode), classifierExecutor);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new ClassifierTimeoutException("No response within " + timeoutMs + "ms", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ClassifierTimeoutException("Interrupted while waiting for LLM", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("LLM call failed", cause);
        }
    }

    private void recordFailure(String reason) {
        if (consecutiveFailures.incrementAndGet() >= DEGRADED_AFTER) {
            healthStatusService.markDegraded(HealthStatusService.CLASSIFIER, reason);
        }
    }
}
