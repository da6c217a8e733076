package com.marketpulse.backend.service.oracle;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.service.HealthStatusService;
import com.marketpulse.backend.service.MetricsService;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmGatewayTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final PulseProperties properties = new PulseProperties();
    private final LlmClient llmClient = mock(LlmClient.class);
    private final MetricsService metrics = new MetricsService(new SimpleMeterRegistry());
    private final HealthStatusService health = new HealthStatusService(Clock.systemUTC());

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void skipsWhenTokenBucketIsEmpty() {
        when(llmClient.generate(anyString(), anyBoolean())).thenReturn("{}");
        LlmGateway gateway = gateway(2);

        assertThat(gateway.complete("relevance", "a")).isPresent();
        assertThat(gateway.complete("relevance", "b")).isPresent();
        assertThat(gateway.complete("relevance", "c")).isEmpty();

        verify(llmClient, times(2)).generate(anyString(), anyBoolean());
        assertThat(metrics.snapshot().classifierSkips()).containsEntry("rate_limited", 1L);
    }

    @Test
    void timesOutSlowCallsAndDegradesAfterRepeatedFailures() {
        properties.getClassifier().setTimeoutMs(50);
        when(llmClient.generate(anyString(), anyBoolean())).thenAnswer(invocation -> {
            Thread.sleep(1000);
            return "{}";
        });
        LlmGateway gateway = gateway(100);

        for (int i = 0; i < 3; i++) {
            assertThat(gateway.complete("relevance", "slow")).isEmpty();
        }

        assertThat(metrics.snapshot().classifierSkips()).containsEntry("timeout", 3L);
        assertThat(health.isDegraded(HealthStatusService.CLASSIFIER)).isTrue();
    }

    @Test
    void transportErrorsBecomeEmptyResultsAndSuccessRecovers() {
        when(llmClient.generate(anyString(), anyBoolean()))
                .thenThrow(new ResourceAccessException("connection refused"))
                .thenReturn("{\"relevant\": true}");
        LlmGateway gateway = gateway(100);

        Optional<String> failed = gateway.complete("relevance", "x");
        Optional<String> ok = gateway.complete("commentary", "y", false);

        assertThat(failed).isEmpty();
        assertThat(ok).contains("{\"relevant\": true}");
        verify(llmClient).generate("y", false);
        verify(llmClient).generate(eq("x"), eq(true));
        assertThat(health.isDegraded(HealthStatusService.CLASSIFIER)).isFalse();
    }

    private LlmGateway gateway(int permits) {
        RateLimiter limiter = RateLimiter.of("llm-test", RateLimiterConfig.custom()
                .limitForPeriod(permits)
                .limitRefreshPeriod(Duration.ofHours(1))
                .timeoutDuration(Duration.ZERO)
                .build());
        return new LlmGateway(properties, llmClient, limiter, executor, metrics, health);
    }
}
