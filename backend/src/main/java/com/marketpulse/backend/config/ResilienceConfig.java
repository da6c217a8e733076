package com.marketpulse.backend.config;

import com.marketpulse.backend.exception.TransientIngestException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;

@Configuration
public class ResilienceConfig {

    /**
     * Process-wide token bucket in front of the LLM. Callers block up to the acquire timeout.
     */
    @Bean
    public RateLimiter classifierRateLimiter(PulseProperties properties) {
        PulseProperties.Classifier classifier = properties.getClassifier();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(classifier.getMaxQps())
                .timeoutDuration(Duration.ofMillis(classifier.getAcquireTimeoutMs()))
                .build();
        return RateLimiter.of("classifier", config);
    }

    @Bean
    public CircuitBreaker oracleCircuitBreaker(
            @Value("${pulse.oracle.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${pulse.oracle.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${pulse.oracle.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .build();
        return CircuitBreaker.of("scoring-oracle", config);
    }

    /**
     * Shared retry policy for loop iterations; each loop builds its own Retry from it.
     */
    @Bean
    public RetryConfig loopRetryConfig(PulseProperties properties) {
        PulseProperties.Loops loops = properties.getLoops();
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(loops.getRetryBaseDelayMs()),
                2.0,
                loops.getRetryJitter()
        );
        return RetryConfig.custom()
                .maxAttempts(loops.getRetryMaxAttempts())
                .intervalFunction(intervalFunction)
                .retryExceptions(TransientIngestException.class, ResourceAccessException.class, HttpServerErrorException.class)
                .build();
    }
}
