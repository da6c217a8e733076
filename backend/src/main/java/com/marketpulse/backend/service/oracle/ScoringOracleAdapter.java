package com.marketpulse.backend.service.oracle;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.service.HealthStatusService;
import com.marketpulse.backend.service.MetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fail-open wrapper around the scoring oracle: any failure becomes a neutral, "unscored"
 * result so ingestion keeps moving.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScoringOracleAdapter {

    private final PulseProperties properties;
    private final ScoringOracle scoringOracle;
    private final PolarityClassifier polarityClassifier;
    private final MetricsService metricsService;
    private final HealthStatusService healthStatusService;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    public SentimentScore score(String text, DomainHint hint) {
        SentimentScore base;
        try {
            base = scoringOracle.score(text, hint).clamped();
        } catch (RuntimeException ex) {
            metricsService.recordOracleFailure();
            int failures = consecutiveFailures.incrementAndGet();
            log.warn("Scoring oracle unavailable, scoring neutral (consecutive failures={}): {}", failures, ex.getMessage());
            if (failures >= properties.getOracle().getDegradedAfterFailures()) {
                healthStatusService.markDegraded(HealthStatusService.ORACLE, "unavailable");
            }
            return SentimentScore.unscored();
        }
        consecutiveFailures.set(0);
        healthStatusService.markOk(HealthStatusService.ORACLE);
        return adjustPolarity(text, base);
    }

    private SentimentScore adjustPolarity(String text, SentimentScore base) {
        PulseProperties.Polarity config = properties.getOracle().getPolarity();
        if (!config.isEnabled()) {
            return base;
        }
        Optional<PolarityClassifier.Polarity> polarity = polarityClassifier.classify(text);
        if (polarity.isEmpty() || polarity.get().confidence() < config.getMinConfidence()) {
            return base;
        }
        double adjusted = polarity.get().sign() * Math.abs(base.score());
        return new SentimentScore(adjusted, base.label());
    }
}
