package com.marketpulse.backend.service.oracle;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.service.MetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class RelevanceClassifier {

    static final String PROMPT = """
            You classify short texts for a market desk that follows %s.
            Decide whether the text is about the asset's price, trading, adoption, technology, \
            regulation or the wider market in a way that could move it.
            Answer with JSON only, exactly these keys:
            {"relevant": true|false, "confidence": 0.0-1.0, "labels": ["short", "tags"], "reason": "one sentence"}
            Text:
            %s
            """;

    private final PulseProperties properties;
    private final LlmGateway llmGateway;
    private final ClassificationParser parser;
    private final MetricsService metricsService;

    /**
     * Empty when classification is disabled, rate limited, timed out, failed or unparseable.
     */
    public Optional<Relevance> classify(String text) {
        if (!properties.getClassifier().isEnabled()) {
            return Optional.empty();
        }
        Optional<String> response = llmGateway.complete("relevance", PROMPT.formatted(properties.getAsset(), text));
        if (response.isEmpty()) {
            return Optional.empty();
        }
        ClassificationParser.ParseResult result = parser.parse(response.get());
        if (!result.success()) {
            log.debug("Unparseable classifier response: {}", result.error());
            metricsService.recordClassifierSkip("parse");
            return Optional.empty();
        }
        return Optional.of(result.relevance());
    }

    public boolean isLowRelevance(Relevance relevance) {
        return !relevance.relevant() || relevance.confidence() < properties.getClassifier().getMinConfidence();
    }
}
