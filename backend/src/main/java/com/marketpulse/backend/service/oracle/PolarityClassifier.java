package com.marketpulse.backend.service.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Asks the LLM for the sign of the text's sentiment toward the asset. Used to correct the
 * oracle's polarity when the oracle model misreads sarcasm or negation.
 */
@Component
@RequiredArgsConstructor
public class PolarityClassifier {

    static final String PROMPT = """
            Classify the sentiment of the text toward the asset as positive, negative or neutral.
            Answer with JSON only: {"polarity": "positive|negative|neutral", "confidence": 0.0-1.0}
            Text:
            %s
            """;

    private final LlmGateway llmGateway;
    private final ClassificationParser parser;

    public Optional<Polarity> classify(String text) {
        return llmGateway.complete("polarity", PROMPT.formatted(text))
                .flatMap(parser::extractObject)
                .flatMap(this::toPolarity);
    }

    private Optional<Polarity> toPolarity(JsonNode node) {
        String value = node.path("polarity").asText("").trim().toLowerCase(Locale.ROOT);
        int sign = switch (value) {
            case "positive", "bullish" -> 1;
            case "negative", "bearish" -> -1;
            case "neutral" -> 0;
            default -> Integer.MIN_VALUE;
        };
        if (sign == Integer.MIN_VALUE) {
            return Optional.empty();
        }
        double confidence = ClassificationParser.readDouble(node.get("confidence")).orElse(0.0);
        return Optional.of(new Polarity(sign, Math.max(0.0, Math.min(1.0, confidence))));
    }

    public record Polarity(int sign, double confidence) {
    }
}
