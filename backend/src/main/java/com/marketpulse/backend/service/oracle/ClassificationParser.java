package com.marketpulse.backend.service.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Best-effort reader for model output that is supposed to be JSON. Tries the whole text first,
 * then the outermost {@code {...}} span. Never throws; failures come back as a result.
 */
@Component
@RequiredArgsConstructor
public class ClassificationParser {

    private static final int MAX_LABELS = 8;
    private static final int MAX_REASON = 1000;

    private final ObjectMapper objectMapper;

    public ParseResult parse(String raw) {
        Optional<JsonNode> object = extractObject(raw);
        if (object.isEmpty()) {
            return ParseResult.failure("no JSON object in response");
        }
        JsonNode node = object.get();
        Optional<Boolean> relevant = readBoolean(node.get("relevant"));
        if (relevant.isEmpty()) {
            return ParseResult.failure("missing 'relevant' field");
        }
        double confidence = readDouble(node.get("confidence")).orElse(relevant.get() ? 1.0 : 0.0);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        Set<String> labels = readLabels(node.get("labels"));
        String reason = node.path("reason").isValueNode() ? node.path("reason").asText() : null;
        if (reason != null && reason.length() > MAX_REASON) {
            reason = reason.substring(0, MAX_REASON);
        }
        return ParseResult.success(new Relevance(relevant.get(), confidence, labels, reason));
    }

    public Optional<JsonNode> extractObject(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Optional<JsonNode> whole = tryRead(raw.trim());
        if (whole.isPresent()) {
            return whole;
        }
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return tryRead(raw.substring(start, end + 1));
    }

    private Optional<JsonNode> tryRead(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException ex) {
            return Optional.empty();
        }
    }

    static Optional<Boolean> readBoolean(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.isBoolean()) {
            return Optional.of(node.asBoolean());
        }
        if (node.isNumber()) {
            return Optional.of(node.asDouble() != 0.0);
        }
        String text = node.asText("").trim().toLowerCase(Locale.ROOT);
        return switch (text) {
            case "true", "yes", "y", "1" -> Optional.of(true);
            case "false", "no", "n", "0" -> Optional.of(false);
            default -> Optional.empty();
        };
    }

    static Optional<Double> readDouble(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            return Optional.of(node.asDouble());
        }
        try {
            double value = Double.parseDouble(node.asText("").trim());
            return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    private Set<String> readLabels(JsonNode node) {
        Set<String> labels = new LinkedHashSet<>();
        if (node == null || node.isNull()) {
            return labels;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                addLabel(labels, element.asText(""));
            }
        } else {
            for (String part : node.asText("").split(",")) {
                addLabel(labels, part);
            }
        }
        return labels;
    }

    private void addLabel(Set<String> labels, String label) {
        String value = label.trim().toLowerCase(Locale.ROOT);
        if (!value.isEmpty() && labels.size() < MAX_LABELS) {
            labels.add(value);
        }
    }

    public record ParseResult(boolean success, Relevance relevance, String error) {

        public static ParseResult success(Relevance relevance) {
            return new ParseResult(true, relevance, null);
        }

        public static ParseResult failure(String error) {
            return new ParseResult(false, null, error);
        }
    }
}
