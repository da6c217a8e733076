package com.marketpulse.backend.service.oracle;

import java.util.Set;

public record Relevance(boolean relevant, double confidence, Set<String> labels, String reason) {
}
