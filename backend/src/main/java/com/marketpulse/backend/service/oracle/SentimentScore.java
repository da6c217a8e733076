package com.marketpulse.backend.service.oracle;

public record SentimentScore(double score, String label) {

    public static final String UNSCORED = "unscored";

    public static SentimentScore unscored() {
        return new SentimentScore(0.0, UNSCORED);
    }

    public boolean isUnscored() {
        return UNSCORED.equals(label);
    }

    public SentimentScore clamped() {
        double value = Double.isFinite(score) ? Math.max(-1.0, Math.min(1.0, score)) : 0.0;
        return value == score ? this : new SentimentScore(value, label);
    }
}
