package com.marketpulse.backend.util;

import java.time.Duration;
import java.util.Locale;

public final class Timeframes {

    private Timeframes() {
    }

    /**
     * Parses exchange-style timeframes such as {@code 1m}, {@code 15m}, {@code 1h}, {@code 1d}.
     */
    public static Duration parse(String timeframe) {
        if (timeframe == null || timeframe.length() < 2) {
            throw new IllegalArgumentException("Invalid timeframe: " + timeframe);
        }
        String value = timeframe.trim().toLowerCase(Locale.ROOT);
        char unit = value.charAt(value.length() - 1);
        long amount;
        try {
            amount = Long.parseLong(value.substring(0, value.length() - 1));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid timeframe: " + timeframe, ex);
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("Invalid timeframe: " + timeframe);
        }
        return switch (unit) {
            case 'm' -> Duration.ofMinutes(amount);
            case 'h' -> Duration.ofHours(amount);
            case 'd' -> Duration.ofDays(amount);
            default -> throw new IllegalArgumentException("Invalid timeframe: " + timeframe);
        };
    }

    /**
     * Number of candles of the given timeframe that cover the span, at least one.
     */
    public static int candlesIn(Duration span, String timeframe) {
        long step = parse(timeframe).toSeconds();
        return (int) Math.max(1, span.toSeconds() / step);
    }
}
