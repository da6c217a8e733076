package com.marketpulse.backend.service.signal;

import java.util.Map;

/**
 * @param raw           weighted sum before multipliers
 * @param multiplier    combined trend and volatility multiplier applied to {@code raw}
 * @param contributions weight times normalized value, per named feature
 */
public record AlphaResult(double alpha, double raw, double multiplier, Map<String, Double> contributions) {
}
