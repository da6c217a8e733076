package com.marketpulse.backend.service.signal;

import com.marketpulse.backend.service.indicator.TechnicalSnapshot;

/**
 * Inputs of one decision. {@code technical} is null when no price data was available.
 */
public record FeatureVector(double ema15, double mentionsZ, TechnicalSnapshot technical) {

    public static FeatureVector sentimentOnly(double ema15, double mentionsZ) {
        return new FeatureVector(ema15, mentionsZ, null);
    }

    public boolean hasTechnical() {
        return technical != null;
    }
}
