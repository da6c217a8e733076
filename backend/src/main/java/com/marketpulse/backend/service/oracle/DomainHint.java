package com.marketpulse.backend.service.oracle;

import com.marketpulse.backend.model.ItemSource;

import java.util.Locale;

/**
 * Selects the scoring variant: a financial-news model for feed text, a social model for posts.
 */
public enum DomainHint {
    NEWS,
    SOCIAL;

    public static DomainHint forSource(ItemSource source) {
        return source == ItemSource.SOCIAL ? SOCIAL : NEWS;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
