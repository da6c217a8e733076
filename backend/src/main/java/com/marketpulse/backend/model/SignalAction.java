package com.marketpulse.backend.model;

import java.util.Locale;

public enum SignalAction {
    HOLD,
    ACCUMULATE,
    WAIT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
