package com.marketpulse.backend.event;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EventType {
    STATE,
    SIGNAL,
    ITEM,
    PRICE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
