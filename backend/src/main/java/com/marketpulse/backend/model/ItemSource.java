package com.marketpulse.backend.model;

public enum ItemSource {
    FEED,
    SOCIAL,
    NOTIFICATION,
    SEED
}
