package com.marketpulse.backend.service.signal;

import com.marketpulse.backend.model.Signal;
import com.marketpulse.backend.service.indicator.TechnicalSnapshot;

public record SignalTick(Signal signal, AggregateSnapshot aggregate, AlphaResult alpha, TechnicalSnapshot technical) {
}
