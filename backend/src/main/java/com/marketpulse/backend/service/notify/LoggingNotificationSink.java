package com.marketpulse.backend.service.notify;

import com.marketpulse.backend.model.SignalAction;
import com.marketpulse.backend.service.signal.SignalTick;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public void notifyActionChange(SignalAction previous, SignalAction current, SignalTick tick) {
        log.info("Action changed {} -> {} asset={} alpha={}", previous, current,
                tick.signal().getAsset(), String.format("%.3f", tick.signal().getAlpha()));
    }
}
