package com.marketpulse.backend.service.notify;

import com.marketpulse.backend.model.SignalAction;
import com.marketpulse.backend.service.signal.SignalTick;

/**
 * Best-effort push on action transitions. Implementations may throw; callers log and move on.
 */
public interface NotificationSink {

    void notifyActionChange(SignalAction previous, SignalAction current, SignalTick tick);
}
