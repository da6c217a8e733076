package com.marketpulse.backend.service.signal;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.model.SignalAction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Threshold rule on alpha. With hysteresis enabled, an ACCUMULATE or WAIT from the previous tick
 * is kept until alpha falls back inside the configured band.
 */
@Component
@RequiredArgsConstructor
public class DecisionPolicy {

    private final PulseProperties properties;

    public SignalAction decide(double alpha, SignalAction previous) {
        PulseProperties.Signal config = properties.getSignal();
        SignalAction action;
        if (alpha >= config.getThresholdUp()) {
            action = SignalAction.ACCUMULATE;
        } else if (alpha <= config.getThresholdDown()) {
            action = SignalAction.WAIT;
        } else {
            action = SignalAction.HOLD;
        }
        PulseProperties.Hysteresis hysteresis = config.getHysteresis();
        if (!hysteresis.isEnabled() || previous == null || action != SignalAction.HOLD) {
            return action;
        }
        if (previous == SignalAction.ACCUMULATE && alpha > hysteresis.getBand()) {
            return SignalAction.ACCUMULATE;
        }
        if (previous == SignalAction.WAIT && alpha < -hysteresis.getBand()) {
            return SignalAction.WAIT;
        }
        return action;
    }
}
