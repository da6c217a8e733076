package com.marketpulse.backend.service.loop;

public enum LoopOutcome {
    /** The run produced or changed something. */
    WORKED,
    /** Nothing new; the worker may stretch its next wait. */
    IDLE
}
