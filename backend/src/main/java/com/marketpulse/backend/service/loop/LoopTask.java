package com.marketpulse.backend.service.loop;

@FunctionalInterface
public interface LoopTask {

    LoopOutcome run();
}
