package com.marketpulse.backend.event;

import java.util.function.Consumer;

/**
 * Handle for a live listener. {@link #gap()} reports whether the replay requested at subscribe
 * time started after events had already been evicted.
 */
public final class Subscription implements AutoCloseable {

    private final EventBusService bus;
    private final Consumer<PulseEvent> listener;
    private final boolean gap;
    private volatile boolean open = true;

    Subscription(EventBusService bus, Consumer<PulseEvent> listener, boolean gap) {
        this.bus = bus;
        this.listener = listener;
        this.gap = gap;
    }

    public boolean gap() {
        return gap;
    }

    public boolean isOpen() {
        return open;
    }

    Consumer<PulseEvent> listener() {
        return listener;
    }

    @Override
    public void close() {
        open = false;
        bus.unsubscribe(this);
    }
}
