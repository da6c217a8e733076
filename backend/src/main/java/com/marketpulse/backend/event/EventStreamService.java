package com.marketpulse.backend.event;

import com.marketpulse.backend.config.PulseProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Bridges the event bus to server-sent events. Each connection gets an initial state snapshot,
 * then every event after its cursor with the event id on the {@code id:} line, so a client
 * reconnecting with {@code Last-Event-ID} resumes where it stopped.
 */
@Service
@Slf4j
public class EventStreamService {

    private final EventBusService eventBusService;
    private final long timeoutMs;

    public EventStreamService(EventBusService eventBusService, PulseProperties properties) {
        this.eventBusService = eventBusService;
        this.timeoutMs = properties.getEvents().getSseTimeoutMs();
    }

    /**
     * @param sinceId last id the client has seen, or null to receive only new events
     * @param state   snapshot sent before any event
     */
    public SseEmitter open(Long sinceId, Supplier<Object> state) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        AtomicReference<Subscription> subscription = new AtomicReference<>();
        Runnable cleanup = () -> {
            Subscription current = subscription.getAndSet(null);
            if (current != null) {
                current.close();
            }
        };
        emitter.onCompletion(cleanup);
        emitter.onTimeout(() -> {
            cleanup.run();
            emitter.complete();
        });
        emitter.onError(error -> cleanup.run());

        try {
            emitter.send(SseEmitter.event().name("state").data(state.get(), MediaType.APPLICATION_JSON));
            if (sinceId != null) {
                subscription.set(eventBusService.subscribeFrom(sinceId,
                        gap -> sendGap(emitter, gap), event -> send(emitter, event)));
            } else {
                subscription.set(eventBusService.subscribe(event -> send(emitter, event)));
            }
        } catch (IOException | UncheckedIOException | IllegalStateException ex) {
            log.debug("SSE client went away during setup: {}", ex.getMessage());
            cleanup.run();
            emitter.completeWithError(ex);
        }
        return emitter;
    }

    private static void sendGap(SseEmitter emitter, ReplayGap gap) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("since_id", gap.sinceId());
        data.put("oldest_id", gap.oldestId());
        data.put("latest_id", gap.latestId());
        try {
            emitter.send(SseEmitter.event().name("gap").data(data, MediaType.APPLICATION_JSON));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    /**
     * Throws when the client is gone so the bus drops the subscription.
     */
    private static void send(SseEmitter emitter, PulseEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .id(Long.toString(event.id()))
                    .name(event.type().wireName())
                    .data(event, MediaType.APPLICATION_JSON));
        } catch (IOException ex) {
            emitter.completeWithError(ex);
            throw new UncheckedIOException(ex);
        }
    }
}
