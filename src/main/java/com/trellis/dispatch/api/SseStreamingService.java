package com.trellis.dispatch.api;

import com.trellis.core.events.CoordinationEvent;
import com.trellis.core.events.EventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances.
 * <p>
 * An emitter either follows one scope (a task id or thread id) or every event. Emitter
 * completion, timeout and error all release the bus subscription. Heartbeats are sent
 * as SSE comments so idle connections survive proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    static final String ALL_SCOPES = "*";

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks clean up
                log.debug("Heartbeat failed for scope {}: {}", registration.scopeId, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for scope {} (emitter not active)", registration.scopeId);
            }
        }
    }

    /**
     * Creates an emitter streaming events whose scope is {@code scopeId}.
     */
    public SseEmitter createEmitter(String scopeId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventBus.Subscription subscription = eventBus.subscribe(scopeId, event -> sendEvent(emitter, event));
        return register(scopeId, emitter, subscription);
    }

    /**
     * Creates an emitter streaming every event on the bus.
     */
    public SseEmitter createGlobalEmitter() {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventBus.Subscription subscription = eventBus.subscribeAll(event -> sendEvent(emitter, event));
        return register(ALL_SCOPES, emitter, subscription);
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private SseEmitter register(String scopeId, SseEmitter emitter, EventBus.Subscription subscription) {
        var registration = new EmitterRegistration(scopeId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> {
            log.debug("SSE emitter error for scope {}: {}", scopeId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial heartbeat for scope {}: {}", scopeId, e.getMessage());
        }
        log.info("SSE emitter created for scope {} (timeout={}ms)", scopeId, timeoutMs);
        return emitter;
    }

    static Map<String, Object> toData(CoordinationEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (event.taskId() != null) {
            data.put("taskId", event.taskId());
        }
        if (event.threadId() != null) {
            data.put("threadId", event.threadId());
        }
        if (event.previousStatus() != null) {
            data.put("previousStatus", event.previousStatus());
        }
        if (event.newStatus() != null) {
            data.put("newStatus", event.newStatus());
        }
        if (event.payload() != null) {
            data.putAll(event.payload());
        }
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private void sendEvent(SseEmitter emitter, CoordinationEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.eventType())
                    .data(toData(event)));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for scope {}: {}",
                    event.eventType(), event.scopeId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for scope {}", registration.scopeId);
    }

    private record EmitterRegistration(
            String scopeId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
