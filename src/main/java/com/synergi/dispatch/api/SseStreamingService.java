package com.synergi.dispatch.api;

import com.synergi.core.events.EventBus;
import com.synergi.core.events.SynergiEvent;
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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter}s.
 * <p>
 * An emitter follows either one task or, for a named client, every task. Each registration
 * owns exactly one bus subscription, removed when the emitter completes, times out or errors,
 * and also when a write fails; a closed registration is never written to again. A second
 * global connection with the same client id replaces the first. Heartbeat comments keep idle
 * connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;
    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, EmitterRegistration> clients = new ConcurrentHashMap<>();

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
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
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
        activeRegistrations.forEach(this::close);
        log.info("SSE heartbeat scheduler stopped");
    }

    void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            write(registration, SseEmitter.event().comment("heartbeat"));
        }
    }

    /**
     * Emitter for the events of one task.
     */
    public SseEmitter createEmitter(String taskId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        var registration = new EmitterRegistration("task:" + taskId, emitter);
        registration.subscription = eventBus.subscribe(taskId, event -> sendEvent(registration, event));
        register(registration);
        log.info("SSE emitter created for task {} (timeout={}ms)", taskId, timeoutMs);
        return emitter;
    }

    /**
     * Emitter for the events of every task, keyed by client id.
     */
    public SseEmitter createGlobalEmitter(String clientId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        var registration = new EmitterRegistration("client:" + clientId, emitter);
        registration.subscription = eventBus.subscribeAll(event -> sendEvent(registration, event));
        EmitterRegistration previous = clients.put(clientId, registration);
        if (previous != null) {
            log.info("Client {} reconnected, closing previous stream", clientId);
            close(previous);
        }
        register(registration);
        log.info("SSE emitter created for client {} (timeout={}ms)", clientId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void register(EmitterRegistration registration) {
        activeRegistrations.add(registration);
        SseEmitter emitter = registration.emitter;
        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for {}", registration.key);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for {}: {}", registration.key, ex.getMessage());
            cleanup(registration);
        });
        write(registration, SseEmitter.event().comment("connected"));
    }

    private void sendEvent(EmitterRegistration registration, SynergiEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("taskId", event.taskId());
        if (event.stepIndex() != null) {
            data.put("stepIndex", event.stepIndex());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        write(registration, SseEmitter.event().name(event.eventType()).data(data));
    }

    private void write(EmitterRegistration registration, SseEmitter.SseEventBuilder event) {
        if (registration.closed.get()) {
            return;
        }
        try {
            synchronized (registration) {
                registration.emitter.send(event);
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("SSE write failed for {} (connection likely closed): {}", registration.key, e.getMessage());
            close(registration);
        }
    }

    private void close(EmitterRegistration registration) {
        cleanup(registration);
        try {
            registration.emitter.complete();
        } catch (IllegalStateException e) {
            log.debug("SSE emitter for {} already completed", registration.key);
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (!registration.closed.compareAndSet(false, true)) {
            return;
        }
        if (registration.subscription != null) {
            registration.subscription.unsubscribe();
        }
        activeRegistrations.remove(registration);
        if (registration.key.startsWith("client:")) {
            clients.remove(registration.key.substring("client:".length()), registration);
        }
        log.debug("Cleaned up SSE registration for {}", registration.key);
    }

    private static final class EmitterRegistration {
        final String key;
        final SseEmitter emitter;
        final AtomicBoolean closed = new AtomicBoolean(false);
        volatile EventBus.Subscription subscription;

        EmitterRegistration(String key, SseEmitter emitter) {
            this.key = key;
            this.emitter = emitter;
        }
    }
}
