package com.devflow.dispatch.api;

import com.devflow.core.events.EventBus;
import com.devflow.core.events.ExecutionEvent;
import com.devflow.core.events.ExecutionEventType;
import com.devflow.core.model.CommandResult;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances for SSE streaming.
 * <p>
 * Each connection subscribes to one execution and receives its {@code output}, {@code error},
 * {@code progress} and {@code complete} events as named SSE frames. The emitter completes
 * after the {@code complete} frame. Heartbeat comments keep idle connections open through
 * proxies.
 * <p>
 * Bus callbacks only queue frames; a single sender thread writes them to the emitters in
 * publication order, off the runner's stream-draining threads.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes (long test runs). */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    private final ExecutorService sender = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "sse-sender");
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
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdownNow();
        sender.shutdownNow();
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // the emitter's own callbacks clean up closed connections
                log.debug("Heartbeat failed for execution {}: {}", registration.executionId, e.getMessage());
            }
        }
    }

    /**
     * Creates an SSE emitter that streams events for the given execution.
     */
    public SseEmitter createEmitter(String executionId) {
        return createEmitter(executionId, id -> Optional.empty());
    }

    /**
     * Creates an SSE emitter for the given execution. If {@code finished} already knows a
     * terminal result for it, a single {@code complete} frame carrying that result is sent
     * and the emitter completes.
     */
    public SseEmitter createEmitter(String executionId, Function<String, Optional<CommandResult>> finished) {
        SseEmitter emitter = newEmitter(timeoutMs);
        var registration = new EmitterRegistration(executionId, emitter);

        // subscribe before the history lookup so a completion in between is not missed
        registration.subscription = eventBus.subscribe(executionId, event -> forward(registration, event));
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for execution {}", executionId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for execution {}: {}", executionId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for execution {}: {}", executionId, e.getMessage());
        }

        finished.apply(executionId).ifPresent(result -> {
            log.debug("Execution {} already finished, replaying its result", executionId);
            enqueue(registration, ExecutionEventType.COMPLETE, historyPayload(result));
        });

        log.debug("SSE emitter created for execution {} (timeout={}ms)", executionId, timeoutMs);
        return emitter;
    }

    SseEmitter newEmitter(long timeout) {
        return new SseEmitter(timeout);
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    static Map<String, Object> payload(ExecutionEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("executionId", event.executionId());
        switch (event.type()) {
            case OUTPUT, ERROR -> data.put("text", event.text());
            case PROGRESS -> data.put("progress", event.progress());
            case COMPLETE -> data.put("result", event.result());
        }
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    static Map<String, Object> historyPayload(CommandResult result) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("executionId", result.id());
        data.put("result", result);
        data.put("timestamp", Instant.now().toString());
        return data;
    }

    private void forward(EmitterRegistration registration, ExecutionEvent event) {
        enqueue(registration, event.type(), payload(event));
    }

    private void enqueue(EmitterRegistration registration, ExecutionEventType type, Map<String, Object> data) {
        if (registration.completed.get()) {
            return;
        }
        boolean terminal = type == ExecutionEventType.COMPLETE;
        if (terminal && !registration.completed.compareAndSet(false, true)) {
            return;
        }
        try {
            sender.execute(() -> send(registration, type, data));
        } catch (RejectedExecutionException e) {
            log.debug("SSE sender stopped, dropping {} for execution {}", type, registration.executionId);
        }
    }

    private void send(EmitterRegistration registration, ExecutionEventType type, Map<String, Object> data) {
        try {
            registration.emitter.send(SseEmitter.event()
                    .name(type.wireName())
                    .data(data));
            if (type == ExecutionEventType.COMPLETE) {
                registration.emitter.complete();
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for execution {}: {}",
                    type, registration.executionId, e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        EventBus.Subscription subscription = registration.subscription;
        if (subscription != null) {
            subscription.unsubscribe();
        }
        activeRegistrations.remove(registration);
    }

    private static final class EmitterRegistration {
        final String executionId;
        final SseEmitter emitter;
        final AtomicBoolean completed = new AtomicBoolean();
        volatile EventBus.Subscription subscription;

        EmitterRegistration(String executionId, SseEmitter emitter) {
            this.executionId = executionId;
            this.emitter = emitter;
        }
    }
}
