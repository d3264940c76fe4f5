package com.outreachagent.interfaces.api.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.outreachagent.domain.pipeline.model.PipelineEvent;
import com.outreachagent.domain.pipeline.model.PipelineEventType;
import com.outreachagent.domain.pipeline.model.PipelineSnapshot;
import com.outreachagent.infrastructure.config.PipelineExecutionConfig;
import com.outreachagent.infrastructure.events.EventBroadcaster;
import com.outreachagent.infrastructure.events.EventSubscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Bridges one {@link EventSubscription} to one SSE connection.
 * <p>
 * The observer is subscribed before the {@code init} event is written, so nothing
 * published after the snapshot is taken can be missed. A pump thread drains the
 * subscription; any send failure, timeout or disconnect unsubscribes it.
 * </p>
 */
@Slf4j
@Component
public class PipelineEventStreamer {

    private static final long POLL_MILLIS = 500L;

    private final EventBroadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final long timeoutMillis;
    private final long heartbeatMillis;

    public PipelineEventStreamer(EventBroadcaster broadcaster,
                                 ObjectMapper objectMapper,
                                 @Qualifier(PipelineExecutionConfig.EVENT_STREAM_EXECUTOR) Executor executor,
                                 @Value("${outreach.events.timeout-ms:1800000}") long timeoutMillis,
                                 @Value("${outreach.events.heartbeat-ms:15000}") long heartbeatMillis) {
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.timeoutMillis = timeoutMillis;
        this.heartbeatMillis = heartbeatMillis;
    }

    public SseEmitter open(PipelineSnapshot snapshot) {
        SseEmitter emitter = new SseEmitter(timeoutMillis);
        EventSubscription subscription = broadcaster.subscribe();

        emitter.onCompletion(() -> broadcaster.unsubscribe(subscription));
        emitter.onTimeout(() -> {
            broadcaster.unsubscribe(subscription);
            emitter.complete();
        });
        emitter.onError(e -> broadcaster.unsubscribe(subscription));

        try {
            Map<String, Object> init = new LinkedHashMap<>();
            init.put("pipelineState", snapshot);
            init.put("timestamp", Instant.now());
            emitter.send(SseEmitter.event()
                    .name(PipelineEventType.INIT.wireName())
                    .data(objectMapper.writeValueAsString(init)));
        } catch (IOException e) {
            log.warn("[Events] Failed to send init event to {}: {}", subscription, e.getMessage());
            broadcaster.unsubscribe(subscription);
            emitter.completeWithError(e);
            return emitter;
        }

        executor.execute(() -> pump(emitter, subscription));
        return emitter;
    }

    private void pump(SseEmitter emitter, EventSubscription subscription) {
        long lastSentAt = System.currentTimeMillis();
        try {
            while (!subscription.isClosed()) {
                PipelineEvent event = subscription.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (event != null) {
                    emitter.send(SseEmitter.event()
                            .name(event.type())
                            .data(objectMapper.writeValueAsString(event)));
                    lastSentAt = System.currentTimeMillis();
                } else if (System.currentTimeMillis() - lastSentAt >= heartbeatMillis) {
                    // Detects clients that went away without closing the connection.
                    emitter.send(SseEmitter.event().comment("keepalive"));
                    lastSentAt = System.currentTimeMillis();
                }
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("[Events] {} disconnected: {}", subscription, e.getMessage());
            broadcaster.unsubscribe(subscription);
            emitter.completeWithError(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            broadcaster.unsubscribe(subscription);
            emitter.complete();
        }
    }
}
