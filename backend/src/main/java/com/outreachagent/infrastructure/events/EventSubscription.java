package com.outreachagent.infrastructure.events;

import com.outreachagent.domain.pipeline.model.PipelineEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbound event queue owned by exactly one observer.
 * <p>
 * The queue is unbounded: publishers never block and never drop. A slow
 * observer only grows its own queue.
 * </p>
 */
public final class EventSubscription {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long id = SEQUENCE.incrementAndGet();
    private final BlockingQueue<PipelineEvent> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    EventSubscription() {
    }

    public long id() {
        return id;
    }

    /**
     * Enqueues without blocking. Returns false once the subscription is closed.
     */
    boolean offer(PipelineEvent event) {
        if (closed.get()) {
            return false;
        }
        return queue.offer(event);
    }

    /**
     * Waits up to {@code timeout} for the next event; null on timeout.
     */
    public PipelineEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public PipelineEvent poll() {
        return queue.poll();
    }

    public List<PipelineEvent> drain() {
        List<PipelineEvent> events = new ArrayList<>();
        queue.drainTo(events);
        return events;
    }

    public int pending() {
        return queue.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    boolean close() {
        if (closed.compareAndSet(false, true)) {
            queue.clear();
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "EventSubscription#" + id;
    }
}
