package com.outreachagent.domain.pipeline.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag for one run.
 * <p>
 * The worker consults it only between stages. A stage already in progress,
 * including an in-flight delivery attempt or backoff sleep, always runs to
 * completion; requesting cancellation never interrupts it.
 * </p>
 */
public final class CancellationToken {

    private final AtomicBoolean requested = new AtomicBoolean();

    /**
     * @return true if this call flipped the flag, false if it was already set
     */
    public boolean requestCancellation() {
        return requested.compareAndSet(false, true);
    }

    public boolean isCancellationRequested() {
        return requested.get();
    }
}
