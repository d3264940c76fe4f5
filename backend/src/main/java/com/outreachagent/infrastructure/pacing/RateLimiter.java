package com.outreachagent.infrastructure.pacing;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Enforces a minimum spacing between consecutive sends.
 * <p>
 * {@code interval = 60s / maxPerMinute}; a non-positive rate disables pacing.
 * The last-send stamp is taken on exit from {@link #acquire()}, whatever the
 * outcome of the send that follows. Not thread-safe: one caller at a time.
 * </p>
 */
@Slf4j
public class RateLimiter {

    private final Duration interval;
    private final Clock clock;
    private final Sleeper sleeper;

    private Instant lastSend;

    public RateLimiter(int maxPerMinute, Clock clock, Sleeper sleeper) {
        this(intervalFor(maxPerMinute), clock, sleeper);
    }

    public RateLimiter(Duration interval, Clock clock, Sleeper sleeper) {
        this.interval = interval.isNegative() ? Duration.ZERO : interval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public static Duration intervalFor(int maxPerMinute) {
        if (maxPerMinute <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(Duration.ofMinutes(1).toNanos() / maxPerMinute);
    }

    public Duration interval() {
        return interval;
    }

    /**
     * Forgets the previous send, so the next {@link #acquire()} does not wait.
     */
    public void reset() {
        lastSend = null;
    }

    /**
     * Blocks until at least {@link #interval()} has passed since the previous send.
     *
     * @return how long the caller was held back
     */
    public Duration acquire() throws InterruptedException {
        if (interval.isZero()) {
            return Duration.ZERO;
        }

        Duration waited = Duration.ZERO;
        if (lastSend != null) {
            Duration sinceLast = Duration.between(lastSend, clock.instant());
            if (sinceLast.compareTo(interval) < 0) {
                waited = interval.minus(sinceLast);
                log.debug("Rate limiting: waiting {} ms before next send", waited.toMillis());
                sleeper.sleep(waited);
            }
        }

        lastSend = clock.instant();
        return waited;
    }
}
