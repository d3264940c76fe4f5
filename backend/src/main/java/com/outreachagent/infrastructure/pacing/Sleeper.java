package com.outreachagent.infrastructure.pacing;

import java.time.Duration;

/**
 * Blocking delay used by pacing and backoff. Swapped out in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
