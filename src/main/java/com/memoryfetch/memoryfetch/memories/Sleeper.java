package com.memoryfetch.memoryfetch.memories;

import java.time.Duration;

/**
 * Blocking pause used for retry backoff and pacing. Interruptible.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
