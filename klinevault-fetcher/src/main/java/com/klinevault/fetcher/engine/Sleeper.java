package com.klinevault.fetcher.engine;

import java.time.Duration;

/**
 * Blocking pause used for backoff and page pacing.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Pause for {@code duration} unless the token is cancelled first.
     *
     * @return true if the pause ended because of cancellation
     */
    boolean sleep(Duration duration, CancellationToken token) throws InterruptedException;

    /**
     * Wall-clock sleeper that wakes as soon as the token is cancelled.
     */
    static Sleeper system() {
        return (duration, token) -> token.await(duration);
    }
}
