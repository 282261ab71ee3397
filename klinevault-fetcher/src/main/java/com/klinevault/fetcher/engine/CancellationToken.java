package com.klinevault.fetcher.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal for a fetch, optionally with a deadline.
 * A passed deadline counts as cancellation.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Instant deadline;
    private final Clock clock;

    private CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * A token that is only cancelled by {@link #cancel()}.
     */
    public static CancellationToken create() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    /**
     * A token that is never cancelled by deadline. Callers may still cancel it.
     */
    public static CancellationToken none() {
        return create();
    }

    public static CancellationToken withDeadline(Instant deadline) {
        return withDeadline(deadline, Clock.systemUTC());
    }

    public static CancellationToken withDeadline(Instant deadline, Clock clock) {
        return new CancellationToken(deadline, clock);
    }

    public static CancellationToken withTimeout(Duration timeout) {
        Clock clock = Clock.systemUTC();
        return new CancellationToken(clock.instant().plus(timeout), clock);
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0 || deadlinePassed();
    }

    /**
     * Wait up to {@code duration}, returning early on cancellation or deadline.
     *
     * @return true if the token is cancelled when the wait ends
     */
    public boolean await(Duration duration) throws InterruptedException {
        long waitNanos = duration.toNanos();
        if (deadline != null) {
            long remaining = Duration.between(clock.instant(), deadline).toNanos();
            waitNanos = Math.min(waitNanos, Math.max(0, remaining));
        }
        if (waitNanos > 0) {
            cancelled.await(waitNanos, TimeUnit.NANOSECONDS);
        }
        return isCancelled();
    }

    private boolean deadlinePassed() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public String reason() {
        if (cancelled.getCount() == 0) return "cancelled by caller";
        if (deadlinePassed()) return "deadline " + deadline + " passed";
        return "not cancelled";
    }
}
