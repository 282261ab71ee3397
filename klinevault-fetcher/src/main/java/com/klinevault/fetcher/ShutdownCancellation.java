package com.klinevault.fetcher;

import com.klinevault.fetcher.engine.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shutdown hook body: cancels the running fetch, then holds the JVM open until the
 * fetch has unwound (or {@code maxWait} passes) so the cancellation is logged.
 */
class ShutdownCancellation implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(ShutdownCancellation.class);

    private final CancellationToken cancel;
    private final Duration maxWait;
    private final CountDownLatch finished = new CountDownLatch(1);

    ShutdownCancellation(CancellationToken cancel, Duration maxWait) {
        this.cancel = cancel;
        this.maxWait = maxWait;
    }

    @Override
    public void run() {
        LOG.info("Shutdown requested, cancelling fetch");
        cancel.cancel();
        try {
            if (!finished.await(maxWait.toNanos(), TimeUnit.NANOSECONDS)) {
                LOG.warn("Fetch did not stop within {}", maxWait);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the fetch to stop");
        }
    }

    /**
     * Called once the fetch has returned, whatever its outcome.
     */
    void release() {
        finished.countDown();
    }
}
