package com.klinevault.fetcher;

import com.klinevault.fetcher.engine.CancellationToken;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
class ShutdownCancellationTest {

    @Test
    void cancelsAndWaitsUntilReleased() throws Exception {
        CancellationToken token = CancellationToken.create();
        ShutdownCancellation shutdown = new ShutdownCancellation(token, Duration.ofSeconds(30));
        Thread hook = new Thread(shutdown, "fetch-cancel");

        hook.start();

        assertTrue(token.await(Duration.ofSeconds(5)));
        hook.join(200);
        assertTrue(hook.isAlive(), "hook should hold until the fetch releases it");

        shutdown.release();
        hook.join(5_000);
        assertFalse(hook.isAlive());
    }

    @Test
    void givesUpAfterMaxWait() throws Exception {
        CancellationToken token = CancellationToken.create();
        Thread hook = new Thread(new ShutdownCancellation(token, Duration.ofMillis(100)));

        hook.start();
        hook.join(5_000);

        assertFalse(hook.isAlive());
        assertTrue(token.isCancelled());
    }

    @Test
    void releaseBeforeShutdownReturnsImmediately() {
        CancellationToken token = CancellationToken.create();
        ShutdownCancellation shutdown = new ShutdownCancellation(token, Duration.ofSeconds(30));

        shutdown.release();
        shutdown.run();

        assertTrue(token.isCancelled());
    }
}
