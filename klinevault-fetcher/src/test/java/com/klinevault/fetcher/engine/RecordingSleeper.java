package com.klinevault.fetcher.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that returns immediately and remembers what it was asked to wait.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new ArrayList<>();
    private Runnable onSleep = () -> { };

    @Override
    public boolean sleep(Duration duration, CancellationToken token) {
        sleeps.add(duration);
        onSleep.run();
        return token.isCancelled();
    }

    /**
     * Run an action during every sleep, e.g. cancel the token.
     */
    public RecordingSleeper onSleep(Runnable action) {
        this.onSleep = action;
        return this;
    }

    public List<Duration> sleeps() {
        return sleeps;
    }
}
