package com.klinevault.fetcher;

import com.klinevault.fetcher.config.FetcherConfig;
import com.klinevault.fetcher.engine.FetchOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class KlineFetcherAppTest {

    @TempDir
    Path tempDir;

    private FetcherConfig offlineConfig() {
        return new FetcherConfig("http://127.0.0.1:1", "/api/v3/klines", tempDir, FetchOptions.defaults());
    }

    @Test
    void wrongArgumentCountIsUsageError() {
        assertEquals(KlineFetcherApp.EXIT_USAGE, KlineFetcherApp.run(new String[] {"BTCUSDT"}, offlineConfig()));
    }

    @Test
    void badDateIsUsageError() {
        assertEquals(KlineFetcherApp.EXIT_USAGE,
            KlineFetcherApp.run(new String[] {"BTCUSDT", "yesterday", "2026-01-02"}, offlineConfig()));
    }

    @Test
    void emptyRangeIsReportedAsFailure() {
        // start == end: the engine returns no candles without touching the network
        assertEquals(KlineFetcherApp.EXIT_FAILED,
            KlineFetcherApp.run(new String[] {"BTCUSDT", "2026-01-02", "2026-01-02"}, offlineConfig()));
    }
}
