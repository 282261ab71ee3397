package com.klinevault.fetcher;

import com.klinevault.core.exception.FetchException;
import com.klinevault.core.model.Candle;
import com.klinevault.core.util.UtcTimes;
import com.klinevault.fetcher.config.FetcherConfig;
import com.klinevault.fetcher.engine.CancellationToken;
import com.klinevault.fetcher.store.CsvUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Command-line fetch of a kline history.
 *
 * Usage: KlineFetcherApp SYMBOL START END [OUTPUT.csv]
 * START and END are ISO dates or date-times, UTC unless an offset is given.
 * Ctrl-C cancels the fetch at the next page boundary or backoff wait; the JVM waits
 * for the fetch to unwind (at most one request timeout plus a grace period) before exiting.
 */
public class KlineFetcherApp {
    private static final Logger LOG = LoggerFactory.getLogger(KlineFetcherApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    public static void main(String[] args) {
        System.exit(run(args, FetcherConfig.load()));
    }

    static int run(String[] args, FetcherConfig config) {
        if (args.length < 3 || args.length > 4) {
            System.err.println("Usage: KlineFetcherApp SYMBOL START END [OUTPUT.csv]");
            return EXIT_USAGE;
        }

        String symbol = args[0].toUpperCase(Locale.ROOT);
        long startMs;
        long endMs;
        try {
            startMs = UtcTimes.parseToEpochMillis(args[1]);
            endMs = UtcTimes.parseToEpochMillis(args[2]);
        } catch (DateTimeParseException e) {
            System.err.println("Invalid date: " + e.getParsedString());
            return EXIT_USAGE;
        }

        CancellationToken cancel = CancellationToken.create();
        ShutdownCancellation shutdown = new ShutdownCancellation(cancel,
            config.getFetchOptions().timeout().plus(SHUTDOWN_GRACE));
        Thread hook = new Thread(shutdown, "fetch-cancel");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            HistoricalDataService service = new HistoricalDataService(config);
            List<Candle> candles = service.fetchData(symbol, startMs, endMs, true, cancel,
                progress -> LOG.info("{} ({}%)", progress.message(), progress.percentComplete()));

            if (args.length == 4) {
                Path output = Paths.get(args[3]);
                CsvUtils.writeCsv(output, Candle.CSV_HEADER, candles, Candle::toCsv);
                LOG.info("Wrote {} candles to {}", candles.size(), output);
            }
            LOG.info("{}: {} candles from {} to {}", symbol, candles.size(),
                candles.get(0).openTimeMs(), candles.get(candles.size() - 1).openTimeMs());
            return EXIT_OK;
        } catch (FetchException | IOException e) {
            LOG.error("Fetch of {} failed", symbol, e);
            return EXIT_FAILED;
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid request: {}", e.getMessage());
            return EXIT_USAGE;
        } finally {
            shutdown.release();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                LOG.debug("JVM already shutting down");
            }
        }
    }
}
