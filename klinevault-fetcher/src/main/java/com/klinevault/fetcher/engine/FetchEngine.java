package com.klinevault.fetcher.engine;

import com.klinevault.core.exception.FetchException;
import com.klinevault.core.exception.FetchFailedException;
import com.klinevault.core.exception.UpstreamException;
import com.klinevault.core.model.Candle;
import com.klinevault.core.model.FetchProgress;
import com.klinevault.core.model.PageRequest;
import com.klinevault.core.util.Intervals;
import com.klinevault.fetcher.http.HttpClientFactory;
import com.klinevault.fetcher.http.KlineTransport;
import com.klinevault.fetcher.http.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Pulls a complete, ascending kline history for [startMs, endMs) page by page.
 *
 * The cursor only moves to lastOpenTime + 1 after a page is accepted, so pages never
 * overlap and nothing between them is skipped. Each page gets its own retry budget with
 * {@link BackoffPolicy} waits between attempts; running out of attempts fails the whole
 * fetch and drops what was collected. An empty page ends the fetch successfully.
 *
 * Holds no per-call state, so one engine can serve independent fetches.
 */
public class FetchEngine {

    private static final Logger log = LoggerFactory.getLogger(FetchEngine.class);
    private static final int ERROR_BODY_SNIPPET = 200;

    private final KlineTransport transport;
    private final KlineParser parser;
    private final Sleeper sleeper;
    private final BackoffPolicy backoff;

    public FetchEngine(KlineTransport transport) {
        this(transport, Sleeper.system(), BackoffPolicy.DEFAULT);
    }

    public FetchEngine(KlineTransport transport, Sleeper sleeper, BackoffPolicy backoff) {
        this.transport = transport;
        this.parser = new KlineParser(HttpClientFactory.getMapper());
        this.sleeper = sleeper;
        this.backoff = backoff;
    }

    /**
     * Fetch with explicit parameters and a fixed 30m bar size.
     */
    public FetchResult fetch(String symbol, long startMs, long endMs, int limit, Duration timeout,
                             int maxAttempts, Duration interPageDelay) {
        FetchOptions options = new FetchOptions("30m", limit, timeout, maxAttempts, interPageDelay);
        return fetch(symbol, startMs, endMs, options, CancellationToken.none(), null);
    }

    public FetchResult fetch(String symbol, long startMs, long endMs, FetchOptions options) {
        return fetch(symbol, startMs, endMs, options, CancellationToken.none(), null);
    }

    /**
     * Fetch all klines in [startMs, endMs).
     *
     * @param cancel     checked before every page and around every sleep
     * @param onProgress optional, called after every accepted page
     * @return {@link FetchResult.Success} with an empty list if startMs >= endMs
     */
    public FetchResult fetch(String symbol, long startMs, long endMs, FetchOptions options,
                             CancellationToken cancel, Consumer<FetchProgress> onProgress) {
        if (startMs >= endMs) {
            log.debug("Empty window [{}, {}) for {}, nothing to fetch", startMs, endMs, symbol);
            return new FetchResult.Success(List.of());
        }

        int estimatedTotal = Intervals.estimateCount(startMs, endMs, options.interval());
        List<Candle> results = new ArrayList<>();
        long cursor = startMs;
        int pages = 0;

        log.info("Fetching {} {} klines in [{}, {})", symbol, options.interval(), startMs, endMs);
        report(onProgress, FetchProgress.starting(symbol, options.interval()));

        try {
            while (cursor < endMs) {
                if (cancel.isCancelled()) {
                    return cancelled(results, cancel.reason(), onProgress);
                }

                PageRequest request = new PageRequest(symbol, options.interval(), cursor, endMs, options.limit());
                List<Candle> page = fetchPage(request, options, cancel);
                if (page == null) {
                    return cancelled(results, cancel.reason(), onProgress);
                }
                pages++;

                if (page.isEmpty()) {
                    log.debug("Empty page at cursor {}, no more data in range", cursor);
                    break;
                }

                results.addAll(page);
                cursor = page.get(page.size() - 1).openTimeMs() + 1;

                report(onProgress, new FetchProgress(results.size(), estimatedTotal,
                    "Fetching " + symbol + " " + options.interval() + ": " + results.size() + " candles..."));
                log.debug("Page {}: {} candles, cursor now {}", pages, page.size(), cursor);

                if (cursor < endMs && !options.interPageDelay().isZero()) {
                    if (sleeper.sleep(options.interPageDelay(), cancel)) {
                        return cancelled(results, cancel.reason(), onProgress);
                    }
                }
            }
        } catch (FetchFailedException e) {
            log.warn("Fetch of {} aborted after {} candles: {}", symbol, results.size(), e.getMessage());
            return new FetchResult.Failed(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return cancelled(results, "interrupted", onProgress);
        }

        log.info("Fetch complete. {} {}: {} candles in {} pages", symbol, options.interval(), results.size(), pages);
        report(onProgress, FetchProgress.complete(results.size()));
        return new FetchResult.Success(results);
    }

    /**
     * Run one page through its retry budget.
     *
     * @return the page's candles, or null if cancelled during a backoff wait
     */
    private List<Candle> fetchPage(PageRequest request, FetchOptions options, CancellationToken cancel)
            throws FetchFailedException, InterruptedException {
        RetryBudget budget = new RetryBudget(options.maxAttempts());
        while (true) {
            FetchException cause;
            try {
                return attempt(request, options.timeout());
            } catch (FetchException e) {
                cause = e;
            }

            if (!budget.hasRemaining()) {
                throw new FetchFailedException(budget.attempt(), cause);
            }

            Duration wait = backoff.delayAfter(budget.attempt());
            log.warn("Attempt {}/{} for {} at {} failed ({}), retrying in {}s",
                budget.attempt(), budget.maxAttempts(), request.symbol(), request.startMs(),
                cause.getMessage(), wait.toSeconds());

            if (cancel.isCancelled() || sleeper.sleep(wait, cancel)) {
                return null;
            }
            budget.next();
        }
    }

    private List<Candle> attempt(PageRequest request, Duration timeout) throws FetchException {
        TransportResponse response = transport.get(request, timeout);
        if (!response.isOk()) {
            throw new UpstreamException(response.statusCode(), response.bodySnippet(ERROR_BODY_SNIPPET));
        }
        return parser.parse(response.body(), request);
    }

    private FetchResult cancelled(List<Candle> results, String reason, Consumer<FetchProgress> onProgress) {
        log.info("Fetch cancelled ({}). Discarding {} candles.", reason, results.size());
        report(onProgress, FetchProgress.cancelled(results.size()));
        return new FetchResult.Cancelled(results.size(), reason);
    }

    private static void report(Consumer<FetchProgress> onProgress, FetchProgress progress) {
        if (onProgress != null) {
            onProgress.accept(progress);
        }
    }
}
