package com.klinevault.fetcher;

import com.klinevault.core.exception.FetchException;
import com.klinevault.core.exception.NoDataException;
import com.klinevault.core.model.Candle;
import com.klinevault.core.model.FetchProgress;
import com.klinevault.fetcher.config.FetcherConfig;
import com.klinevault.fetcher.engine.CancellationToken;
import com.klinevault.fetcher.engine.FetchEngine;
import com.klinevault.fetcher.engine.FetchOptions;
import com.klinevault.fetcher.http.OkHttpKlineTransport;
import com.klinevault.fetcher.store.CandleCsvCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Entry point for consumers that want a candle history for a range: serves it from the
 * CSV cache when present, otherwise fetches it and caches the complete result.
 */
public class HistoricalDataService {

    private static final Logger log = LoggerFactory.getLogger(HistoricalDataService.class);

    private final FetchEngine engine;
    private final CandleCsvCache cache;
    private final FetchOptions options;

    public HistoricalDataService(FetcherConfig config) {
        this(new FetchEngine(new OkHttpKlineTransport(config.getBaseUrl(), config.getKlinesPath())),
            new CandleCsvCache(config.getCacheDir()), config.getFetchOptions());
    }

    public HistoricalDataService(FetchEngine engine, CandleCsvCache cache, FetchOptions options) {
        this.engine = engine;
        this.cache = cache;
        this.options = options;
    }

    public List<Candle> fetchData(String symbol, long startMs, long endMs, boolean useCache,
                                  Consumer<FetchProgress> onProgress) throws FetchException, IOException {
        return fetchData(symbol, startMs, endMs, useCache, CancellationToken.none(), onProgress);
    }

    /**
     * Get candles for [startMs, endMs).
     *
     * @throws NoDataException if the upstream has nothing in the range
     * @throws com.klinevault.core.exception.FetchFailedException if a page ran out of retries
     * @throws com.klinevault.core.exception.FetchCancelledException if {@code cancel} fired
     * @throws IOException if the cache cannot be read or written
     */
    public List<Candle> fetchData(String symbol, long startMs, long endMs, boolean useCache,
                                  CancellationToken cancel, Consumer<FetchProgress> onProgress)
            throws FetchException, IOException {
        Path cachePath = cache.cachePath(symbol, options.interval(), startMs, endMs);

        if (useCache && cache.exists(cachePath)) {
            log.info("Loading {} from cache {}", symbol, cachePath.getFileName());
            List<Candle> cached = cache.load(cachePath);
            if (onProgress != null) {
                onProgress.accept(new FetchProgress(cached.size(), cached.size(),
                    "Loaded from cache: " + cachePath.getFileName()));
            }
            return cached;
        }

        List<Candle> candles = engine.fetch(symbol, startMs, endMs, options, cancel, onProgress).orElseThrow();
        if (candles.isEmpty()) {
            throw new NoDataException("No " + options.interval() + " klines for " + symbol
                + " in [" + startMs + ", " + endMs + ")");
        }

        if (useCache) {
            cache.save(cachePath, candles);
        }
        return candles;
    }
}
