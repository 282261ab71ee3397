package com.klinevault.fetcher.engine;

import com.klinevault.core.exception.FetchCancelledException;
import com.klinevault.core.exception.FetchException;
import com.klinevault.core.exception.FetchFailedException;
import com.klinevault.core.model.Candle;

import java.util.List;

/**
 * Outcome of one {@link FetchEngine} run. All-or-nothing: only {@link Success} carries candles.
 */
public sealed interface FetchResult {

    boolean isSuccess();

    /**
     * The candles of a successful run.
     *
     * @throws FetchFailedException    if a page ran out of retries
     * @throws FetchCancelledException if the run was cancelled
     */
    List<Candle> orElseThrow() throws FetchException;

    record Success(List<Candle> candles) implements FetchResult {
        public Success {
            candles = List.copyOf(candles);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public List<Candle> orElseThrow() {
            return candles;
        }
    }

    record Failed(FetchFailedException error) implements FetchResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public List<Candle> orElseThrow() throws FetchFailedException {
            throw error;
        }
    }

    /**
     * @param discardedCandles candles fetched before cancellation, dropped from the result
     */
    record Cancelled(int discardedCandles, String reason) implements FetchResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public List<Candle> orElseThrow() throws FetchCancelledException {
            throw new FetchCancelledException("Fetch cancelled (" + reason + ") after "
                + discardedCandles + " candles");
        }
    }
}
