package com.klinevault.fetcher.store;

import com.klinevault.core.model.Candle;
import com.klinevault.core.util.UtcTimes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * CSV cache of completed range fetches, one file per exact symbol/interval/range.
 * Bounds at UTC midnight are written as dates, others with the time of day:
 * BTCUSDT_30m_20260101_to_20260131.csv, BTCUSDT_30m_20260101_to_20260101T120000000.csv
 */
public class CandleCsvCache {

    private static final Logger log = LoggerFactory.getLogger(CandleCsvCache.class);
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter FILE_DATE_TIME = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS");

    private final Path cacheDir;

    public CandleCsvCache(Path cacheDir) {
        this.cacheDir = cacheDir;
        try {
            Files.createDirectories(cacheDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create cache directory " + cacheDir, e);
        }
    }

    public Path cachePath(String symbol, String interval, long startMs, long endMs) {
        String filename = symbol + "_" + interval + "_" + fileTime(startMs)
            + "_to_" + fileTime(endMs) + ".csv";
        return cacheDir.resolve(filename);
    }

    private static String fileTime(long epochMillis) {
        LocalDateTime utc = UtcTimes.toUtcDateTime(epochMillis);
        return utc.toLocalTime().equals(LocalTime.MIDNIGHT)
            ? FILE_DATE.format(utc)
            : FILE_DATE_TIME.format(utc);
    }

    public boolean exists(Path path) {
        return Files.isRegularFile(path);
    }

    public List<Candle> load(Path path) throws IOException {
        List<Candle> candles = CsvUtils.readCsv(path, "timestamp", Candle::fromCsv);
        log.debug("Loaded {} candles from {}", candles.size(), path.getFileName());
        return candles;
    }

    public void save(Path path, List<Candle> candles) throws IOException {
        // Entries only ever appear complete
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        CsvUtils.writeCsv(tmp, Candle.CSV_HEADER, candles, Candle::toCsv);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        log.info("Cached {} candles to {}", candles.size(), path.getFileName());
    }

    public Path getCacheDir() {
        return cacheDir;
    }
}
