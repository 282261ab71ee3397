package com.klinevault.fetcher.config;

import com.klinevault.core.model.PageRequest;
import com.klinevault.fetcher.engine.FetchOptions;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration for the kline fetcher. Built once and passed to the engine and service.
 */
public class FetcherConfig {
    private static final String DEFAULT_BASE_URL = "https://api.binance.com";
    private static final String DEFAULT_KLINES_PATH = "/api/v3/klines";
    private static final String DEFAULT_INTERVAL = "30m";
    private static final int DEFAULT_LIMIT = PageRequest.MAX_LIMIT;
    private static final long DEFAULT_TIMEOUT_SECONDS = 15;
    private static final int DEFAULT_MAX_ATTEMPTS = 8;
    private static final long DEFAULT_PAGE_DELAY_MS = 200;
    private static final String DEFAULT_CACHE_DIR = "./cache";

    private final String baseUrl;
    private final String klinesPath;
    private final Path cacheDir;
    private final FetchOptions fetchOptions;

    public FetcherConfig(String baseUrl, String klinesPath, Path cacheDir, FetchOptions fetchOptions) {
        this.baseUrl = baseUrl;
        this.klinesPath = klinesPath;
        this.cacheDir = cacheDir;
        this.fetchOptions = fetchOptions;
    }

    /**
     * Load from system properties and environment, with defaults.
     */
    public static FetcherConfig load() {
        return load(System.getProperties(), System.getenv());
    }

    static FetcherConfig load(Properties props, Map<String, String> env) {
        String baseUrl = setting(props, env, "klinevault.base_url", "KLINEVAULT_BASE_URL", DEFAULT_BASE_URL);
        String path = setting(props, env, "klinevault.klines_path", "KLINEVAULT_KLINES_PATH", DEFAULT_KLINES_PATH);
        Path cacheDir = Paths.get(setting(props, env, "klinevault.cache_dir", "KLINEVAULT_CACHE_DIR", DEFAULT_CACHE_DIR));

        String interval = setting(props, env, "klinevault.interval", "KLINEVAULT_INTERVAL", DEFAULT_INTERVAL);
        int limit = Integer.parseInt(setting(props, env, "klinevault.limit", "KLINEVAULT_LIMIT",
            String.valueOf(DEFAULT_LIMIT)));
        long timeoutSeconds = Long.parseLong(setting(props, env, "klinevault.timeout_seconds",
            "KLINEVAULT_TIMEOUT_SECONDS", String.valueOf(DEFAULT_TIMEOUT_SECONDS)));
        int maxAttempts = Integer.parseInt(setting(props, env, "klinevault.max_attempts",
            "KLINEVAULT_MAX_ATTEMPTS", String.valueOf(DEFAULT_MAX_ATTEMPTS)));
        long delayMs = Long.parseLong(setting(props, env, "klinevault.page_delay_ms",
            "KLINEVAULT_PAGE_DELAY_MS", String.valueOf(DEFAULT_PAGE_DELAY_MS)));

        // FetchOptions rejects a limit outside [1, 1000] here, before anything runs
        FetchOptions options = new FetchOptions(interval, limit, Duration.ofSeconds(timeoutSeconds),
            maxAttempts, Duration.ofMillis(delayMs));
        return new FetcherConfig(baseUrl, path, cacheDir, options);
    }

    private static String setting(Properties props, Map<String, String> env,
                                  String property, String envVar, String defaultValue) {
        return props.getProperty(property, env.getOrDefault(envVar, defaultValue));
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getKlinesPath() {
        return klinesPath;
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    public FetchOptions getFetchOptions() {
        return fetchOptions;
    }
}
