package com.klinevault.fetcher.config;

import com.klinevault.core.exception.InvalidLimitException;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class FetcherConfigTest {

    @Test
    void defaults() {
        FetcherConfig config = FetcherConfig.load(new Properties(), Map.of());

        assertEquals("https://api.binance.com", config.getBaseUrl());
        assertEquals("/api/v3/klines", config.getKlinesPath());
        assertEquals(Paths.get("./cache"), config.getCacheDir());
        assertEquals("30m", config.getFetchOptions().interval());
        assertEquals(1000, config.getFetchOptions().limit());
        assertEquals(Duration.ofSeconds(15), config.getFetchOptions().timeout());
        assertEquals(8, config.getFetchOptions().maxAttempts());
        assertEquals(Duration.ofMillis(200), config.getFetchOptions().interPageDelay());
    }

    @Test
    void systemPropertiesOverrideEnvironment() {
        Properties props = new Properties();
        props.setProperty("klinevault.max_attempts", "3");
        Map<String, String> env = Map.of(
            "KLINEVAULT_MAX_ATTEMPTS", "5",
            "KLINEVAULT_INTERVAL", "1h",
            "KLINEVAULT_BASE_URL", "https://testnet.binance.vision");

        FetcherConfig config = FetcherConfig.load(props, env);

        assertEquals(3, config.getFetchOptions().maxAttempts());
        assertEquals("1h", config.getFetchOptions().interval());
        assertEquals("https://testnet.binance.vision", config.getBaseUrl());
    }

    @Test
    void limitOutOfRangeIsAConfigurationError() {
        Properties props = new Properties();
        props.setProperty("klinevault.limit", "5000");

        assertThrows(InvalidLimitException.class, () -> FetcherConfig.load(props, Map.of()));
    }
}
