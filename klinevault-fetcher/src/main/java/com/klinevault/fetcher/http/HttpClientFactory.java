package com.klinevault.fetcher.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Factory for the shared HTTP client and JSON mapper.
 *
 * The client does not retry on connection failure by itself: retries are counted
 * against the engine's per-page budget so that backoff stays observable.
 */
public final class HttpClientFactory {

    private static final OkHttpClient SHARED_CLIENT;
    private static final ObjectMapper SHARED_MAPPER;

    static {
        SHARED_CLIENT = new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(5, 5, TimeUnit.MINUTES))
            .connectTimeout(15, TimeUnit.SECONDS)
            .readTimeout(15, TimeUnit.SECONDS)
            .writeTimeout(15, TimeUnit.SECONDS)
            .retryOnConnectionFailure(false)
            .build();

        SHARED_MAPPER = new ObjectMapper();
    }

    private HttpClientFactory() {
        // Prevent instantiation
    }

    /**
     * Get the shared OkHttpClient instance. Its timeouts are defaults only: transports
     * derive a per-request client with {@link OkHttpClient#newBuilder()}, which keeps the pool.
     */
    public static OkHttpClient getClient() {
        return SHARED_CLIENT;
    }

    public static ObjectMapper getMapper() {
        return SHARED_MAPPER;
    }
}
