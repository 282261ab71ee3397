package com.klinevault.fetcher.http;

import com.klinevault.core.exception.TransportException;
import com.klinevault.core.model.PageRequest;
import com.sun.net.httpserver.HttpServer;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the OkHttp transport against a local JDK HTTP server.
 */
@Timeout(30)
class OkHttpKlineTransportTest {

    private HttpServer server;
    private final AtomicReference<String> lastQuery = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String body = "[]";
    private volatile long delayMs = 0;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/api/v3/klines", exchange -> {
            lastQuery.set(exchange.getRequestURI().getRawQuery());
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/";
    }

    @Test
    @DisplayName("Sends the page window as query parameters and returns the body")
    void sendsQueryAndReadsBody() throws Exception {
        body = "[[0,\"1\",\"2\",\"0.5\",\"1.5\"]]";
        KlineTransport transport = new OkHttpKlineTransport(baseUrl(), "/api/v3/klines");

        TransportResponse response = transport.get(
            new PageRequest("BTCUSDT", "30m", 1000, 3_600_000, 2), Duration.ofSeconds(5));

        assertEquals(200, response.statusCode());
        assertEquals(body, response.bodyText());
        assertEquals("symbol=BTCUSDT&interval=30m&startTime=1000&endTime=3599999&limit=2", lastQuery.get());
    }

    @Test
    @DisplayName("Non-200 statuses are returned, not thrown")
    void returnsErrorStatus() throws Exception {
        status = 429;
        body = "{\"code\":-1003}";
        KlineTransport transport = new OkHttpKlineTransport(baseUrl(), "/api/v3/klines");

        TransportResponse response = transport.get(
            new PageRequest("BTCUSDT", "30m", 0, 10, 1), Duration.ofSeconds(5));

        assertFalse(response.isOk());
        assertEquals(429, response.statusCode());
        assertEquals("{\"code\"", response.bodySnippet(7));
    }

    @Test
    @DisplayName("Per-request timeout surfaces as TransportException")
    void timesOut() {
        delayMs = 2_000;
        KlineTransport transport = new OkHttpKlineTransport(baseUrl(), "/api/v3/klines");

        assertThrows(TransportException.class, () -> transport.get(
            new PageRequest("BTCUSDT", "30m", 0, 10, 1), Duration.ofMillis(200)));
    }

    @Test
    @DisplayName("Request timeout longer than the client's own read timeout is honoured")
    void requestTimeoutOverridesClientTimeouts() throws Exception {
        delayMs = 500;
        body = "[]";
        OkHttpClient shortClient = new OkHttpClient.Builder()
            .readTimeout(Duration.ofMillis(100))
            .build();
        KlineTransport transport = new OkHttpKlineTransport(shortClient, baseUrl(), "/api/v3/klines");

        TransportResponse response = transport.get(
            new PageRequest("BTCUSDT", "30m", 0, 10, 1), Duration.ofSeconds(5));

        assertEquals(200, response.statusCode());
        assertEquals("[]", response.bodyText());
    }

    @Test
    @DisplayName("Connection refused surfaces as TransportException")
    void connectionRefused() throws IOException {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            freePort = socket.getLocalPort();
        }
        KlineTransport transport = new OkHttpKlineTransport("http://127.0.0.1:" + freePort, "/api/v3/klines");

        assertThrows(TransportException.class, () -> transport.get(
            new PageRequest("BTCUSDT", "30m", 0, 10, 1), Duration.ofSeconds(2)));
    }
}
