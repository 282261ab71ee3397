package com.klinevault.fetcher.http;

import com.klinevault.core.exception.TransportException;
import com.klinevault.core.model.PageRequest;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * {@link KlineTransport} backed by the shared OkHttp client.
 */
public class OkHttpKlineTransport implements KlineTransport {

    private static final Logger log = LoggerFactory.getLogger(OkHttpKlineTransport.class);

    private final OkHttpClient client;
    private final HttpUrl endpoint;

    public OkHttpKlineTransport(String baseUrl, String path) {
        this(HttpClientFactory.getClient(), baseUrl, path);
    }

    public OkHttpKlineTransport(OkHttpClient client, String baseUrl, String path) {
        HttpUrl parsed = HttpUrl.parse(stripTrailingSlash(baseUrl) + path);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid endpoint URL: " + baseUrl + path);
        }
        this.client = client;
        this.endpoint = parsed;
    }

    @Override
    public TransportResponse get(PageRequest pageRequest, Duration timeout) throws TransportException {
        HttpUrl.Builder url = endpoint.newBuilder();
        for (Map.Entry<String, String> param : pageRequest.toQueryParams().entrySet()) {
            url.addQueryParameter(param.getKey(), param.getValue());
        }

        Request request = new Request.Builder()
            .url(url.build())
            .header("Accept", "application/json")
            .get()
            .build();

        // The request timeout replaces the shared client's own limits
        OkHttpClient call = client.newBuilder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .writeTimeout(timeout)
            .callTimeout(timeout)
            .build();

        log.debug("GET {}", request.url());
        try (Response response = call.newCall(request).execute()) {
            ResponseBody body = response.body();
            byte[] bytes = body != null ? body.bytes() : new byte[0];
            return new TransportResponse(response.code(), bytes);
        } catch (IOException e) {
            throw new TransportException("GET " + endpoint + " failed: " + e.getMessage(), e);
        }
    }

    private static String stripTrailingSlash(String baseUrl) {
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
}
