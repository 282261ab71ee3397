package com.klinevault.fetcher.engine;

import com.klinevault.core.model.PageRequest;
import com.klinevault.fetcher.http.KlineTransport;
import com.klinevault.fetcher.http.TransportResponse;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Transport over a fixed set of open times, answering like the upstream:
 * rows with startTime <= t <= endTime, at most limit of them.
 */
public class DataBackedTransport implements KlineTransport {

    private final long[] openTimes;
    private final List<PageRequest> requests = new ArrayList<>();

    public DataBackedTransport(long... openTimes) {
        this.openTimes = openTimes.clone();
        java.util.Arrays.sort(this.openTimes);
    }

    @Override
    public TransportResponse get(PageRequest request, Duration timeout) {
        requests.add(request);
        long startTime = Long.parseLong(request.toQueryParams().get("startTime"));
        long endTime = Long.parseLong(request.toQueryParams().get("endTime"));
        List<Long> page = new ArrayList<>();
        for (long t : openTimes) {
            if (t >= startTime && t <= endTime && page.size() < request.limit()) {
                page.add(t);
            }
        }
        return TransportResponse.ok(ScriptedTransport.klines(page.stream().mapToLong(Long::longValue).toArray()));
    }

    public List<PageRequest> requests() {
        return requests;
    }
}
