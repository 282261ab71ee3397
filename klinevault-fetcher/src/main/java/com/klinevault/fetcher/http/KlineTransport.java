package com.klinevault.fetcher.http;

import com.klinevault.core.exception.TransportException;
import com.klinevault.core.model.PageRequest;

import java.time.Duration;

/**
 * HTTP GET capability for one kline page. Any status code is returned as a response;
 * only network-level failures are thrown.
 */
public interface KlineTransport {

    TransportResponse get(PageRequest request, Duration timeout) throws TransportException;
}
