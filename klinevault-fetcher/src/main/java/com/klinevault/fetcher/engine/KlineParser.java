package com.klinevault.fetcher.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.klinevault.core.exception.MalformedResponseException;
import com.klinevault.core.model.Candle;
import com.klinevault.core.model.PageRequest;
import com.klinevault.core.model.TimeWindow;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses a klines response body into candles and checks it against the page request.
 */
public class KlineParser {

    private final ObjectMapper mapper;

    public KlineParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws MalformedResponseException if the body is not an array of kline rows,
     *         a row is short or non-numeric, timestamps are not strictly increasing,
     *         or a row falls outside the requested window
     */
    public List<Candle> parse(byte[] body, PageRequest request) throws MalformedResponseException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Response is not JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedResponseException("Unreadable response body", e);
        }
        if (root == null || !root.isArray()) {
            throw new MalformedResponseException("Expected a JSON array of klines");
        }

        TimeWindow window = request.window();
        List<Candle> candles = new ArrayList<>(root.size());
        long previous = Long.MIN_VALUE;
        for (int i = 0; i < root.size(); i++) {
            // Kline format: [openTime, open, high, low, close, volume, closeTime, ...]
            JsonNode kline = root.get(i);
            if (!kline.isArray() || kline.size() < 5) {
                throw new MalformedResponseException("Row " + i + " is not a kline: " + kline);
            }
            JsonNode time = kline.get(0);
            if (!time.isNumber() || !time.canConvertToExactIntegral()) {
                throw new MalformedResponseException("Row " + i + " has a non-integral open time: " + time);
            }
            long openTime = time.asLong();

            Candle candle;
            try {
                candle = new Candle(openTime,
                    decimalText(kline.get(1)), decimalText(kline.get(2)),
                    decimalText(kline.get(3)), decimalText(kline.get(4)));
            } catch (IllegalArgumentException e) {
                throw new MalformedResponseException("Row " + i + ": " + e.getMessage(), e);
            }

            if (openTime <= previous) {
                throw new MalformedResponseException("Row " + i + " open time " + openTime
                    + " does not follow " + previous);
            }
            if (!window.contains(openTime)) {
                throw new MalformedResponseException("Row " + i + " open time " + openTime
                    + " outside [" + request.startMs() + ", " + request.endMs() + ")");
            }
            previous = openTime;
            candles.add(candle);
        }
        return candles;
    }

    private static String decimalText(JsonNode node) {
        if (node.isNumber()) {
            return node.decimalValue().toPlainString();
        }
        if (node.isTextual()) {
            return node.asText();
        }
        throw new IllegalArgumentException("expected a number or numeric string, got " + node);
    }
}
