package com.marketpulse.backend.service.price;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.exception.TransientIngestException;
import com.marketpulse.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads candles from a Binance-compatible {@code /api/v3/klines} endpoint. Each kline is an
 * array {@code [openTime, open, high, low, close, volume, ...]} with prices as strings.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BinanceKlinesClient implements PriceFeedClient {

    private final PulseProperties properties;
    @Qualifier("sourceRestTemplate")
    private final RestTemplate sourceRestTemplate;

    @Override
    public List<Candle> fetchCandles(String symbol, String timeframe, int limit) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getPrices().getBaseUrl())
                .path("/api/v3/klines")
                .queryParam("symbol", symbol)
                .queryParam("interval", timeframe)
                .queryParam("limit", Math.max(1, Math.min(1000, limit)))
                .build()
                .toUri();
        JsonNode body;
        try {
            body = sourceRestTemplate.getForObject(uri, JsonNode.class);
        } catch (HttpStatusCodeException ex) {
            int status = ex.getStatusCode().value();
            if (status == 429 || status == 418 || status >= 500) {
                throw new TransientIngestException("Klines HTTP " + status, status, ex);
            }
            throw new IllegalStateException("Klines request rejected (HTTP " + status + ")", ex);
        } catch (ResourceAccessException ex) {
            throw new TransientIngestException("Klines endpoint unreachable: " + ex.getMessage(), ex);
        }
        if (body == null || !body.isArray()) {
            throw new TransientIngestException("Unexpected klines response");
        }
        List<Candle> candles = new ArrayList<>(body.size());
        for (JsonNode row : body) {
            if (!row.isArray() || row.size() < 6) {
                log.debug("Skipping malformed kline {}", row);
                continue;
            }
            candles.add(Candle.builder()
                    .timestamp(Instant.ofEpochMilli(row.get(0).asLong()))
                    .open(row.get(1).asDouble())
                    .high(row.get(2).asDouble())
                    .low(row.get(3).asDouble())
                    .close(row.get(4).asDouble())
                    .volume(row.get(5).asDouble())
                    .build());
        }
        return candles;
    }
}
