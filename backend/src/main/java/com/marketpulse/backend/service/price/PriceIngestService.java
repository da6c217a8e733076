package com.marketpulse.backend.service.price;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.event.EventBusService;
import com.marketpulse.backend.event.EventType;
import com.marketpulse.backend.exception.TransientIngestException;
import com.marketpulse.backend.model.Candle;
import com.marketpulse.backend.model.PriceCandle;
import com.marketpulse.backend.service.HealthStatusService;
import com.marketpulse.backend.service.PulseStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pulls the latest candles and upserts them. Candles are the only price data the rest of the
 * service reads.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PriceIngestService {

    private final PulseProperties properties;
    private final PriceFeedClient priceFeedClient;
    private final PulseStore pulseStore;
    private final EventBusService eventBusService;
    private final HealthStatusService healthStatusService;

    /**
     * @return number of candles that were not stored before
     */
    public int poll() {
        PulseProperties.Prices config = properties.getPrices();
        List<Candle> candles;
        try {
            candles = priceFeedClient.fetchCandles(config.getSymbol(), config.getTimeframe(), config.getFetchLimit());
        } catch (TransientIngestException ex) {
            healthStatusService.markDegraded(HealthStatusService.PRICE_FEED, ex.getMessage());
            throw ex;
        }
        int inserted = 0;
        for (Candle candle : candles) {
            PriceCandle row = PriceCandle.builder()
                    .symbol(config.getSymbol())
                    .timeframe(config.getTimeframe())
                    .ts(candle.getTimestamp())
                    .open(candle.getOpen())
                    .high(candle.getHigh())
                    .low(candle.getLow())
                    .close(candle.getClose())
                    .volume(candle.getVolume())
                    .build();
            if (pulseStore.upsertCandle(row) == PulseStore.AppendOutcome.PERSISTED) {
                inserted++;
            }
        }
        healthStatusService.markOk(HealthStatusService.PRICE_FEED);
        log.info("Price poll symbol={} fetched={} new={}", config.getSymbol(), candles.size(), inserted);
        if (inserted > 0) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("symbol", config.getSymbol());
            payload.put("timeframe", config.getTimeframe());
            payload.put("count", inserted);
            payload.put("last_close", candles.get(candles.size() - 1).getClose());
            eventBusService.publish(EventType.PRICE,
                    inserted + " new candles for " + config.getSymbol(), payload);
        }
        return inserted;
    }
}
