package com.marketpulse.backend.service.price;

import com.marketpulse.backend.model.Candle;

import java.util.List;

/**
 * Source of OHLCV candles, oldest first. The last candle may still be forming.
 */
public interface PriceFeedClient {

    List<Candle> fetchCandles(String symbol, String timeframe, int limit);
}
