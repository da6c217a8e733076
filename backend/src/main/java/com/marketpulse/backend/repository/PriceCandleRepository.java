package com.marketpulse.backend.repository;

import com.marketpulse.backend.model.PriceCandle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface PriceCandleRepository extends JpaRepository<PriceCandle, Long> {

    Optional<PriceCandle> findBySymbolAndTimeframeAndTs(String symbol, String timeframe, Instant ts);

    List<PriceCandle> findBySymbolAndTimeframeAndTsBetweenOrderByTsAsc(String symbol, String timeframe,
                                                                      Instant from, Instant to);

    Optional<PriceCandle> findTopBySymbolAndTimeframeOrderByTsDesc(String symbol, String timeframe);

    long countBySymbolAndTimeframe(String symbol, String timeframe);
}
