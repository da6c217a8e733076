package com.marketpulse.backend.service;

import com.marketpulse.backend.model.Item;
import com.marketpulse.backend.model.PriceCandle;
import com.marketpulse.backend.model.Signal;
import com.marketpulse.backend.repository.ItemRepository;
import com.marketpulse.backend.repository.PriceCandleRepository;
import com.marketpulse.backend.repository.SignalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Persistence entry point shared by every loop. Writes go through one fair lock so at most one
 * loop appends at a time; reads go straight to the repositories.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PulseStore {

    private final ItemRepository itemRepository;
    private final SignalRepository signalRepository;
    private final PriceCandleRepository priceCandleRepository;

    private final ReentrantLock writeLock = new ReentrantLock(true);

    /**
     * Inserts a new item. The primary key is the dedup hash; a key violation is the normal
     * duplicate outcome and is not logged as an error.
     */
    public AppendOutcome appendItem(Item item) {
        return write(() -> {
            try {
                itemRepository.saveAndFlush(item);
                return AppendOutcome.PERSISTED;
            } catch (DataIntegrityViolationException ex) {
                log.debug("Duplicate item id={}", item.getId());
                return AppendOutcome.DUPLICATE;
            }
        });
    }

    public AppendOutcome appendSignal(Signal signal) {
        return write(() -> {
            if (signalRepository.existsByAssetAndTs(signal.getAsset(), signal.getTs())) {
                return AppendOutcome.DUPLICATE;
            }
            try {
                signalRepository.saveAndFlush(signal);
                return AppendOutcome.PERSISTED;
            } catch (DataIntegrityViolationException ex) {
                log.warn("Signal already recorded asset={} ts={}", signal.getAsset(), signal.getTs());
                return AppendOutcome.DUPLICATE;
            }
        });
    }

    /**
     * Inserts a candle or refreshes the one with the same (symbol, timeframe, ts). The latest
     * candle is still forming when the feed returns it, so its values move until it closes.
     */
    public AppendOutcome upsertCandle(PriceCandle candle) {
        return write(() -> {
            Optional<PriceCandle> existing = priceCandleRepository.findBySymbolAndTimeframeAndTs(
                    candle.getSymbol(), candle.getTimeframe(), candle.getTs());
            if (existing.isPresent()) {
                PriceCandle stored = existing.get();
                stored.setOpen(candle.getOpen());
                stored.setHigh(candle.getHigh());
                stored.setLow(candle.getLow());
                stored.setClose(candle.getClose());
                stored.setVolume(candle.getVolume());
                priceCandleRepository.save(stored);
                return AppendOutcome.DUPLICATE;
            }
            priceCandleRepository.save(candle);
            return AppendOutcome.PERSISTED;
        });
    }

    public boolean writeImpact15m(String itemId, double impact, String meta) {
        return write(() -> itemRepository.writeImpact15m(itemId, impact, meta) == 1);
    }

    public boolean writeImpact60m(String itemId, double impact, String meta) {
        return write(() -> itemRepository.writeImpact60m(itemId, impact, meta) == 1);
    }

    public List<Item> itemWindow(String asset, Instant from, Instant to, boolean includeLowRelevance) {
        return itemRepository.findWindow(asset, from, to, includeLowRelevance);
    }

    public List<Instant> itemTimestamps(String asset, Instant from, Instant to, boolean includeLowRelevance) {
        return itemRepository.findTimestamps(asset, from, to, includeLowRelevance);
    }

    public long countItems(String asset, Instant from, Instant to, boolean includeLowRelevance) {
        return itemRepository.countWindow(asset, from, to, includeLowRelevance);
    }

    public List<Item> pendingImpact(String asset, Instant notBefore, Instant readyBefore, int limit) {
        return itemRepository.findPendingImpact(asset, notBefore, readyBefore, PageRequest.of(0, limit));
    }

    public List<Item> recentRelevantItems(String asset, Instant since, int limit) {
        return itemRepository.findTop50ByAssetAndLowRelevanceFalseAndTsAfterOrderByTsDesc(asset, since).stream()
                .limit(limit)
                .toList();
    }

    /**
     * Read-only existence check, taken without the write lock. Inserts still rely on the
     * primary key.
     */
    public boolean itemExists(String id) {
        return itemRepository.existsById(id);
    }

    public Optional<Item> findItem(String id) {
        return itemRepository.findById(id);
    }

    public List<PriceCandle> candles(String symbol, String timeframe, Instant from, Instant to) {
        return priceCandleRepository.findBySymbolAndTimeframeAndTsBetweenOrderByTsAsc(symbol, timeframe, from, to);
    }

    public Optional<PriceCandle> latestCandle(String symbol, String timeframe) {
        return priceCandleRepository.findTopBySymbolAndTimeframeOrderByTsDesc(symbol, timeframe);
    }

    public Optional<Signal> latestSignal(String asset) {
        return signalRepository.findTopByAssetOrderByTsDesc(asset);
    }

    private <T> T write(Supplier<T> action) {
        writeLock.lock();
        try {
            return action.get();
        } finally {
            writeLock.unlock();
        }
    }

    public enum AppendOutcome {
        PERSISTED,
        DUPLICATE
    }
}
