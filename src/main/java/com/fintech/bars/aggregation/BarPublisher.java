package com.fintech.bars.aggregation;

import com.fintech.bars.cache.CacheKeys;
import com.fintech.bars.cache.QuoteCache;
import com.fintech.bars.domain.CurrentBar;
import com.fintech.bars.domain.Interval;
import com.fintech.bars.domain.LatestQuote;
import com.fintech.bars.domain.SymbolKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Publishes latest quotes and in-progress bars to the cache.
 * Cache failures are logged and swallowed here so that they never reach the
 * feed's reader thread.
 */
public class BarPublisher {

    private static final Logger log = LoggerFactory.getLogger(BarPublisher.class);

    private final QuoteCache cache;
    private final Duration quoteTtl;
    private final Duration barTtl;

    public BarPublisher(QuoteCache cache, Duration quoteTtl, Duration barTtl) {
        this.cache = cache;
        this.quoteTtl = quoteTtl;
        this.barTtl = barTtl;
    }

    public void publishLatestQuote(LatestQuote quote) {
        String key = CacheKeys.latestQuote(SymbolKey.of(quote.exchange(), quote.symbol()));
        try {
            cache.set(key, quote, quoteTtl);
        } catch (RuntimeException e) {
            log.warn("Failed to cache latest quote {}: {}", key, e.getMessage());
        }
    }

    public void publishCurrentBar(CurrentBar bar) {
        String key = CacheKeys.currentBar(SymbolKey.of(bar.exchange(), bar.symbol()), Interval.fromCode(bar.interval()));
        try {
            cache.set(key, bar, barTtl);
        } catch (RuntimeException e) {
            log.warn("Failed to cache current bar {}: {}", key, e.getMessage());
        }
    }

    public Optional<LatestQuote> getLatestQuote(SymbolKey key) {
        return read(CacheKeys.latestQuote(key), LatestQuote.class);
    }

    public Optional<CurrentBar> getCurrentBar(SymbolKey key, Interval interval) {
        return read(CacheKeys.currentBar(key, interval), CurrentBar.class);
    }

    public void evictLatestQuote(SymbolKey key) {
        try {
            cache.delete(CacheKeys.latestQuote(key));
        } catch (RuntimeException e) {
            log.warn("Failed to evict latest quote for {}: {}", key, e.getMessage());
        }
    }

    /**
     * Removes the in-progress bars of an instrument for every interval.
     *
     * @return number of entries removed
     */
    public long evictCurrentBars(SymbolKey key) {
        try {
            return cache.deletePattern(CacheKeys.currentBarPrefix(key));
        } catch (RuntimeException e) {
            log.warn("Failed to evict current bars for {}: {}", key, e.getMessage());
            return 0;
        }
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        try {
            return cache.get(key, type);
        } catch (RuntimeException e) {
            log.warn("Cache read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
