package com.fintech.bars.cache;

import com.fintech.bars.domain.Interval;
import com.fintech.bars.domain.SymbolKey;

/**
 * Cache key schema.
 * <pre>
 *   quote:latest:{EXCHANGE}:{SYMBOL}              latest quote JSON
 *   bar:current:{EXCHANGE}:{SYMBOL}:{interval}    in-progress bar JSON
 * </pre>
 */
public final class CacheKeys {

    public static final String KEY_PREFIX_LATEST_QUOTE = "quote:latest:";
    public static final String KEY_PREFIX_CURRENT_BAR = "bar:current:";

    private CacheKeys() {
    }

    public static String latestQuote(SymbolKey key) {
        return KEY_PREFIX_LATEST_QUOTE + key.exchange() + ":" + key.symbol();
    }

    public static String currentBar(SymbolKey key, Interval interval) {
        return currentBarPrefix(key) + interval.code();
    }

    /** Prefix matching the current bars of every interval for one instrument. */
    public static String currentBarPrefix(SymbolKey key) {
        return KEY_PREFIX_CURRENT_BAR + key.exchange() + ":" + key.symbol() + ":";
    }
}
