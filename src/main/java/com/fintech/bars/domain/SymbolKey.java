package com.fintech.bars.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * Instrument identity on the feed: {@code EXCHANGE:SYMBOL}, always upper-cased.
 *
 * @param exchange Exchange code (e.g. BINANCE, NASDAQ)
 * @param symbol Ticker within the exchange (e.g. BTCUSDT, AAPL)
 */
public record SymbolKey(String exchange, String symbol) {

    public SymbolKey {
        Objects.requireNonNull(exchange, "Exchange cannot be null");
        Objects.requireNonNull(symbol, "Symbol cannot be null");
        exchange = exchange.trim().toUpperCase(Locale.ROOT);
        symbol = symbol.trim().toUpperCase(Locale.ROOT);
        if (exchange.isEmpty() || symbol.isEmpty()) {
            throw new IllegalArgumentException("Exchange and symbol must not be blank");
        }
    }

    public static SymbolKey of(String exchange, String symbol) {
        return new SymbolKey(exchange, symbol);
    }

    /**
     * Parses the wire form {@code EXCHANGE:SYMBOL}.
     *
     * @throws IllegalArgumentException if the separator is missing
     */
    public static SymbolKey parse(String key) {
        Objects.requireNonNull(key, "Key cannot be null");
        int separator = key.indexOf(':');
        if (separator <= 0 || separator == key.length() - 1) {
            throw new IllegalArgumentException("Symbol key must be EXCHANGE:SYMBOL, got '" + key + "'");
        }
        return new SymbolKey(key.substring(0, separator), key.substring(separator + 1));
    }

    @Override
    public String toString() {
        return exchange + ":" + symbol;
    }
}
