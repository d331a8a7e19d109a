package com.fintech.bars.domain;

import java.util.Objects;

/**
 * A single price observation taken from a quote update.
 *
 * @param key Instrument the tick belongs to
 * @param timestamp Epoch milliseconds (receipt time of the update)
 * @param price Last traded price
 * @param volume Volume reported with the update, or null when the update carried none
 */
public record Tick(SymbolKey key, long timestamp, double price, Double volume) {

    public Tick {
        Objects.requireNonNull(key, "Symbol key cannot be null");
        if (Double.isNaN(price) || Double.isInfinite(price)) {
            throw new IllegalArgumentException("Tick price must be finite, got " + price);
        }
    }

    public static Tick of(String exchange, String symbol, long timestamp, double price, Double volume) {
        return new Tick(SymbolKey.of(exchange, symbol), timestamp, price, volume);
    }

    public String symbol() {
        return key.symbol();
    }

    public String exchange() {
        return key.exchange();
    }
}
