package com.fintech.bars.domain;

import java.util.Objects;

/**
 * Immutable OHLCV bar whose window has closed (or was flushed on shutdown).
 * Compact constructor enforces the OHLC and volume invariants.
 *
 * @param key Instrument
 * @param interval Bar interval
 * @param barStart Window start (epoch ms, aligned)
 * @param barEnd Exclusive window end (epoch ms)
 * @param open First price in window
 * @param high Maximum price (>= open, close, low)
 * @param low Minimum price (<= open, close, high)
 * @param close Last price in window
 * @param volume Summed volume of the ticks that carried one
 * @param tickCount Number of ticks aggregated, at least 1
 */
public record CompletedBar(
    SymbolKey key,
    Interval interval,
    long barStart,
    long barEnd,
    double open,
    double high,
    double low,
    double close,
    double volume,
    long tickCount
) {

    public CompletedBar {
        Objects.requireNonNull(key, "Symbol key cannot be null");
        Objects.requireNonNull(interval, "Interval cannot be null");
        if (barEnd <= barStart) {
            throw new IllegalArgumentException(
                "Bar end (" + barEnd + ") must be after bar start (" + barStart + ")"
            );
        }
        if (high < low) {
            throw new IllegalArgumentException(
                "High price (" + high + ") cannot be less than low price (" + low + ")"
            );
        }
        if (high < open || high < close) {
            throw new IllegalArgumentException(
                "High price (" + high + ") must be >= open (" + open + ") and close (" + close + ")"
            );
        }
        if (low > open || low > close) {
            throw new IllegalArgumentException(
                "Low price (" + low + ") must be <= open (" + open + ") and close (" + close + ")"
            );
        }
        if (volume < 0) {
            throw new IllegalArgumentException("Volume cannot be negative: " + volume);
        }
        if (tickCount < 1) {
            throw new IllegalArgumentException("A completed bar needs at least one tick");
        }
    }

    public String symbol() {
        return key.symbol();
    }

    public String exchange() {
        return key.exchange();
    }

    /** Returns price range (high - low). */
    public double range() {
        return high - low;
    }

    /** Returns true if close > open. */
    public boolean isBullish() {
        return close > open;
    }
}
