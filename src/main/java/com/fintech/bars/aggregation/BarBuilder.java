package com.fintech.bars.aggregation;

import com.fintech.bars.domain.CompletedBar;
import com.fintech.bars.domain.CurrentBar;
import com.fintech.bars.domain.Interval;
import com.fintech.bars.domain.SymbolKey;

/**
 * Accumulates ticks into one OHLCV bar for a symbol and interval.
 * The window is {@code [barStart, barEnd)}. Not thread-safe; callers hold the
 * owning partition's lock.
 */
public class BarBuilder {

    private final SymbolKey key;
    private final Interval interval;
    private final long barStart;
    private final long barEnd;

    private double open;
    private double high;
    private double low;
    private double close;
    private double volume;
    private long tickCount;

    public BarBuilder(SymbolKey key, Interval interval, long barStart) {
        this.key = key;
        this.interval = interval;
        this.barStart = barStart;
        this.barEnd = interval.windowEnd(barStart);
    }

    /** Creates a builder for the window containing {@code timestamp}. */
    public static BarBuilder forTimestamp(SymbolKey key, Interval interval, long timestamp) {
        return new BarBuilder(key, interval, interval.alignTimestamp(timestamp));
    }

    /**
     * Adds a tick to the bar.
     *
     * @param volume Volume carried by the tick; null leaves the bar volume unchanged
     * @return false if the timestamp falls outside {@code [barStart, barEnd)}
     */
    public boolean addTick(double price, Double volume, long timestamp) {
        if (timestamp < barStart || timestamp >= barEnd) {
            return false;
        }

        if (tickCount == 0) {
            open = price;
            high = price;
            low = price;
        } else {
            high = Math.max(high, price);
            low = Math.min(low, price);
        }
        close = price;
        if (volume != null && volume > 0) {
            this.volume += volume;
        }
        tickCount++;
        return true;
    }

    /** True once {@code now} has reached the exclusive window end. */
    public boolean isComplete(long now) {
        return now >= barEnd;
    }

    public boolean isEmpty() {
        return tickCount == 0;
    }

    /**
     * @throws IllegalStateException if no tick was added
     */
    public CompletedBar toCompletedBar() {
        if (isEmpty()) {
            throw new IllegalStateException("Cannot complete an empty bar: " + key + " " + interval.code());
        }
        return new CompletedBar(key, interval, barStart, barEnd, open, high, low, close, volume, tickCount);
    }

    public CurrentBar toCurrentBar(long updatedAt) {
        return new CurrentBar(
            key.symbol(), key.exchange(), interval.code(),
            barStart, barEnd, open, high, low, close, volume, tickCount, updatedAt
        );
    }

    public SymbolKey getKey() {
        return key;
    }

    public Interval getInterval() {
        return interval;
    }

    public long getBarStart() {
        return barStart;
    }

    public long getBarEnd() {
        return barEnd;
    }

    public double getOpen() {
        return open;
    }

    public double getHigh() {
        return high;
    }

    public double getLow() {
        return low;
    }

    public double getClose() {
        return close;
    }

    public double getVolume() {
        return volume;
    }

    public long getTickCount() {
        return tickCount;
    }
}
