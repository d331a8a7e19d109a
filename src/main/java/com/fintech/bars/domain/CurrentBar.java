package com.fintech.bars.domain;

/**
 * Snapshot of an in-progress bar as published to the cache.
 * Values may still change until {@code barEnd} has passed.
 */
public record CurrentBar(
    String symbol,
    String exchange,
    String interval,
    long barStart,
    long barEnd,
    double open,
    double high,
    double low,
    double close,
    double volume,
    long tickCount,
    long updatedAt
) {
}
