package com.fintech.bars.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Most recent quote state for an instrument, as cached for readers.
 * Fields absent from the last update are null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LatestQuote(
    String symbol,
    String exchange,
    long timestamp,
    Double lastPrice,
    Double volume,
    Double bid,
    Double ask,
    Double change,
    Double changePercent,
    Double open,
    Double high,
    Double low,
    Double prevClose
) {
}
