package com.fintech.bars.service;

import java.util.List;

/**
 * Snapshot of the quote stream and aggregator state.
 *
 * @param running Whether the reader loop is running
 * @param connected Whether the feed transport is open
 * @param sessionId Current quote session id, null while disconnected
 * @param subscriptionCount Number of retained subscriptions
 * @param subscriptions Subscribed keys ({@code EXCHANGE:SYMBOL})
 * @param activeSymbols Keys with at least one in-progress bar
 * @param intervals Configured interval codes
 */
public record StreamStatus(
    boolean running,
    boolean connected,
    String sessionId,
    int subscriptionCount,
    List<String> subscriptions,
    List<String> activeSymbols,
    List<String> intervals
) {
}
