package com.fintech.bars;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Realtime Bar Service
 *
 * Subscribes to a streaming quote feed and aggregates last-price ticks into
 * multi-interval OHLCV bars.
 *
 * Key Features:
 * - Length-prefixed WebSocket quote protocol with heartbeat echo
 * - Automatic reconnect with exponential backoff and resubscription
 * - Partitioned in-memory bar builders (1m .. 1M)
 * - Latest quote and in-progress bars in Redis
 * - Completed bars upserted to TimescaleDB
 *
 * @since 1.0.0
 */
@SpringBootApplication
public class BarAggregationApplication {

    public static void main(String[] args) {
        SpringApplication.run(BarAggregationApplication.class, args);
    }
}
