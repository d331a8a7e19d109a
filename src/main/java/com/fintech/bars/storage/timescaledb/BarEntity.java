package com.fintech.bars.storage.timescaledb;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA entity for persisted OHLCV bars.
 * One row per (symbol, exchange, interval, bar_start).
 */
@Entity
@Table(
    name = "ohlcv_bars",
    indexes = {
        @Index(name = "idx_bars_key_interval_start", columnList = "exchange, symbol, interval_code, bar_start DESC")
    },
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_bar", columnNames = {"exchange", "symbol", "interval_code", "bar_start"})
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BarEntity {

    /**
     * Composite primary key: exchange_symbol_interval_barStart
     * Example: "BINANCE_BTCUSDT_1m_1733000000000"
     */
    @Id
    @Column(length = 120)
    private String id;

    @Column(nullable = false, length = 40)
    private String symbol;

    @Column(nullable = false, length = 40)
    private String exchange;

    /**
     * Interval code (1m, 5m, 1h, 1d, 1M ...)
     */
    @Column(name = "interval_code", nullable = false, length = 4)
    private String intervalCode;

    /**
     * Window start, Unix epoch milliseconds
     */
    @Column(name = "bar_start", nullable = false)
    private Long barStart;

    /**
     * Exclusive window end, Unix epoch milliseconds
     */
    @Column(name = "bar_end", nullable = false)
    private Long barEnd;

    @Column(nullable = false)
    private Double open;

    @Column(nullable = false)
    private Double high;

    @Column(nullable = false)
    private Double low;

    @Column(nullable = false)
    private Double close;

    @Column(nullable = false)
    private Double volume;

    @Column(name = "tick_count", nullable = false)
    private Long tickCount;

    /**
     * Set once on insert, never rewritten by upserts
     */
    @Column(name = "created_at", nullable = false, updatable = false)
    private Long createdAt;

    @Column(name = "updated_at", nullable = false)
    private Long updatedAt;

    public static String generateId(String exchange, String symbol, String intervalCode, long barStart) {
        return String.format("%s_%s_%s_%d", exchange, symbol, intervalCode, barStart);
    }

    @PrePersist
    protected void onCreate() {
        long now = System.currentTimeMillis();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = System.currentTimeMillis();
    }
}
