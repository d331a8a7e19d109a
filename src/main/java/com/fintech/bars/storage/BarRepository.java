package com.fintech.bars.storage;

import com.fintech.bars.domain.CompletedBar;
import com.fintech.bars.domain.Interval;
import com.fintech.bars.domain.SymbolKey;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for completed bars.
 * Bars are identified by (symbol, exchange, interval, barStart).
 */
public interface BarRepository {

    /**
     * Inserts the bar or overwrites the OHLCV fields of the existing row with the
     * same identity. The creation timestamp of an existing row is never changed.
     *
     * @param bar The completed bar
     * @return whether a new row was created
     */
    UpsertResult upsert(CompletedBar bar);

    /**
     * Retrieves bars whose start lies in {@code [fromTime, toTime]}, ordered by start ascending.
     *
     * @return matching bars, empty if none
     */
    List<CompletedBar> findByRange(SymbolKey key, Interval interval, long fromTime, long toTime);

    /**
     * Finds the bar with an exact start time.
     */
    Optional<CompletedBar> findByBarStart(SymbolKey key, Interval interval, long barStart);

    /**
     * Returns the total number of stored bars.
     */
    long count();

    /**
     * Checks if the repository is reachable.
     */
    boolean isHealthy();
}
