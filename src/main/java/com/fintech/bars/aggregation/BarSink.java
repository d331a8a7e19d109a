package com.fintech.bars.aggregation;

import com.fintech.bars.domain.CompletedBar;

/**
 * Destination for completed bars. Implementations must not throw back into the
 * aggregator; storage failures are handled (and counted) on their side.
 */
@FunctionalInterface
public interface BarSink {

    void save(CompletedBar bar);
}
