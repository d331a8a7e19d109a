package com.fintech.bars.stream;

import com.fintech.bars.protocol.QuoteUpdate;

/**
 * Receives decoded quote updates for one subscribed instrument.
 * Invoked on the stream's reader thread; implementations should not block.
 */
@FunctionalInterface
public interface QuoteListener {

    void onQuote(QuoteUpdate update);
}
