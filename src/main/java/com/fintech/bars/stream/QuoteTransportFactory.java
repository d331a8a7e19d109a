package com.fintech.bars.stream;

/**
 * Opens transports to the quote feed. The returned transport is already open.
 */
@FunctionalInterface
public interface QuoteTransportFactory {

    /**
     * @param listener Receives inbound text and lifecycle events of the new transport
     * @throws TransportException if the connection cannot be established
     * @throws InterruptedException if interrupted while waiting for the handshake
     */
    QuoteTransport open(TransportListener listener) throws InterruptedException;
}
