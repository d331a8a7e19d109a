package com.fintech.bars.stream;

/**
 * Open text connection to the quote feed.
 */
public interface QuoteTransport {

    /**
     * Sends one text message.
     *
     * @throws RuntimeException if the connection is no longer usable
     */
    void send(String text);

    boolean isOpen();

    void close();
}
