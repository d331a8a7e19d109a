package com.fintech.bars.stream;

/**
 * Callbacks raised by a {@link QuoteTransport}, possibly from a library-owned thread.
 */
public interface TransportListener {

    void onText(String text);

    void onClose(int code, String reason);

    void onError(Exception error);
}
