package com.fintech.bars.stream;

/**
 * Failure to open or use the feed transport. Recovered by the reconnect loop.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
