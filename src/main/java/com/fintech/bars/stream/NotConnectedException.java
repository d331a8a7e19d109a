package com.fintech.bars.stream;

/**
 * Raised when an operation needs a live feed connection and there is none.
 */
public class NotConnectedException extends IllegalStateException {

    public NotConnectedException(String message) {
        super(message);
    }
}
