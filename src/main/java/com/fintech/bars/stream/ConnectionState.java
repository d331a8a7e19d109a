package com.fintech.bars.stream;

/** Connection lifecycle of {@link QuoteStreamClient}. */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
