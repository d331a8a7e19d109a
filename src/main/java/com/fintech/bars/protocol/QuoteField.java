package com.fintech.bars.protocol;

import java.util.Optional;

/**
 * Fixed decode table for the quote fields negotiated with {@code quote_set_fields}.
 * The declaration order is the order sent on the wire.
 */
public enum QuoteField {

    LAST_PRICE("lp"),
    VOLUME("volume"),
    BID("bid"),
    ASK("ask"),
    CHANGE("ch"),
    CHANGE_PERCENT("chp"),
    OPEN("open_price"),
    HIGH("high_price"),
    LOW("low_price"),
    PREV_CLOSE("prev_close_price");

    private final String code;

    QuoteField(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<QuoteField> fromCode(String code) {
        for (QuoteField field : values()) {
            if (field.code.equals(code)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
