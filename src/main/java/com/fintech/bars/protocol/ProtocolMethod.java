package com.fintech.bars.protocol;

import java.util.Optional;

/**
 * Method names carried in the {@code "m"} field of a protocol message.
 */
public enum ProtocolMethod {

    // Outbound
    QUOTE_CREATE_SESSION("quote_create_session"),
    QUOTE_SET_FIELDS("quote_set_fields"),
    QUOTE_ADD_SYMBOLS("quote_add_symbols"),
    QUOTE_REMOVE_SYMBOLS("quote_remove_symbols"),

    // Inbound
    QUOTE_DATA("qsd"),
    QUOTE_COMPLETED("quote_completed"),
    CRITICAL_ERROR("critical_error"),
    PROTOCOL_ERROR("protocol_error");

    private final String wireName;

    ProtocolMethod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Looks up a method by its wire name; unknown methods yield empty. */
    public static Optional<ProtocolMethod> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (ProtocolMethod method : values()) {
            if (method.wireName.equals(name)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
