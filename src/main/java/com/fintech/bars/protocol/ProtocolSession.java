package com.fintech.bars.protocol;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Logical quote session on a connection. A fresh session (with a fresh id) is
 * created on every successful connect; ids of earlier sessions are never reused.
 */
public final class ProtocolSession {

    public static final String ID_PREFIX = "qs_";
    public static final int ID_RANDOM_LENGTH = 12;

    private static final char[] ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
    private static final List<String> FIELD_CODES = Arrays.stream(QuoteField.values())
        .map(QuoteField::code)
        .collect(Collectors.toUnmodifiableList());

    private final String id;

    private ProtocolSession(String id) {
        this.id = id;
    }

    public static ProtocolSession create() {
        return create(new SecureRandom());
    }

    public static ProtocolSession create(Random random) {
        StringBuilder sb = new StringBuilder(ID_PREFIX.length() + ID_RANDOM_LENGTH).append(ID_PREFIX);
        for (int i = 0; i < ID_RANDOM_LENGTH; i++) {
            sb.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return new ProtocolSession(sb.toString());
    }

    public String id() {
        return id;
    }

    /** Field codes requested with {@code quote_set_fields}, in wire order. */
    public List<String> fieldCodes() {
        return FIELD_CODES;
    }

    /** True if a message stamped with {@code sessionId} belongs to this session. */
    public boolean owns(String sessionId) {
        return id.equals(sessionId);
    }

    @Override
    public String toString() {
        return id;
    }
}
