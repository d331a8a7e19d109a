package com.fintech.bars.protocol;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProtocolSession Tests")
class ProtocolSessionTest {

    @Test
    @DisplayName("Session id should be qs_ followed by 12 lowercase alphanumerics")
    void testIdFormat() {
        for (int i = 0; i < 100; i++) {
            assertThat(ProtocolSession.create().id()).matches("qs_[a-z0-9]{12}");
        }
    }

    @Test
    @DisplayName("Fresh sessions should not reuse ids")
    void testIdsAreFresh() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(ProtocolSession.create().id());
        }
        assertThat(ids).hasSize(1000);
    }

    @Test
    @DisplayName("Should request the quote fields in wire order")
    void testFieldCodes() {
        assertThat(ProtocolSession.create().fieldCodes()).containsExactly(
            "lp", "volume", "bid", "ask", "ch", "chp",
            "open_price", "high_price", "low_price", "prev_close_price"
        );
    }

    @Test
    @DisplayName("owns() should match only its own id")
    void testOwns() {
        ProtocolSession session = ProtocolSession.create();

        assertThat(session.owns(session.id())).isTrue();
        assertThat(session.owns("qs_000000000000")).isFalse();
        assertThat(session.owns(null)).isFalse();
    }
}
