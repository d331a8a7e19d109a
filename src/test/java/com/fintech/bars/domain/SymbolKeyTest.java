package com.fintech.bars.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SymbolKey Tests")
class SymbolKeyTest {

    @Test
    @DisplayName("Should upper-case and render as EXCHANGE:SYMBOL")
    void testNormalization() {
        SymbolKey key = SymbolKey.of(" nasdaq ", "aapl");

        assertThat(key.exchange()).isEqualTo("NASDAQ");
        assertThat(key.symbol()).isEqualTo("AAPL");
        assertThat(key).hasToString("NASDAQ:AAPL");
        assertThat(key).isEqualTo(SymbolKey.of("NASDAQ", "AAPL"));
    }

    @Test
    @DisplayName("Should parse wire form")
    void testParse() {
        assertThat(SymbolKey.parse("binance:btcusdt")).isEqualTo(SymbolKey.of("BINANCE", "BTCUSDT"));
    }

    @Test
    @DisplayName("Should reject malformed keys")
    void testParseInvalid() {
        assertThatThrownBy(() -> SymbolKey.parse("AAPL")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SymbolKey.parse(":AAPL")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SymbolKey.parse("NASDAQ:")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SymbolKey.of(" ", "AAPL")).isInstanceOf(IllegalArgumentException.class);
    }
}
