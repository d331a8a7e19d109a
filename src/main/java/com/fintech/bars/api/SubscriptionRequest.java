package com.fintech.bars.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Body of subscribe/unsubscribe requests.
 */
@Schema(description = "Instrument to (un)subscribe")
public record SubscriptionRequest(

    @Schema(description = "Ticker symbol", example = "BTCUSDT")
    @NotBlank(message = "Symbol is required")
    @Pattern(regexp = "^[A-Za-z0-9._!\\-]{1,40}$", message = "Symbol contains unsupported characters")
    String symbol,

    @Schema(description = "Exchange code", example = "BINANCE")
    @NotBlank(message = "Exchange is required")
    @Pattern(regexp = "^[A-Za-z0-9_]{1,40}$", message = "Exchange contains unsupported characters")
    String exchange
) {
}
