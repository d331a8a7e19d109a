package com.fintech.bars.api;

import com.fintech.bars.domain.CurrentBar;
import com.fintech.bars.domain.Interval;
import com.fintech.bars.domain.LatestQuote;
import com.fintech.bars.domain.SymbolKey;
import com.fintech.bars.service.QuoteStreamService;
import com.fintech.bars.service.StreamStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API over the quote stream: lifecycle, subscriptions and cached lookups.
 */
@RestController
@RequestMapping("/api/v1/quotes")
@Validated
@Tag(name = "Quotes", description = "Quote feed control and real-time lookups")
public class QuoteController {

    private static final Logger log = LoggerFactory.getLogger(QuoteController.class);

    private final QuoteStreamService quoteStreamService;

    public QuoteController(QuoteStreamService quoteStreamService) {
        this.quoteStreamService = quoteStreamService;
    }

    @Operation(summary = "Start the quote stream")
    @PostMapping("/start")
    public ResponseEntity<StreamStatus> start() {
        quoteStreamService.start();
        return ResponseEntity.ok(quoteStreamService.status());
    }

    @Operation(summary = "Stop the quote stream and flush in-progress bars")
    @PostMapping("/stop")
    public ResponseEntity<FlushResponse> stop() {
        int flushed = quoteStreamService.stop();
        log.info("Quote stream stopped via API, {} bars flushed", flushed);
        return ResponseEntity.ok(new FlushResponse(flushed));
    }

    @Operation(summary = "Subscribe to an instrument")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Subscribed"),
        @ApiResponse(
            responseCode = "503",
            description = "Quote feed not connected",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @PostMapping("/subscribe")
    public ResponseEntity<SubscriptionResponse> subscribe(@Valid @RequestBody SubscriptionRequest request) {
        SymbolKey key = quoteStreamService.subscribe(request.symbol(), request.exchange());
        return ResponseEntity.ok(new SubscriptionResponse(key.toString(), "Subscribed to " + key));
    }

    @Operation(summary = "Unsubscribe from an instrument")
    @PostMapping("/unsubscribe")
    public ResponseEntity<SubscriptionResponse> unsubscribe(@Valid @RequestBody SubscriptionRequest request) {
        boolean removed = quoteStreamService.unsubscribe(request.symbol(), request.exchange());
        String key = SymbolKey.of(request.exchange(), request.symbol()).toString();
        String message = removed ? "Unsubscribed from " + key : "No subscription for " + key;
        return ResponseEntity.ok(new SubscriptionResponse(key, message));
    }

    @Operation(summary = "Latest cached quotes of all subscribed instruments")
    @GetMapping
    public ResponseEntity<List<LatestQuote>> getAllQuotes() {
        return ResponseEntity.ok(quoteStreamService.getAllQuotes());
    }

    @Operation(summary = "Stream status")
    @GetMapping("/status")
    public ResponseEntity<StreamStatus> status() {
        return ResponseEntity.ok(quoteStreamService.status());
    }

    @Operation(summary = "Latest cached quote of one instrument")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Quote found"),
        @ApiResponse(responseCode = "404", description = "No cached quote")
    })
    @GetMapping("/{exchange}/{symbol}")
    public ResponseEntity<LatestQuote> getLatestQuote(
            @Parameter(description = "Exchange code", example = "BINANCE") @PathVariable String exchange,
            @Parameter(description = "Ticker symbol", example = "BTCUSDT") @PathVariable String symbol) {
        return quoteStreamService.getLatestQuote(symbol, exchange)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(summary = "In-progress bar of one instrument and interval")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Bar found"),
        @ApiResponse(responseCode = "404", description = "No in-progress bar cached"),
        @ApiResponse(
            responseCode = "400",
            description = "Unsupported interval",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/{exchange}/{symbol}/bar")
    public ResponseEntity<CurrentBar> getCurrentBar(
            @PathVariable String exchange,
            @PathVariable String symbol,
            @Parameter(description = "Interval code: 1m, 3m, 5m, 15m, 30m, 45m, 1h, 2h, 3h, 4h, 1d, 1w, 1M", example = "1m")
            @RequestParam(defaultValue = "1m") String interval) {
        Interval parsed = Interval.fromCode(interval);
        return quoteStreamService.getCurrentBar(symbol, exchange, parsed)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(summary = "Write all in-progress bars to storage",
        description = "While the stream runs, bars are checkpointed and keep accumulating; the row is rewritten when the window closes")
    @PostMapping("/flush")
    public ResponseEntity<FlushResponse> flush() {
        return ResponseEntity.ok(new FlushResponse(quoteStreamService.flushAll()));
    }

    @Schema(description = "Result of a subscription change")
    public record SubscriptionResponse(
        @Schema(description = "Normalized EXCHANGE:SYMBOL key", example = "BINANCE:BTCUSDT")
        String subscriptionKey,
        @Schema(description = "Outcome message")
        String message
    ) {
    }

    @Schema(description = "Number of in-progress bars written to storage")
    public record FlushResponse(
        @Schema(example = "8")
        int flushed
    ) {
    }
}
