package com.fintech.bars.api;

import com.fintech.bars.domain.CompletedBar;
import com.fintech.bars.domain.Interval;
import com.fintech.bars.domain.SymbolKey;
import com.fintech.bars.service.BarPersistenceService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for completed bar history.
 */
@RestController
@RequestMapping("/api/v1/bars")
@Validated
@Tag(name = "Bar History", description = "Completed OHLCV bars from storage")
public class BarHistoryController {

    private static final Logger log = LoggerFactory.getLogger(BarHistoryController.class);

    private final BarPersistenceService persistenceService;
    private final MeterRegistry meterRegistry;

    public BarHistoryController(BarPersistenceService persistenceService, MeterRegistry meterRegistry) {
        this.persistenceService = persistenceService;
        this.meterRegistry = meterRegistry;
    }

    /**
     * GET /api/v1/bars/history
     *
     * @param from Start, Unix seconds (inclusive)
     * @param to End, Unix seconds (inclusive)
     */
    @Operation(
        summary = "Get completed bars",
        description = """
            Returns completed bars whose start lies in [from, to] (Unix seconds).

            **Example Request:**
            ```
            GET /api/v1/bars/history?exchange=BINANCE&symbol=BTCUSDT&interval=1m&from=1733529420&to=1733533020
            ```
            """
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Bars retrieved",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = HistoryResponse.class),
                examples = @ExampleObject(
                    name = "Sample Response",
                    value = """
                        {
                          "s": "ok",
                          "t": [1733529420, 1733529480],
                          "o": [50000.0, 50100.0],
                          "h": [50150.0, 50200.0],
                          "l": [49950.0, 50000.0],
                          "c": [50100.0, 50050.0],
                          "v": [12.5, 9.8]
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request parameters",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/history")
    public ResponseEntity<HistoryResponse> getHistory(
            @Parameter(description = "Exchange code", example = "BINANCE", required = true)
            @RequestParam @NotBlank(message = "Exchange is required") String exchange,

            @Parameter(description = "Ticker symbol", example = "BTCUSDT", required = true)
            @RequestParam @NotBlank(message = "Symbol is required") String symbol,

            @Parameter(description = "Interval code", example = "1m", required = true)
            @RequestParam @NotBlank(message = "Interval is required") String interval,

            @Parameter(description = "Start time (Unix seconds)", example = "1733529420", required = true)
            @RequestParam @NotNull @Positive(message = "From timestamp must be positive") Long from,

            @Parameter(description = "End time (Unix seconds)", example = "1733533020", required = true)
            @RequestParam @NotNull @Positive(message = "To timestamp must be positive") Long to) {

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            SymbolKey key = SymbolKey.of(exchange, symbol);
            Interval parsed = Interval.fromCode(interval);

            List<CompletedBar> bars = persistenceService.findBars(key, parsed, from * 1000, to * 1000);
            log.debug("History query: key={}, interval={}, from={}, to={}, results={}",
                key, parsed.code(), from, to, bars.size());

            return ResponseEntity.ok(HistoryResponse.fromBars(bars));
        } finally {
            sample.stop(meterRegistry.timer("api.bars.history.request.time"));
        }
    }
}
