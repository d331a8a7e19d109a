package com.fintech.bars.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fintech.bars.domain.CompletedBar;

import java.util.ArrayList;
import java.util.List;

/**
 * Columnar bar history (TradingView UDF style): one array per OHLCV component,
 * times in Unix seconds.
 *
 * <pre>
 * { "s": "ok", "t": [1620000000, 1620000060], "o": [..], "h": [..], "l": [..], "c": [..], "v": [..] }
 * </pre>
 * Status is "no_data" when the range holds no bars.
 */
public record HistoryResponse(
    @JsonProperty("s") String status,
    @JsonProperty("t") List<Long> time,
    @JsonProperty("o") List<Double> open,
    @JsonProperty("h") List<Double> high,
    @JsonProperty("l") List<Double> low,
    @JsonProperty("c") List<Double> close,
    @JsonProperty("v") List<Double> volume
) {

    public static HistoryResponse fromBars(List<CompletedBar> bars) {
        if (bars.isEmpty()) {
            return noData();
        }
        int size = bars.size();

        List<Long> time = new ArrayList<>(size);
        List<Double> open = new ArrayList<>(size);
        List<Double> high = new ArrayList<>(size);
        List<Double> low = new ArrayList<>(size);
        List<Double> close = new ArrayList<>(size);
        List<Double> volume = new ArrayList<>(size);

        for (CompletedBar bar : bars) {
            time.add(bar.barStart() / 1000);
            open.add(bar.open());
            high.add(bar.high());
            low.add(bar.low());
            close.add(bar.close());
            volume.add(bar.volume());
        }

        return new HistoryResponse("ok", time, open, high, low, close, volume);
    }

    public static HistoryResponse noData() {
        return new HistoryResponse("no_data", List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
