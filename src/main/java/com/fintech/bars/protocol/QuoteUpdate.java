package com.fintech.bars.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.bars.domain.LatestQuote;
import com.fintech.bars.domain.SymbolKey;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Typed view of one {@code qsd} payload: {@code {"n": "EX:SYM", "v": {field: value}}}.
 * Only fields from {@link QuoteField} with numeric values are kept.
 *
 * @param key Instrument the update refers to
 * @param timestamp Receipt time in epoch ms (the feed carries no event time)
 * @param values Decoded field values
 */
public record QuoteUpdate(SymbolKey key, long timestamp, Map<QuoteField, Double> values) {

    public QuoteUpdate {
        values = Collections.unmodifiableMap(values.isEmpty()
            ? new EnumMap<>(QuoteField.class)
            : new EnumMap<>(values));
    }

    /**
     * Decodes the quote object (second {@code qsd} parameter).
     *
     * @return empty when the name or the value object is missing or unusable
     */
    public static Optional<QuoteUpdate> decode(JsonNode quoteData, long receivedAt) {
        if (quoteData == null || !quoteData.isObject()) {
            return Optional.empty();
        }
        String name = quoteData.path("n").asText("");
        JsonNode rawValues = quoteData.path("v");
        if (name.isEmpty() || !rawValues.isObject() || rawValues.isEmpty()) {
            return Optional.empty();
        }

        SymbolKey key;
        try {
            key = SymbolKey.parse(name);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }

        Map<QuoteField, Double> values = new EnumMap<>(QuoteField.class);
        Iterator<Map.Entry<String, JsonNode>> fields = rawValues.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            if (!value.isNumber()) {
                continue;
            }
            QuoteField.fromCode(entry.getKey())
                .ifPresent(field -> values.put(field, value.asDouble()));
        }
        return Optional.of(new QuoteUpdate(key, receivedAt, values));
    }

    public Optional<Double> get(QuoteField field) {
        return Optional.ofNullable(values.get(field));
    }

    public Optional<Double> lastPrice() {
        return get(QuoteField.LAST_PRICE);
    }

    public LatestQuote toLatestQuote() {
        return new LatestQuote(
            key.symbol(),
            key.exchange(),
            timestamp,
            values.get(QuoteField.LAST_PRICE),
            values.get(QuoteField.VOLUME),
            values.get(QuoteField.BID),
            values.get(QuoteField.ASK),
            values.get(QuoteField.CHANGE),
            values.get(QuoteField.CHANGE_PERCENT),
            values.get(QuoteField.OPEN),
            values.get(QuoteField.HIGH),
            values.get(QuoteField.LOW),
            values.get(QuoteField.PREV_CLOSE)
        );
    }
}
