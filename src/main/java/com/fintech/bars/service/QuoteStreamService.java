package com.fintech.bars.service;

import com.fintech.bars.aggregation.BarAggregator;
import com.fintech.bars.aggregation.BarPublisher;
import com.fintech.bars.config.BarProperties;
import com.fintech.bars.domain.CurrentBar;
import com.fintech.bars.domain.Interval;
import com.fintech.bars.domain.LatestQuote;
import com.fintech.bars.domain.SymbolKey;
import com.fintech.bars.domain.Tick;
import com.fintech.bars.protocol.QuoteField;
import com.fintech.bars.protocol.QuoteUpdate;
import com.fintech.bars.stream.NotConnectedException;
import com.fintech.bars.stream.QuoteStreamClient;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point for the quote pipeline: feed subscription, latest-quote caching and
 * tick routing into the bar aggregator.
 *
 * <p>Each subscribed instrument gets {@link #onQuoteUpdate} as its listener. Updates
 * without a last price are ignored; otherwise the quote is cached and a tick stamped
 * with the receipt time is added to the aggregator.
 */
@Service
public class QuoteStreamService {

    private static final Logger log = LoggerFactory.getLogger(QuoteStreamService.class);

    private final QuoteStreamClient client;
    private final BarAggregator aggregator;
    private final BarPublisher publisher;
    private final BarProperties properties;

    public QuoteStreamService(
            QuoteStreamClient client,
            BarAggregator aggregator,
            BarPublisher publisher,
            BarProperties properties) {
        this.client = client;
        this.aggregator = aggregator;
        this.publisher = publisher;
        this.properties = properties;
    }

    /**
     * Starts the feed and subscribes the configured symbols when
     * {@code bars.stream.auto-start} is set.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void startOnBoot() {
        if (!properties.getStream().isAutoStart()) {
            log.info("Quote stream auto-start disabled");
            return;
        }
        start();
        for (String configured : properties.getStream().getSymbols()) {
            try {
                SymbolKey key = SymbolKey.parse(configured);
                subscribe(key.symbol(), key.exchange());
            } catch (NotConnectedException e) {
                log.warn("Cannot subscribe {} on boot: feed not connected", configured);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping invalid configured symbol '{}': {}", configured, e.getMessage());
            }
        }
    }

    public void start() {
        client.start();
    }

    /**
     * Stops the feed and flushes every in-progress bar to storage.
     *
     * @return number of bars flushed
     */
    public int stop() {
        client.stop();
        return aggregator.flushAll();
    }

    @PreDestroy
    public void shutdown() {
        if (client.isRunning()) {
            log.info("Shutting down quote stream");
            stop();
        }
    }

    /**
     * @throws NotConnectedException if the feed is not connected
     */
    public SymbolKey subscribe(String symbol, String exchange) {
        return client.subscribe(symbol, exchange, this::onQuoteUpdate);
    }

    /**
     * Unsubscribes and evicts the instrument's cached latest quote and current bars.
     *
     * @return true if a subscription existed
     */
    public boolean unsubscribe(String symbol, String exchange) {
        boolean removed = client.unsubscribe(symbol, exchange);
        SymbolKey key = SymbolKey.of(exchange, symbol);
        publisher.evictLatestQuote(key);
        publisher.evictCurrentBars(key);
        return removed;
    }

    void onQuoteUpdate(QuoteUpdate update) {
        Optional<Double> lastPrice = update.lastPrice();
        if (lastPrice.isEmpty()) {
            return;
        }

        publisher.publishLatestQuote(update.toLatestQuote());
        aggregator.addTick(new Tick(
            update.key(),
            update.timestamp(),
            lastPrice.get(),
            update.get(QuoteField.VOLUME).orElse(null)
        ));
    }

    public Optional<LatestQuote> getLatestQuote(String symbol, String exchange) {
        return publisher.getLatestQuote(SymbolKey.of(exchange, symbol));
    }

    /** Latest cached quotes of every subscribed instrument, ordered by key. */
    public List<LatestQuote> getAllQuotes() {
        List<LatestQuote> quotes = new ArrayList<>();
        client.getSubscribedKeys().stream()
            .sorted(Comparator.comparing(SymbolKey::toString))
            .forEach(key -> publisher.getLatestQuote(key).ifPresent(quotes::add));
        return quotes;
    }

    public Optional<CurrentBar> getCurrentBar(String symbol, String exchange, Interval interval) {
        return aggregator.getCurrentBar(symbol, exchange, interval);
    }

    /**
     * Writes every in-progress bar to storage. While the feed is running the builders
     * stay live and only a checkpoint is written; once stopped they are completed and
     * cleared.
     *
     * @return number of bars written
     */
    public int flushAll() {
        if (client.isRunning()) {
            return aggregator.checkpoint();
        }
        return aggregator.flushAll();
    }

    public StreamStatus status() {
        List<String> subscriptions = client.getSubscribedKeys().stream()
            .map(SymbolKey::toString)
            .sorted()
            .collect(Collectors.toList());
        List<String> active = aggregator.activeSymbols().stream()
            .map(SymbolKey::toString)
            .collect(Collectors.toList());
        List<String> intervals = aggregator.getIntervals().stream()
            .map(Interval::code)
            .collect(Collectors.toList());

        return new StreamStatus(
            client.isRunning(),
            client.isConnected(),
            client.getSessionId().orElse(null),
            subscriptions.size(),
            subscriptions,
            active,
            intervals
        );
    }
}
