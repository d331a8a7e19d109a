package com.fintech.bars.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.bars.aggregation.BarAggregator;
import com.fintech.bars.aggregation.BarPublisher;
import com.fintech.bars.cache.QuoteCache;
import com.fintech.bars.domain.Interval;
import com.fintech.bars.protocol.FrameCodec;
import com.fintech.bars.service.BarPersistenceService;
import com.fintech.bars.stream.JavaWebSocketTransportFactory;
import com.fintech.bars.stream.QuoteStreamClient;
import com.fintech.bars.stream.QuoteTransportFactory;
import com.fintech.bars.stream.ReconnectBackoff;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;

/**
 * Wiring of the feed client and aggregation pipeline.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FrameCodec frameCodec(ObjectMapper objectMapper) {
        return new FrameCodec(objectMapper);
    }

    @Bean
    public QuoteTransportFactory quoteTransportFactory(BarProperties properties) {
        BarProperties.Stream stream = properties.getStream();
        return new JavaWebSocketTransportFactory(
            URI.create(stream.getUrl()),
            stream.getOrigin(),
            stream.getUserAgent(),
            stream.getConnectTimeoutMs(),
            stream.getConnectionLostTimeoutSeconds()
        );
    }

    @Bean
    public QuoteStreamClient quoteStreamClient(
            QuoteTransportFactory transportFactory,
            FrameCodec frameCodec,
            BarProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        BarProperties.Stream stream = properties.getStream();
        ReconnectBackoff backoff = new ReconnectBackoff(
            Duration.ofMillis(stream.getBackoffFloorMs()),
            Duration.ofMillis(stream.getBackoffCeilingMs())
        );
        return new QuoteStreamClient(transportFactory, frameCodec, backoff, clock, meterRegistry);
    }

    @Bean
    public BarPublisher barPublisher(QuoteCache quoteCache, BarProperties properties) {
        BarProperties.Cache cache = properties.getCache();
        return new BarPublisher(
            quoteCache,
            Duration.ofSeconds(cache.getQuoteTtlSeconds()),
            Duration.ofSeconds(cache.getBarTtlSeconds())
        );
    }

    @Bean
    public BarAggregator barAggregator(
            BarProperties properties,
            BarPublisher barPublisher,
            BarPersistenceService persistenceService,
            Clock clock,
            MeterRegistry meterRegistry) {
        BarProperties.Aggregation aggregation = properties.getAggregation();
        return new BarAggregator(
            Interval.fromCodes(aggregation.getIntervals()),
            aggregation.getPartitions(),
            barPublisher,
            persistenceService,
            clock,
            meterRegistry
        );
    }
}
