package com.fintech.bars.aggregation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.bars.cache.InMemoryQuoteCache;
import com.fintech.bars.domain.CompletedBar;
import com.fintech.bars.domain.CurrentBar;
import com.fintech.bars.domain.Interval;
import com.fintech.bars.domain.SymbolKey;
import com.fintech.bars.domain.Tick;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("BarAggregator Tests")
class BarAggregatorTest {

    private static final long T0 = 1_704_067_200_000L;
    private static final SymbolKey AAPL = SymbolKey.of("NASDAQ", "AAPL");

    private BarSink sink;
    private BarPublisher publisher;
    private BarAggregator aggregator;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(T0), ZoneOffset.UTC);
        sink = mock(BarSink.class);
        publisher = new BarPublisher(
            new InMemoryQuoteCache(new ObjectMapper(), clock), Duration.ofMinutes(1), Duration.ofMinutes(5));
        registry = new SimpleMeterRegistry();
        aggregator = new BarAggregator(List.of(Interval.M1, Interval.M5), 4, publisher, sink, clock, registry);
    }

    private static Tick tick(long timestamp, double price) {
        return Tick.of("NASDAQ", "AAPL", timestamp, price, 1.0);
    }

    @Test
    @DisplayName("Ticks within one window should not emit completed bars")
    void testNoEmissionWithinWindow() {
        aggregator.addTick(tick(T0 + 1_000, 10.0));
        aggregator.addTick(tick(T0 + 30_000, 11.0));

        verify(sink, never()).save(any());
        assertThat(aggregator.getTicksProcessed()).isEqualTo(2);
    }

    @Test
    @DisplayName("Crossing a window boundary should emit exactly one bar for that interval")
    void testRolloverEmitsOneBar() {
        aggregator.addTick(tick(T0 + 1_000, 10.0));
        aggregator.addTick(tick(T0 + 30_000, 12.0));
        aggregator.addTick(tick(T0 + 61_000, 11.0));

        ArgumentCaptor<CompletedBar> captor = ArgumentCaptor.forClass(CompletedBar.class);
        verify(sink, times(1)).save(captor.capture());
        CompletedBar bar = captor.getValue();
        assertThat(bar.interval()).isEqualTo(Interval.M1);
        assertThat(bar.barStart()).isEqualTo(T0);
        assertThat(bar.open()).isEqualTo(10.0);
        assertThat(bar.high()).isEqualTo(12.0);
        assertThat(bar.close()).isEqualTo(12.0);
        assertThat(bar.tickCount()).isEqualTo(2);
        assertThat(aggregator.getBarsCompleted()).isEqualTo(1);
    }

    @Test
    @DisplayName("A gap of several windows should not emit bars for the empty windows")
    void testGapSkipsEmptyWindows() {
        aggregator.addTick(tick(T0 + 1_000, 10.0));
        aggregator.addTick(tick(T0 + 10 * 60_000 + 1, 11.0));

        ArgumentCaptor<CompletedBar> captor = ArgumentCaptor.forClass(CompletedBar.class);
        verify(sink, times(2)).save(captor.capture());
        assertThat(captor.getAllValues())
            .extracting(CompletedBar::interval, CompletedBar::barStart)
            .containsExactlyInAnyOrder(
                tuple(Interval.M1, T0),
                tuple(Interval.M5, T0)
            );
    }

    @Test
    @DisplayName("A tick older than the active window should be dropped and counted")
    void testLateTickDropped() {
        aggregator.addTick(tick(T0 + 61_000, 10.0));
        aggregator.addTick(tick(T0 + 59_000, 99.0));

        assertThat(aggregator.getLateTicksDropped()).isEqualTo(1);
        Optional<CurrentBar> m1 = aggregator.getCurrentBar("AAPL", "NASDAQ", Interval.M1);
        assertThat(m1).isPresent();
        assertThat(m1.get().high()).isEqualTo(10.0);
        // the 5m window still contains the late tick
        assertThat(aggregator.getCurrentBar("AAPL", "NASDAQ", Interval.M5).orElseThrow().high()).isEqualTo(99.0);
    }

    @Test
    @DisplayName("Every accepted tick should publish the current bar to the cache")
    void testCurrentBarPublished() {
        aggregator.addTick(tick(T0 + 1_000, 10.0));
        aggregator.addTick(tick(T0 + 2_000, 9.0));

        CurrentBar bar = publisher.getCurrentBar(AAPL, Interval.M1).orElseThrow();
        assertThat(bar.open()).isEqualTo(10.0);
        assertThat(bar.low()).isEqualTo(9.0);
        assertThat(bar.tickCount()).isEqualTo(2);
        assertThat(bar.updatedAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("flushAll should emit every in-progress bar and clear state")
    void testFlushAll() {
        aggregator.addTick(tick(T0 + 1_000, 10.0));
        aggregator.addTick(Tick.of("NYSE", "IBM", T0 + 1_000, 150.0, null));

        int flushed = aggregator.flushAll();

        assertThat(flushed).isEqualTo(4);
        verify(sink, times(4)).save(any());
        assertThat(aggregator.activeSymbols()).isEmpty();
        assertThat(aggregator.flushAll()).isZero();
    }

    @Test
    @DisplayName("checkpoint should write in-progress bars and keep accumulating the window")
    void testCheckpointKeepsBuilders() {
        Map<String, CompletedBar> stored = new ConcurrentHashMap<>();
        BarAggregator upserting = new BarAggregator(List.of(Interval.M1), 4, publisher,
            bar -> stored.put(bar.key() + "|" + bar.interval().code() + "|" + bar.barStart(), bar),
            Clock.fixed(Instant.ofEpochMilli(T0), ZoneOffset.UTC), new SimpleMeterRegistry());
        String firstWindow = AAPL + "|1m|" + T0;

        upserting.addTick(tick(T0 + 1_000, 10.0));
        upserting.addTick(tick(T0 + 2_000, 20.0));

        assertThat(upserting.checkpoint()).isEqualTo(1);
        assertThat(stored.get(firstWindow).tickCount()).isEqualTo(2);
        assertThat(upserting.activeSymbols()).containsExactly(AAPL);

        upserting.addTick(tick(T0 + 30_000, 15.0));
        upserting.addTick(tick(T0 + 61_000, 16.0));

        CompletedBar bar = stored.get(firstWindow);
        assertThat(bar.open()).isEqualTo(10.0);
        assertThat(bar.high()).isEqualTo(20.0);
        assertThat(bar.low()).isEqualTo(10.0);
        assertThat(bar.close()).isEqualTo(15.0);
        assertThat(bar.volume()).isEqualTo(3.0);
        assertThat(bar.tickCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("checkpoint with no active builders should write nothing")
    void testCheckpointEmpty() {
        assertThat(aggregator.checkpoint()).isZero();
        verify(sink, never()).save(any());
    }

    @Test
    @DisplayName("activeSymbols should list keys with builders in sorted order")
    void testActiveSymbols() {
        aggregator.addTick(Tick.of("NYSE", "IBM", T0, 150.0, null));
        aggregator.addTick(tick(T0, 10.0));

        assertThat(aggregator.activeSymbols())
            .extracting(SymbolKey::toString)
            .containsExactly("NASDAQ:AAPL", "NYSE:IBM");
    }

    @Test
    @DisplayName("A failing sink should not break tick processing")
    void testSinkFailureIsolated() {
        doThrow(new IllegalStateException("db down")).when(sink).save(any());

        aggregator.addTick(tick(T0 + 1_000, 10.0));
        aggregator.addTick(tick(T0 + 61_000, 11.0));
        aggregator.addTick(tick(T0 + 62_000, 12.0));

        assertThat(aggregator.getTicksProcessed()).isEqualTo(3);
        assertThat(aggregator.getBarsCompleted()).isZero();
    }

    @Test
    @DisplayName("Concurrent ticks across symbols should be counted once each")
    void testConcurrentTicks() throws InterruptedException {
        List<CompletedBar> saved = Collections.synchronizedList(new ArrayList<>());
        BarAggregator concurrent = new BarAggregator(List.of(Interval.M1), 8, publisher, saved::add,
            Clock.fixed(Instant.ofEpochMilli(T0), ZoneOffset.UTC), new SimpleMeterRegistry());
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);

        for (int t = 0; t < 4; t++) {
            String symbol = "SYM" + t;
            executor.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    concurrent.addTick(Tick.of("TEST", symbol, T0 + i * 1_000L, 100.0 + i, 1.0));
                }
                done.countDown();
            });
        }

        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        concurrent.flushAll();

        assertThat(concurrent.getTicksProcessed()).isEqualTo(2_000);
        // 500 seconds per symbol span 9 one-minute windows
        assertThat(saved).hasSize(4 * 9);
        assertThat(saved.stream().mapToLong(CompletedBar::tickCount).sum()).isEqualTo(2_000);
    }

    @Test
    @DisplayName("Concurrent ticks for one key should leave the newest bar in the cache")
    void testConcurrentSameKeyPublishesNewest() throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(4);

        for (int t = 0; t < 4; t++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < 1_000; i++) {
                        aggregator.addTick(tick(T0 + 1_000, 100.0 + i));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();

        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(publisher.getCurrentBar(AAPL, Interval.M1).orElseThrow().tickCount()).isEqualTo(4_000);
        assertThat(publisher.getCurrentBar(AAPL, Interval.M5).orElseThrow().tickCount()).isEqualTo(4_000);
    }

    @Test
    @DisplayName("Should reject an empty interval list or non-positive partition count")
    void testInvalidConfiguration() {
        assertThatThrownBy(() -> new BarAggregator(List.of(), 1, publisher, sink, Clock.systemUTC(), registry))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BarAggregator(List.of(Interval.M1), 0, publisher, sink, Clock.systemUTC(), registry))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
