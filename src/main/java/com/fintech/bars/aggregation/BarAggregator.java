package com.fintech.bars.aggregation;

import com.fintech.bars.domain.CompletedBar;
import com.fintech.bars.domain.CurrentBar;
import com.fintech.bars.domain.Interval;
import com.fintech.bars.domain.SymbolKey;
import com.fintech.bars.domain.Tick;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Multi-interval OHLCV bar aggregator.
 *
 * <p>Builders live in N partitions selected by symbol-key hash, each with its own lock,
 * so ticks for unrelated symbols do not contend. Locks cover map mutation only:
 * completed bars are queued under the partition lock and handed to the {@link BarSink}
 * afterwards by one drainer at a time (bars of one key reach storage in
 * {@code barStart} order). Cache publication happens after the lock is released:
 * every snapshot carries a per-partition sequence number and a snapshot older than
 * the last one published for its key and interval is skipped, so concurrent ticks
 * for one key never leave a stale bar in the cache.
 *
 * <p>A tick older than the active window of an interval is dropped and counted.
 */
public class BarAggregator {

    private static final Logger log = LoggerFactory.getLogger(BarAggregator.class);

    private final List<Interval> intervals;
    private final Partition[] partitions;
    private final BarPublisher publisher;
    private final BarSink sink;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final AtomicLong ticksProcessed = new AtomicLong(0);
    private final AtomicLong barsCompleted = new AtomicLong(0);
    private final AtomicLong lateTicksDropped = new AtomicLong(0);

    public BarAggregator(
            List<Interval> intervals,
            int partitionCount,
            BarPublisher publisher,
            BarSink sink,
            Clock clock,
            MeterRegistry meterRegistry) {
        if (intervals == null || intervals.isEmpty()) {
            throw new IllegalArgumentException("At least one interval is required");
        }
        if (partitionCount < 1) {
            throw new IllegalArgumentException("Partition count must be >= 1, got " + partitionCount);
        }
        this.intervals = List.copyOf(intervals);
        this.partitions = new Partition[partitionCount];
        for (int i = 0; i < partitionCount; i++) {
            partitions[i] = new Partition();
        }
        this.publisher = publisher;
        this.sink = sink;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("bar.aggregator.ticks.processed", ticksProcessed);
        meterRegistry.gauge("bar.aggregator.bars.completed", barsCompleted);
        meterRegistry.gauge("bar.aggregator.late.ticks.dropped", lateTicksDropped);

        log.info("Bar aggregator initialized: intervals={}, partitions={}",
            this.intervals.stream().map(Interval::code).collect(Collectors.joining(",")), partitionCount);
    }

    /**
     * Routes a tick to every configured interval. A builder whose window the tick
     * has moved past is completed and replaced before the tick is applied.
     */
    public void addTick(Tick tick) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            SymbolKey key = tick.key();
            long timestamp = tick.timestamp();
            Partition partition = partitionFor(key);
            List<Snapshot> snapshots = new ArrayList<>(intervals.size());
            long now = clock.millis();

            partition.lock.lock();
            try {
                Map<Interval, BarBuilder> builders =
                    partition.builders.computeIfAbsent(key, k -> new EnumMap<>(Interval.class));

                for (Interval interval : intervals) {
                    BarBuilder builder = builders.get(interval);
                    if (builder == null) {
                        builder = BarBuilder.forTimestamp(key, interval, timestamp);
                        builders.put(interval, builder);
                    } else if (builder.isComplete(timestamp)) {
                        if (!builder.isEmpty()) {
                            partition.pending.add(builder.toCompletedBar());
                        }
                        log.debug("Rolled bar: key={}, interval={}, old_start={}",
                            key, interval.code(), builder.getBarStart());
                        builder = BarBuilder.forTimestamp(key, interval, timestamp);
                        builders.put(interval, builder);
                    }

                    if (!builder.addTick(tick.price(), tick.volume(), timestamp)) {
                        lateTicksDropped.incrementAndGet();
                        if (log.isTraceEnabled()) {
                            log.trace("Dropped late tick: key={}, interval={}, tick_ts={}, bar_start={}",
                                key, interval.code(), timestamp, builder.getBarStart());
                        }
                        continue;
                    }
                    snapshots.add(new Snapshot(++partition.sequence, builder.toCurrentBar(now)));
                }
            } finally {
                partition.lock.unlock();
            }

            drain(partition);
            publish(partition, key, snapshots);
            ticksProcessed.incrementAndGet();
        } finally {
            sample.stop(meterRegistry.timer("bar.aggregator.tick.processing.time"));
        }
    }

    /**
     * Completes every non-empty builder, hands the bars to the sink and clears all
     * state. Used on shutdown.
     *
     * @return number of bars flushed
     */
    public int flushAll() {
        int flushed = 0;
        for (Partition partition : partitions) {
            partition.lock.lock();
            try {
                for (Map<Interval, BarBuilder> builders : partition.builders.values()) {
                    for (BarBuilder builder : builders.values()) {
                        if (!builder.isEmpty()) {
                            partition.pending.add(builder.toCompletedBar());
                            flushed++;
                        }
                    }
                }
                partition.builders.clear();
            } finally {
                partition.lock.unlock();
            }
            drain(partition);
            partition.flushLock.lock();
            try {
                partition.published.clear();
            } finally {
                partition.flushLock.unlock();
            }
        }
        log.info("Flushed {} in-progress bars", flushed);
        return flushed;
    }

    /**
     * Hands a copy of every non-empty builder to the sink as a completed bar while
     * keeping the builders live. Later ticks keep accumulating into the same window,
     * and the bar stored at rollover replaces the checkpointed row.
     *
     * @return number of bars checkpointed
     */
    public int checkpoint() {
        int written = 0;
        for (Partition partition : partitions) {
            partition.lock.lock();
            try {
                for (Map<Interval, BarBuilder> builders : partition.builders.values()) {
                    for (BarBuilder builder : builders.values()) {
                        if (!builder.isEmpty()) {
                            partition.pending.add(builder.toCompletedBar());
                            written++;
                        }
                    }
                }
            } finally {
                partition.lock.unlock();
            }
            drain(partition);
        }
        log.info("Checkpointed {} in-progress bars", written);
        return written;
    }

    /** Reads the in-progress bar from the cache; aggregator state is not consulted. */
    public Optional<CurrentBar> getCurrentBar(String symbol, String exchange, Interval interval) {
        return publisher.getCurrentBar(SymbolKey.of(exchange, symbol), interval);
    }

    /** Symbol keys that currently have at least one builder. */
    public Set<SymbolKey> activeSymbols() {
        Set<SymbolKey> active = new TreeSet<>((a, b) -> a.toString().compareTo(b.toString()));
        for (Partition partition : partitions) {
            partition.lock.lock();
            try {
                active.addAll(partition.builders.keySet());
            } finally {
                partition.lock.unlock();
            }
        }
        return active;
    }

    public List<Interval> getIntervals() {
        return intervals;
    }

    public long getTicksProcessed() {
        return ticksProcessed.get();
    }

    public long getBarsCompleted() {
        return barsCompleted.get();
    }

    public long getLateTicksDropped() {
        return lateTicksDropped.get();
    }

    private Partition partitionFor(SymbolKey key) {
        return partitions[Math.floorMod(key.hashCode(), partitions.length)];
    }

    /**
     * Hands queued bars to the sink in FIFO order. The flush lock serializes drainers
     * so that queue order is storage order.
     */
    private void drain(Partition partition) {
        partition.flushLock.lock();
        try {
            while (true) {
                CompletedBar bar;
                partition.lock.lock();
                try {
                    bar = partition.pending.poll();
                } finally {
                    partition.lock.unlock();
                }
                if (bar == null) {
                    return;
                }
                try {
                    sink.save(bar);
                    barsCompleted.incrementAndGet();
                } catch (RuntimeException e) {
                    log.error("Bar sink rejected {} {} start={}", bar.key(), bar.interval().code(), bar.barStart(), e);
                }
            }
        } finally {
            partition.flushLock.unlock();
        }
    }

    /**
     * Publishes snapshots newer than the last one published for the same key and
     * interval. The flush lock makes check and publish atomic per partition.
     */
    private void publish(Partition partition, SymbolKey key, List<Snapshot> snapshots) {
        if (snapshots.isEmpty()) {
            return;
        }
        partition.flushLock.lock();
        try {
            Map<String, Long> published =
                partition.published.computeIfAbsent(key, k -> new HashMap<>());
            for (Snapshot snapshot : snapshots) {
                String interval = snapshot.bar().interval();
                Long last = published.get(interval);
                if (last != null && last > snapshot.sequence()) {
                    log.trace("Skipped stale snapshot: key={}, interval={}", key, interval);
                    continue;
                }
                published.put(interval, snapshot.sequence());
                publisher.publishCurrentBar(snapshot.bar());
            }
        } finally {
            partition.flushLock.unlock();
        }
    }

    private record Snapshot(long sequence, CurrentBar bar) {
    }

    private static final class Partition {
        final ReentrantLock lock = new ReentrantLock();
        final ReentrantLock flushLock = new ReentrantLock();
        // guarded by lock
        final Map<SymbolKey, Map<Interval, BarBuilder>> builders = new HashMap<>();
        final Queue<CompletedBar> pending = new ArrayDeque<>();
        long sequence;
        // guarded by flushLock
        final Map<SymbolKey, Map<String, Long>> published = new HashMap<>();
    }
}
