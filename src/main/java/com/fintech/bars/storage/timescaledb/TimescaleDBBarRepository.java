package com.fintech.bars.storage.timescaledb;

import com.fintech.bars.domain.CompletedBar;
import com.fintech.bars.domain.Interval;
import com.fintech.bars.domain.SymbolKey;
import com.fintech.bars.storage.BarRepository;
import com.fintech.bars.storage.UpsertResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * TimescaleDB (PostgreSQL) implementation of {@link BarRepository}.
 *
 * <p>Upsert is read-then-write on the composite id inside one transaction: an existing
 * row gets its OHLCV fields overwritten, its {@code created_at} stays as first written.
 */
@Repository
public class TimescaleDBBarRepository implements BarRepository {

    private static final Logger log = LoggerFactory.getLogger(TimescaleDBBarRepository.class);

    private final BarJpaRepository jpaRepository;

    private final AtomicLong insertCounter = new AtomicLong(0);
    private final AtomicLong updateCounter = new AtomicLong(0);
    private final AtomicLong readCounter = new AtomicLong(0);
    private final AtomicLong writeErrorCounter = new AtomicLong(0);
    private final Timer writeTimer;
    private final Timer readTimer;

    public TimescaleDBBarRepository(BarJpaRepository jpaRepository, MeterRegistry meterRegistry) {
        this.jpaRepository = jpaRepository;

        meterRegistry.gauge("bar.storage.inserts.total", insertCounter);
        meterRegistry.gauge("bar.storage.updates.total", updateCounter);
        meterRegistry.gauge("bar.storage.reads.total", readCounter);
        meterRegistry.gauge("bar.storage.write.errors", writeErrorCounter);

        this.writeTimer = meterRegistry.timer("bar.storage.write.latency");
        this.readTimer = meterRegistry.timer("bar.storage.read.latency");

        log.info("TimescaleDB bar repository initialized");
    }

    @Override
    @Transactional
    public UpsertResult upsert(CompletedBar bar) {
        return writeTimer.record(() -> {
            String id = idOf(bar);
            try {
                Optional<BarEntity> existing = jpaRepository.findById(id);
                if (existing.isPresent()) {
                    BarEntity entity = existing.get();
                    applyValues(entity, bar);
                    jpaRepository.save(entity);
                    updateCounter.incrementAndGet();
                    log.debug("Updated bar {}", id);
                    return UpsertResult.UPDATED;
                }

                BarEntity entity = BarEntity.builder().id(id).build();
                applyValues(entity, bar);
                jpaRepository.save(entity);
                insertCounter.incrementAndGet();
                if (log.isTraceEnabled()) {
                    log.trace("Inserted bar {}", id);
                }
                return UpsertResult.INSERTED;

            } catch (RuntimeException e) {
                writeErrorCounter.incrementAndGet();
                log.error("Failed to upsert bar: id={}", id, e);
                throw new IllegalStateException("TimescaleDB write failed for " + id, e);
            }
        });
    }

    @Override
    @Transactional(readOnly = true)
    public List<CompletedBar> findByRange(SymbolKey key, Interval interval, long fromTime, long toTime) {
        return readTimer.record(() -> {
            List<BarEntity> entities = jpaRepository.findByRange(
                key.exchange(), key.symbol(), interval.code(), fromTime, toTime
            );
            readCounter.addAndGet(entities.size());

            if (log.isDebugEnabled()) {
                log.debug("Range query: key={}, interval={}, from={}, to={}, results={}",
                    key, interval.code(), fromTime, toTime, entities.size());
            }

            return entities.stream()
                .map(this::fromEntity)
                .collect(Collectors.toList());
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CompletedBar> findByBarStart(SymbolKey key, Interval interval, long barStart) {
        return readTimer.record(() -> {
            Optional<BarEntity> entity = jpaRepository.findByExchangeAndSymbolAndIntervalCodeAndBarStart(
                key.exchange(), key.symbol(), interval.code(), barStart
            );
            entity.ifPresent(e -> readCounter.incrementAndGet());
            return entity.map(this::fromEntity);
        });
    }

    /** Returns the stored creation time of a bar, if present. */
    @Transactional(readOnly = true)
    public Optional<Long> findCreatedAt(SymbolKey key, Interval interval, long barStart) {
        return jpaRepository.findById(BarEntity.generateId(key.exchange(), key.symbol(), interval.code(), barStart))
            .map(BarEntity::getCreatedAt);
    }

    @Override
    public long count() {
        return jpaRepository.count();
    }

    public long count(SymbolKey key, Interval interval) {
        return jpaRepository.countByExchangeAndSymbolAndIntervalCode(key.exchange(), key.symbol(), interval.code());
    }

    @Override
    public boolean isHealthy() {
        try {
            jpaRepository.count();
            return true;
        } catch (Exception e) {
            log.error("TimescaleDB health check failed", e);
            return false;
        }
    }

    private static String idOf(CompletedBar bar) {
        return BarEntity.generateId(bar.exchange(), bar.symbol(), bar.interval().code(), bar.barStart());
    }

    private static void applyValues(BarEntity entity, CompletedBar bar) {
        entity.setSymbol(bar.symbol());
        entity.setExchange(bar.exchange());
        entity.setIntervalCode(bar.interval().code());
        entity.setBarStart(bar.barStart());
        entity.setBarEnd(bar.barEnd());
        entity.setOpen(bar.open());
        entity.setHigh(bar.high());
        entity.setLow(bar.low());
        entity.setClose(bar.close());
        entity.setVolume(bar.volume());
        entity.setTickCount(bar.tickCount());
    }

    private CompletedBar fromEntity(BarEntity entity) {
        return new CompletedBar(
            SymbolKey.of(entity.getExchange(), entity.getSymbol()),
            Interval.fromCode(entity.getIntervalCode()),
            entity.getBarStart(),
            entity.getBarEnd(),
            entity.getOpen(),
            entity.getHigh(),
            entity.getLow(),
            entity.getClose(),
            entity.getVolume(),
            entity.getTickCount()
        );
    }
}
