package com.fintech.bars.service;

import com.fintech.bars.aggregation.BarSink;
import com.fintech.bars.domain.CompletedBar;
import com.fintech.bars.domain.Interval;
import com.fintech.bars.domain.SymbolKey;
import com.fintech.bars.storage.BarRepository;
import com.fintech.bars.storage.UpsertResult;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Storage gateway for bars, guarded by the {@code database} circuit breaker.
 *
 * <p>Writes come from the aggregator on the feed's reader thread and never throw:
 * failures are logged and counted. Reads serve the history API and surface
 * {@link ServiceException} / {@link ValidationException}.
 */
@Service
public class BarPersistenceService implements BarSink {

    private static final Logger log = LoggerFactory.getLogger(BarPersistenceService.class);

    private static final long MAX_RANGE_MS = 366L * 24 * 60 * 60 * 1000;
    private static final int LARGE_RESULT_WARN = 10_000;

    private final BarRepository repository;
    private final CircuitBreaker circuitBreaker;

    private final AtomicLong barsSaved = new AtomicLong(0);
    private final AtomicLong saveErrors = new AtomicLong(0);
    private final AtomicLong savesRejected = new AtomicLong(0);
    private final AtomicLong validationErrors = new AtomicLong(0);

    public BarPersistenceService(
            BarRepository repository,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        this.repository = repository;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("database");

        meterRegistry.gauge("bar.service.saved", barsSaved);
        meterRegistry.gauge("bar.service.save.errors", saveErrors);
        meterRegistry.gauge("bar.service.save.rejected", savesRejected);
        meterRegistry.gauge("bar.service.validation.errors", validationErrors);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    /**
     * Upserts a completed bar. Never throws.
     */
    @Override
    public void save(CompletedBar bar) {
        Objects.requireNonNull(bar, "Bar cannot be null");
        try {
            UpsertResult result = circuitBreaker.executeSupplier(() -> repository.upsert(bar));
            barsSaved.incrementAndGet();
            log.info("Saved bar: key={}, interval={}, start={}, result={}",
                bar.key(), bar.interval().code(), bar.barStart(), result);

        } catch (CallNotPermittedException e) {
            savesRejected.incrementAndGet();
            log.warn("Circuit breaker OPEN - bar save rejected: key={}, interval={}, start={}",
                bar.key(), bar.interval().code(), bar.barStart());

        } catch (Exception e) {
            saveErrors.incrementAndGet();
            log.error("Failed to save bar: key={}, interval={}, start={}",
                bar.key(), bar.interval().code(), bar.barStart(), e);
        }
    }

    /**
     * Finds stored bars with start in {@code [fromTimeMs, toTimeMs]}.
     *
     * @throws ValidationException if inputs are invalid
     * @throws ServiceException if storage fails or the breaker is open
     */
    public List<CompletedBar> findBars(SymbolKey key, Interval interval, long fromTimeMs, long toTimeMs) {
        validateInputs(key, interval, fromTimeMs, toTimeMs);

        try {
            List<CompletedBar> bars = circuitBreaker.executeSupplier(
                () -> repository.findByRange(key, interval, fromTimeMs, toTimeMs)
            );
            if (bars == null) {
                return Collections.emptyList();
            }
            if (bars.size() > LARGE_RESULT_WARN) {
                log.warn("Large result set: {} bars for key={}, interval={}", bars.size(), key, interval.code());
            }
            return bars;

        } catch (CallNotPermittedException e) {
            log.error("Circuit breaker OPEN - rejecting history request for key={}, interval={}", key, interval.code());
            throw new ServiceException("Database circuit breaker is open. System is recovering from errors.", e);

        } catch (Exception e) {
            log.error("Error retrieving bars: key={}, interval={}, from={}, to={}",
                key, interval.code(), fromTimeMs, toTimeMs, e);
            throw new ServiceException("Failed to retrieve bars from repository", e);
        }
    }

    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    public long getBarsSaved() {
        return barsSaved.get();
    }

    public long getSaveErrors() {
        return saveErrors.get();
    }

    private void validateInputs(SymbolKey key, Interval interval, long fromTimeMs, long toTimeMs) {
        if (key == null) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Symbol key cannot be null");
        }
        if (interval == null) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Interval cannot be null");
        }
        if (fromTimeMs < 0 || toTimeMs < 0) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Time range cannot be negative");
        }
        if (fromTimeMs >= toTimeMs) {
            validationErrors.incrementAndGet();
            throw new ValidationException("From time must be less than to time");
        }
        if (toTimeMs - fromTimeMs > MAX_RANGE_MS) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Time range exceeds maximum allowed (366 days)");
        }
    }

    /**
     * Invalid query input.
     */
    public static class ValidationException extends RuntimeException {
        public ValidationException(String message) {
            super(message);
        }
    }

    /**
     * Storage failure surfaced to API callers.
     */
    public static class ServiceException extends RuntimeException {
        public ServiceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
