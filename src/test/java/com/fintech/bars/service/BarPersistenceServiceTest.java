package com.fintech.bars.service;

import com.fintech.bars.domain.CompletedBar;
import com.fintech.bars.domain.Interval;
import com.fintech.bars.domain.SymbolKey;
import com.fintech.bars.storage.BarRepository;
import com.fintech.bars.storage.UpsertResult;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("BarPersistenceService Tests")
class BarPersistenceServiceTest {

    private static final SymbolKey BTC = SymbolKey.of("BINANCE", "BTCUSDT");
    private static final long T0 = 1_733_000_040_000L;
    private static final long DAY_MS = 24L * 60 * 60 * 1000;

    private BarRepository repository;
    private BarPersistenceService service;

    @BeforeEach
    void setUp() {
        repository = mock(BarRepository.class);
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
            .slidingWindowSize(2)
            .minimumNumberOfCalls(2)
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofMinutes(1))
            .build());
        service = new BarPersistenceService(repository, registry, new SimpleMeterRegistry());
    }

    private static CompletedBar bar() {
        return new CompletedBar(BTC, Interval.M1, T0, T0 + 60_000, 1.0, 2.0, 0.5, 1.5, 10.0, 3);
    }

    @Test
    @DisplayName("Should upsert completed bars through the repository")
    void testSave() {
        when(repository.upsert(any())).thenReturn(UpsertResult.INSERTED);

        service.save(bar());

        verify(repository).upsert(bar());
        assertThat(service.getBarsSaved()).isEqualTo(1);
        assertThat(service.getCircuitBreakerState()).isEqualTo("CLOSED");
    }

    @Test
    @DisplayName("Storage failures should be counted, never thrown")
    void testSaveFailure() {
        when(repository.upsert(any())).thenThrow(new IllegalStateException("db down"));

        assertThatCode(() -> service.save(bar())).doesNotThrowAnyException();
        assertThat(service.getSaveErrors()).isEqualTo(1);
        assertThat(service.getBarsSaved()).isZero();
    }

    @Test
    @DisplayName("An open breaker should reject saves without touching storage")
    void testBreakerOpens() {
        when(repository.upsert(any())).thenThrow(new IllegalStateException("db down"));

        service.save(bar());
        service.save(bar());
        assertThat(service.getCircuitBreakerState()).isEqualTo("OPEN");

        service.save(bar());

        verify(repository, times(2)).upsert(any());
        assertThat(service.getSaveErrors()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should return bars for a valid range")
    void testFindBars() {
        when(repository.findByRange(BTC, Interval.M1, T0, T0 + 60_000)).thenReturn(List.of(bar()));

        assertThat(service.findBars(BTC, Interval.M1, T0, T0 + 60_000)).containsExactly(bar());
    }

    @Test
    @DisplayName("Should reject invalid ranges before querying")
    void testFindBarsValidation() {
        assertThatThrownBy(() -> service.findBars(BTC, Interval.M1, T0, T0))
            .isInstanceOf(BarPersistenceService.ValidationException.class);
        assertThatThrownBy(() -> service.findBars(BTC, Interval.M1, -1, T0))
            .isInstanceOf(BarPersistenceService.ValidationException.class);
        assertThatThrownBy(() -> service.findBars(BTC, Interval.M1, T0, T0 + 367 * DAY_MS))
            .isInstanceOf(BarPersistenceService.ValidationException.class);
        assertThatThrownBy(() -> service.findBars(BTC, null, T0, T0 + 1))
            .isInstanceOf(BarPersistenceService.ValidationException.class);

        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("Storage errors on read should surface as ServiceException")
    void testFindBarsFailure() {
        when(repository.findByRange(eq(BTC), eq(Interval.M1), anyLong(), anyLong()))
            .thenThrow(new IllegalStateException("timeout"));

        assertThatThrownBy(() -> service.findBars(BTC, Interval.M1, T0, T0 + 60_000))
            .isInstanceOf(BarPersistenceService.ServiceException.class)
            .hasMessageContaining("Failed to retrieve");
    }
}
