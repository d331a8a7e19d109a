package com.fintech.bars.storage.timescaledb;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for bar rows.
 */
@Repository
public interface BarJpaRepository extends JpaRepository<BarEntity, String> {

    /**
     * Bars of one instrument and interval with start in [fromTime, toTime], oldest first.
     */
    @Query("SELECT b FROM BarEntity b " +
           "WHERE b.exchange = :exchange " +
           "AND b.symbol = :symbol " +
           "AND b.intervalCode = :intervalCode " +
           "AND b.barStart >= :fromTime " +
           "AND b.barStart <= :toTime " +
           "ORDER BY b.barStart ASC")
    List<BarEntity> findByRange(
        @Param("exchange") String exchange,
        @Param("symbol") String symbol,
        @Param("intervalCode") String intervalCode,
        @Param("fromTime") long fromTime,
        @Param("toTime") long toTime
    );

    Optional<BarEntity> findByExchangeAndSymbolAndIntervalCodeAndBarStart(
        String exchange,
        String symbol,
        String intervalCode,
        long barStart
    );

    long countByExchangeAndSymbolAndIntervalCode(String exchange, String symbol, String intervalCode);
}
