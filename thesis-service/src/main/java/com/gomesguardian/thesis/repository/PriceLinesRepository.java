package com.gomesguardian.thesis.repository;

import com.gomesguardian.thesis.model.PriceLinesRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface PriceLinesRepository extends ReactiveCrudRepository<PriceLinesRecord, Long> {

    @Query("SELECT * FROM price_lines WHERE ticker = :ticker AND valid_until IS NULL")
    Mono<PriceLinesRecord> findCurrent(String ticker);

    @Query("SELECT * FROM price_lines WHERE ticker = :ticker ORDER BY effective_from DESC, id DESC")
    Flux<PriceLinesRecord> findHistory(String ticker);

    /** Retires the current version so that a new one can be inserted. */
    @Modifying
    @Query("""
        UPDATE price_lines
           SET valid_until = :validUntil
         WHERE ticker = :ticker
           AND valid_until IS NULL
        """)
    Mono<Integer> closeCurrent(String ticker, LocalDateTime validUntil);
}
