package com.gomesguardian.thesis.repository;

import com.gomesguardian.thesis.model.ThesisRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface ThesisRepository extends ReactiveCrudRepository<ThesisRecord, Long> {

    Mono<ThesisRecord> findByTicker(String ticker);

    /**
     * Row-locks the thesis for the rest of the surrounding transaction. Concurrent
     * merges for the same ticker queue here; other tickers are unaffected.
     */
    @Query("SELECT * FROM thesis WHERE ticker = :ticker FOR UPDATE")
    Mono<ThesisRecord> lockByTicker(String ticker);

    @Query("SELECT * FROM thesis WHERE needs_review = TRUE ORDER BY last_updated DESC")
    Flux<ThesisRecord> findNeedingReview();

    @Modifying
    @Query("""
        UPDATE thesis
           SET needs_review = TRUE,
               review_reason = :reason
         WHERE ticker = :ticker
        """)
    Mono<Integer> markNeedsReview(String ticker, String reason);
}
