package com.gomesguardian.thesis.repository;

import com.gomesguardian.thesis.model.ScoreHistoryEntry;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface ScoreHistoryRepository extends ReactiveCrudRepository<ScoreHistoryEntry, Long> {

    @Query("SELECT * FROM score_history WHERE ticker = :ticker ORDER BY recorded_at DESC, id DESC LIMIT :limit")
    Flux<ScoreHistoryEntry> findRecent(String ticker, int limit);

    /** Latest entry for the ticker, empty when no history exists yet. */
    @Query("SELECT * FROM score_history WHERE ticker = :ticker ORDER BY recorded_at DESC, id DESC LIMIT 1")
    Mono<ScoreHistoryEntry> findLatest(String ticker);
}
