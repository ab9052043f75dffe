package com.gomesguardian.thesis.repository;

import com.gomesguardian.thesis.model.VerdictRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface VerdictRepository extends ReactiveCrudRepository<VerdictRecord, Long> {

    @Query("SELECT * FROM verdict_log WHERE ticker = :ticker ORDER BY created_at DESC, id DESC LIMIT :limit")
    Flux<VerdictRecord> findRecent(String ticker, int limit);
}
