package com.gomesguardian.thesis.repository;

import com.gomesguardian.thesis.model.MarketRegimeChange;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface MarketRegimeChangeRepository extends ReactiveCrudRepository<MarketRegimeChange, Long> {

    @Query("SELECT * FROM market_regime_log ORDER BY changed_at DESC, id DESC LIMIT :limit")
    Flux<MarketRegimeChange> findRecent(int limit);
}
