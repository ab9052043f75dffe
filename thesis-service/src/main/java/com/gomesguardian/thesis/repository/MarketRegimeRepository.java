package com.gomesguardian.thesis.repository;

import com.gomesguardian.thesis.model.MarketRegimeState;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface MarketRegimeRepository extends ReactiveCrudRepository<MarketRegimeState, Long> {

    @Query("SELECT * FROM market_regime WHERE id = 1")
    Mono<MarketRegimeState> findCurrent();

    @Query("SELECT * FROM market_regime WHERE id = 1 FOR UPDATE")
    Mono<MarketRegimeState> lockCurrent();

    /**
     * Writes the single regime row, creating it on first use and bumping its version.
     */
    @Modifying
    @Query("""
        INSERT INTO market_regime (id, regime, note, version, updated_by, updated_at)
        VALUES (1, :regime, :note, 0, :updatedBy, :updatedAt)
        ON CONFLICT (id) DO UPDATE SET
            regime     = EXCLUDED.regime,
            note       = EXCLUDED.note,
            version    = market_regime.version + 1,
            updated_by = EXCLUDED.updated_by,
            updated_at = EXCLUDED.updated_at
        """)
    Mono<Integer> upsert(String regime, String note, String updatedBy, LocalDateTime updatedAt);
}
