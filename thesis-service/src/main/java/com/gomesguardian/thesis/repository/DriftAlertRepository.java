package com.gomesguardian.thesis.repository;

import com.gomesguardian.thesis.model.DriftAlert;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface DriftAlertRepository extends ReactiveCrudRepository<DriftAlert, Long> {

    /**
     * Unacknowledged alerts, most severe first, then newest first.
     */
    @Query("""
        SELECT * FROM drift_alert
        WHERE acknowledged = FALSE
        ORDER BY CASE severity
                   WHEN 'CRITICAL'    THEN 0
                   WHEN 'WARNING'     THEN 1
                   WHEN 'OPPORTUNITY' THEN 2
                   ELSE 3
                 END,
                 created_at DESC
        LIMIT :limit
        """)
    Flux<DriftAlert> findPending(int limit);

    @Query("""
        SELECT * FROM drift_alert
        WHERE acknowledged = FALSE AND severity = :severity
        ORDER BY created_at DESC
        LIMIT :limit
        """)
    Flux<DriftAlert> findPendingBySeverity(String severity, int limit);

    Flux<DriftAlert> findByTickerOrderByCreatedAtDesc(String ticker);

    /** Sets the acknowledgement once; a second call changes nothing. */
    @Modifying
    @Query("""
        UPDATE drift_alert
           SET acknowledged = TRUE,
               acknowledged_at = :acknowledgedAt
         WHERE id = :id
           AND acknowledged = FALSE
        """)
    Mono<Integer> acknowledge(Long id, LocalDateTime acknowledgedAt);
}
