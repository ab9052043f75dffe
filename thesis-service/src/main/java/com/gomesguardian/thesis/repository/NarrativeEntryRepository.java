package com.gomesguardian.thesis.repository;

import com.gomesguardian.thesis.model.NarrativeEntry;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface NarrativeEntryRepository extends ReactiveCrudRepository<NarrativeEntry, Long> {

    Flux<NarrativeEntry> findByTickerOrderBySequenceNoAsc(String ticker);
}
