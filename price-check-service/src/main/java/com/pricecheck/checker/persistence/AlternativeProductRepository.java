package com.pricecheck.checker.persistence;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface AlternativeProductRepository extends ReactiveCrudRepository<AlternativeProductRecord, Long> {

    @Query("SELECT * FROM alternative_products WHERE search_query = :query ORDER BY recorded_at DESC, match_score DESC LIMIT :limit")
    Flux<AlternativeProductRecord> findRecentByQuery(String query, int limit);
}
