package com.pricecheck.checker.persistence;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;

@Repository
public interface PriceHistoryRepository extends ReactiveCrudRepository<PriceHistoryRecord, Long> {

    Flux<PriceHistoryRecord> findByProductKeyAndRecordedAtAfterOrderByRecordedAtAsc(String productKey,
                                                                                   LocalDateTime after);
}
