package com.pricecheck.checker.persistence;

import com.pricecheck.common.model.AlternativeProduct;
import com.pricecheck.common.model.ProductCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;

/**
 * {@link PriceHistoryStore} backed by Spring Data R2DBC repositories. Timestamps are stored
 * as UTC {@link LocalDateTime}; queries are stored lower-cased and trimmed.
 */
@Service
public class R2dbcPriceHistoryStore implements PriceHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcPriceHistoryStore.class);

    private final PriceHistoryRepository priceHistoryRepository;
    private final AlternativeProductRepository alternativeRepository;
    private final Clock clock;

    public R2dbcPriceHistoryStore(PriceHistoryRepository priceHistoryRepository,
                                  AlternativeProductRepository alternativeRepository,
                                  Clock clock) {
        this.priceHistoryRepository = priceHistoryRepository;
        this.alternativeRepository  = alternativeRepository;
        this.clock                  = clock;
    }

    @Override
    public Mono<Void> recordPrice(ProductCandidate candidate, Instant timestamp) {
        PriceHistoryRecord entity = new PriceHistoryRecord();
        entity.setProductKey(candidate.productKey());
        entity.setProductName(candidate.name());
        entity.setSource(candidate.source());
        entity.setPrice(candidate.price());
        entity.setWasPrice(candidate.wasPrice());
        entity.setOnSale(candidate.onSale());
        entity.setPromoText(candidate.promoText());
        entity.setUrl(candidate.url());
        entity.setRecordedAt(toUtc(timestamp));

        return priceHistoryRepository.save(entity)
            .doOnSuccess(saved -> log.debug("PRICE_RECORDED productKey={} price={} source={}",
                saved.getProductKey(), saved.getPrice(), saved.getSource()))
            .then();
    }

    @Override
    public Mono<Void> recordAlternatives(String query, String source, List<AlternativeProduct> alternatives,
                                         Instant timestamp) {
        if (alternatives == null || alternatives.isEmpty()) {
            return Mono.empty();
        }
        String normalizedQuery = normalize(query);
        LocalDateTime recordedAt = toUtc(timestamp);
        List<AlternativeProductRecord> entities = alternatives.stream()
            .map(alt -> {
                AlternativeProductRecord entity = new AlternativeProductRecord();
                entity.setSearchQuery(normalizedQuery);
                entity.setSource(source);
                entity.setProductName(alt.name());
                entity.setPrice(alt.price());
                entity.setWasPrice(alt.was());
                entity.setOnSale(alt.onSale());
                entity.setPromoText(alt.promoText());
                entity.setUrl(alt.url());
                entity.setMatchScore(alt.matchScore());
                entity.setRecordedAt(recordedAt);
                return entity;
            })
            .toList();

        return alternativeRepository.saveAll(entities)
            .count()
            .doOnSuccess(count -> log.debug("ALTERNATIVES_RECORDED query={} source={} count={}",
                normalizedQuery, source, count))
            .then();
    }

    @Override
    public Flux<PricePoint> readPriceHistory(String productKey, int windowDays) {
        LocalDateTime cutoff = LocalDateTime.now(clock.withZone(ZoneOffset.UTC)).minusDays(windowDays);
        return priceHistoryRepository
            .findByProductKeyAndRecordedAtAfterOrderByRecordedAtAsc(productKey, cutoff)
            .map(PricePoint::from);
    }

    @Override
    public Flux<StoredAlternative> readAlternatives(String query, int limit) {
        return alternativeRepository.findRecentByQuery(normalize(query), limit)
            .map(StoredAlternative::from);
    }

    private static LocalDateTime toUtc(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static String normalize(String query) {
        return query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
    }
}
