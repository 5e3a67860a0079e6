package com.pricecheck.checker.service;

import com.pricecheck.checker.adapter.SourceAdapter;
import com.pricecheck.checker.adapter.SourceResponse;
import com.pricecheck.checker.cache.CacheLookup;
import com.pricecheck.checker.cache.TtlLruCache;
import com.pricecheck.checker.persistence.PriceHistoryStore;
import com.pricecheck.checker.resilience.DegradationOrchestrator;
import com.pricecheck.checker.resilience.MultiSourceResult;
import com.pricecheck.checker.resilience.SourceCall;
import com.pricecheck.checker.resilience.SourceOutcome;
import com.pricecheck.common.exception.SourceException;
import com.pricecheck.common.matching.ProductMatcher;
import com.pricecheck.common.model.AlternativeProduct;
import com.pricecheck.common.model.CheckItemsResponse;
import com.pricecheck.common.model.ItemResult;
import com.pricecheck.common.model.PotentialSaving;
import com.pricecheck.common.model.ProductCandidate;
import com.pricecheck.common.model.RankedCandidate;
import com.pricecheck.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Checks a list of grocery items against every registered retailer source.
 *
 * <p>Per item:
 * <pre>
 *   cache lookup per source → misses fanned out through the DegradationOrchestrator
 *     → primary successes cached → candidates ranked per source → ItemResult per source
 *     → best match and alternatives handed to the PriceHistoryStore (fire-and-forget)
 * </pre>
 *
 * <p>A failed or circuit-open source contributes an empty candidate list, which surfaces as
 * a no-match {@link ItemResult}; it never fails the check. Items are processed one after
 * another; sources for one item run concurrently. Results keep source registration order.
 */
@Service
public class PriceCheckService {

    private static final Logger log = LoggerFactory.getLogger(PriceCheckService.class);

    /** Best match plus up to seven alternatives. */
    static final int MAX_MATCHES = 8;

    private final List<SourceAdapter> sources;
    private final TtlLruCache<List<ProductCandidate>> searchCache;
    private final DegradationOrchestrator orchestrator;
    private final ProductMatcher matcher;
    private final PriceHistoryStore historyStore;
    private final Clock clock;

    public PriceCheckService(List<SourceAdapter> sources,
                             TtlLruCache<List<ProductCandidate>> searchCache,
                             DegradationOrchestrator orchestrator,
                             ProductMatcher matcher,
                             PriceHistoryStore historyStore,
                             Clock clock) {
        this.sources      = List.copyOf(sources);
        this.searchCache  = searchCache;
        this.orchestrator = orchestrator;
        this.matcher      = matcher;
        this.historyStore = historyStore;
        this.clock        = clock;
    }

    public List<String> sourceNames() {
        return sources.stream().map(SourceAdapter::sourceName).toList();
    }

    public Mono<CheckItemsResponse> checkItems(List<String> items, String location) {
        String traceId = UUID.randomUUID().toString();
        Mono<CheckItemsResponse> pipeline = Mono.deferContextual(ctx -> {
            String tid = TraceContextUtil.getTraceId(ctx);
            TraceContextUtil.withMdc(tid, () -> log.info("CHECK_ITEMS_START items={} location={} sources={} traceId={}",
                items.size(), location, sourceNames(), tid));
            long startedMs = clock.millis();

            return Flux.fromIterable(items)
                .concatMap(item -> checkItem(item, location, tid))
                .flatMapIterable(results -> results)
                .collectList()
                .map(results -> {
                    TraceContextUtil.withMdc(tid, () -> log.info(
                        "CHECK_ITEMS_COMPLETE items={} results={} matched={} latencyMs={} traceId={}",
                        items.size(), results.size(), results.stream().filter(ItemResult::hasMatch).count(),
                        clock.millis() - startedMs, tid));
                    return new CheckItemsResponse(results, location, items.size());
                });
        });
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    // ── per item ─────────────────────────────────────────────────────────────

    private Mono<List<ItemResult>> checkItem(String item, String location, String traceId) {
        Map<String, List<ProductCandidate>> candidatesBySource = new HashMap<>();
        List<SourceCall<List<ProductCandidate>>> misses = new ArrayList<>();

        for (SourceAdapter source : sources) {
            CacheLookup<List<ProductCandidate>> cached = searchCache.lookup(source.sourceName(), item, location);
            if (cached.hit()) {
                List<ProductCandidate> value = cached.value() == null ? List.of() : cached.value();
                log.info("CACHE_HIT source={} query={} location={} results={} traceId={}",
                    source.sourceName(), item, location, value.size(), traceId);
                candidatesBySource.put(source.sourceName(), value);
            } else {
                log.info("CACHE_MISS source={} query={} location={} traceId={}",
                    source.sourceName(), item, location, traceId);
                misses.add(new SourceCall<>(source.sourceName(), item + "@" + location,
                    () -> searchSource(source, item, location), null, null));
            }
        }

        Mono<MultiSourceResult<List<ProductCandidate>>> fetched = misses.isEmpty()
            ? Mono.just(new MultiSourceResult<List<ProductCandidate>>(List.of(), 1.0))
            : orchestrator.executeMultiSourceSearch(misses);

        return fetched.map(multi -> {
            for (SourceOutcome<List<ProductCandidate>> outcome : multi.outcomes()) {
                List<ProductCandidate> candidates = List.of();
                if (outcome.result().success() && outcome.result().data() != null) {
                    candidates = outcome.result().data();
                    if (!outcome.result().fallbackUsed()) {
                        searchCache.put(outcome.sourceName(), item, location, candidates);
                    }
                } else {
                    log.warn("SOURCE_UNAVAILABLE source={} query={} reason={} error={} traceId={}",
                        outcome.sourceName(), item, outcome.result().degradationReason(),
                        outcome.result().error(), traceId);
                }
                candidatesBySource.put(outcome.sourceName(), candidates);
            }

            List<ItemResult> results = new ArrayList<>(sources.size());
            for (SourceAdapter source : sources) {
                List<ProductCandidate> candidates = candidatesBySource.getOrDefault(source.sourceName(), List.of());
                results.add(buildResult(item, source.sourceName(), candidates, traceId));
            }
            return results;
        });
    }

    private Mono<List<ProductCandidate>> searchSource(SourceAdapter source, String item, String location) {
        return source.search(item, location)
            .flatMap(response -> response.success()
                ? Mono.just(response.candidates())
                : Mono.<List<ProductCandidate>>error(new SourceException(source.sourceName(), errorOf(response))));
    }

    private static String errorOf(SourceResponse response) {
        return response.error() == null ? "search failed" : response.error();
    }

    // ── ranking and result assembly ──────────────────────────────────────────

    ItemResult buildResult(String item, String sourceName, List<ProductCandidate> candidates, String traceId) {
        List<RankedCandidate> ranked = matcher.topMatches(item, candidates, MAX_MATCHES);
        if (ranked.isEmpty()) {
            log.info("NO_MATCH source={} query={} candidates={} traceId={}", sourceName, item, candidates.size(), traceId);
            return ItemResult.noMatch(item, sourceName);
        }

        RankedCandidate best = ranked.get(0);
        ProductCandidate winner = best.candidate();
        List<RankedCandidate> runnersUp = ranked.subList(1, ranked.size());

        List<AlternativeProduct> alternatives = runnersUp.stream().map(AlternativeProduct::from).toList();
        List<PotentialSaving> savings = potentialSavings(winner, runnersUp);

        log.info("BEST_MATCH source={} query={} product={} score={} confidence={} alternatives={} traceId={}",
            sourceName, item, winner.name(), best.score().totalScore(), best.score().confidence(),
            alternatives.size(), traceId);

        persist(item, sourceName, winner, runnersUp, alternatives, traceId);

        return new ItemResult(item, sourceName, winner.name(), round(best.score().totalScore(), 2),
            best.score().confidence(), alternatives, winner.onSale(), winner.price(), winner.wasPrice(),
            winner.promoText(), winner.url(), winner.inStock(), savings);
    }

    /** Runners-up cheaper than the winner, with the saving in dollars and percent of the winner's price. */
    static List<PotentialSaving> potentialSavings(ProductCandidate winner, List<RankedCandidate> runnersUp) {
        List<PotentialSaving> savings = new ArrayList<>();
        Double current = winner.price();
        if (current == null || current <= 0) {
            return savings;
        }
        for (RankedCandidate alt : runnersUp) {
            Double altPrice = alt.candidate().price();
            if (altPrice == null || altPrice <= 0) {
                continue;
            }
            double saving = current - altPrice;
            if (saving > 0) {
                savings.add(new PotentialSaving(alt.candidate().name(), round(current, 2), round(altPrice, 2),
                    round(saving, 2), round(saving / current * 100.0, 1)));
            }
        }
        return savings;
    }

    // ── persistence hand-off ─────────────────────────────────────────────────

    private void persist(String item, String sourceName, ProductCandidate winner, List<RankedCandidate> runnersUp,
                         List<AlternativeProduct> alternatives, String traceId) {
        Instant now = clock.instant();
        List<Mono<Void>> writes = new ArrayList<>();
        if (winner.price() != null) {
            writes.add(Mono.defer(() -> historyStore.recordPrice(winner, now)));
        }
        for (RankedCandidate alt : runnersUp) {
            if (alt.candidate().price() != null) {
                writes.add(Mono.defer(() -> historyStore.recordPrice(alt.candidate(), now)));
            }
        }
        if (!alternatives.isEmpty()) {
            writes.add(Mono.defer(() -> historyStore.recordAlternatives(item, sourceName, alternatives, now)));
        }
        if (writes.isEmpty()) {
            return;
        }
        Mono.when(writes)
            .subscribe(
                ignored -> { },
                e -> log.warn("PERSIST_FAILED source={} query={} traceId={} error={}",
                    sourceName, item, traceId, e.getMessage()));
    }

    private static double round(double value, int places) {
        double factor = Math.pow(10, places);
        return Math.round(value * factor) / factor;
    }
}
