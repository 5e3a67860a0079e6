package com.pricecheck.checker.service;

import com.pricecheck.checker.adapter.SourceAdapter;
import com.pricecheck.checker.adapter.SourceResponse;
import com.pricecheck.checker.cache.TtlLruCache;
import com.pricecheck.checker.persistence.PriceHistoryStore;
import com.pricecheck.checker.resilience.CircuitBreakerRegistry;
import com.pricecheck.checker.resilience.CircuitState;
import com.pricecheck.checker.resilience.DegradationOrchestrator;
import com.pricecheck.checker.resilience.DegradationSettings;
import com.pricecheck.checker.support.MutableClock;
import com.pricecheck.common.matching.ProductMatcher;
import com.pricecheck.common.model.CheckItemsResponse;
import com.pricecheck.common.model.ItemResult;
import com.pricecheck.common.model.MatchScore;
import com.pricecheck.common.model.PotentialSaving;
import com.pricecheck.common.model.ProductCandidate;
import com.pricecheck.common.model.RankedCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PriceCheckServiceTest {

    private static final ProductCandidate MILK = new ProductCandidate("Milk 2L", 3.10, 3.60, false, null,
        "https://shop.example/milk", true, "alpha", "A:1");

    private MutableClock clock;
    private CircuitBreakerRegistry breakers;
    private TtlLruCache<List<ProductCandidate>> searchCache;
    private PriceHistoryStore historyStore;

    private FakeSource alpha;
    private FakeSource slow;
    private FakeSource broken;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        breakers = new CircuitBreakerRegistry(3, Duration.ofSeconds(60), clock);
        searchCache = new TtlLruCache<>("search", 100, Duration.ofMinutes(30), clock);
        historyStore = mock(PriceHistoryStore.class);
        when(historyStore.recordPrice(any(), any())).thenReturn(Mono.empty());
        when(historyStore.recordAlternatives(anyString(), anyString(), anyList(), any())).thenReturn(Mono.empty());

        alpha = new FakeSource("alpha", () -> Mono.just(SourceResponse.success("alpha", List.of(MILK))));
        slow = new FakeSource("slow", Mono::never);
        broken = new FakeSource("broken", () -> Mono.just(SourceResponse.success("broken", List.of(MILK))));
    }

    private PriceCheckService service(SourceAdapter... sources) {
        DegradationSettings settings = new DegradationSettings(Duration.ofMillis(200), Duration.ofHours(1), 0.3);
        DegradationOrchestrator orchestrator = new DegradationOrchestrator(breakers,
            new TtlLruCache<>("last-known-good", 100, settings.freshness(), clock), settings, clock);
        return new PriceCheckService(List.of(sources), searchCache, orchestrator, new ProductMatcher(),
            historyStore, clock);
    }

    private void openCircuit(String name) {
        for (int i = 0; i < 3; i++) {
            breakers.get(name).recordFailure();
        }
        assertEquals(CircuitState.OPEN, breakers.get(name).state());
    }

    @Nested
    @DisplayName("checkItems()")
    class CheckItemsTests {

        @Test
        @DisplayName("one healthy source, one timing out, one circuit-open: results come from the healthy one")
        void degradedSourcesDoNotFailTheCheck() {
            openCircuit("broken");
            PriceCheckService service = service(alpha, slow, broken);

            CheckItemsResponse response = service.checkItems(List.of("milk 2l"), "2000").block(Duration.ofSeconds(5));

            assertNotNull(response);
            assertEquals(1, response.itemsChecked());
            assertEquals("2000", response.location());
            assertEquals(List.of("alpha", "slow", "broken"),
                response.results().stream().map(ItemResult::source).toList());

            ItemResult fromAlpha = response.results().get(0);
            assertTrue(fromAlpha.hasMatch());
            assertEquals("Milk 2L", fromAlpha.bestMatch());
            assertEquals(3.10, fromAlpha.price());
            assertTrue(fromAlpha.onSale());

            assertFalse(response.results().get(1).hasMatch());
            assertFalse(response.results().get(2).hasMatch());
            assertEquals(0, broken.calls.get());
        }

        @Test
        @DisplayName("items are answered in input order, one result per source each")
        void itemOrder() {
            PriceCheckService service = service(alpha);

            CheckItemsResponse response = service.checkItems(List.of("milk 2l", "bread"), "2000")
                .block(Duration.ofSeconds(5));

            assertEquals(List.of("milk 2l", "bread"), response.results().stream().map(ItemResult::input).toList());
        }

        @Test
        @DisplayName("successful searches are cached and served without calling the source again")
        void successCached() {
            PriceCheckService service = service(alpha);

            service.checkItems(List.of("milk 2l"), "2000").block(Duration.ofSeconds(5));
            CheckItemsResponse second = service.checkItems(List.of("milk 2l"), "2000").block(Duration.ofSeconds(5));

            assertEquals(1, alpha.calls.get());
            assertTrue(second.results().get(0).hasMatch());
            assertTrue(searchCache.lookup("alpha", "milk 2l", "2000").hit());
        }

        @Test
        @DisplayName("cache is keyed by location")
        void cachePerLocation() {
            PriceCheckService service = service(alpha);

            service.checkItems(List.of("milk 2l"), "2000").block(Duration.ofSeconds(5));
            service.checkItems(List.of("milk 2l"), "3000").block(Duration.ofSeconds(5));

            assertEquals(2, alpha.calls.get());
        }

        @Test
        @DisplayName("failed searches are not cached")
        void failureNotCached() {
            FakeSource failing = new FakeSource("failing",
                () -> Mono.just(SourceResponse.failure("failing", "HTTP 503")));
            PriceCheckService service = service(failing);

            service.checkItems(List.of("milk 2l"), "2000").block(Duration.ofSeconds(5));
            service.checkItems(List.of("milk 2l"), "2000").block(Duration.ofSeconds(5));

            assertEquals(2, failing.calls.get());
            assertFalse(searchCache.lookup("failing", "milk 2l", "2000").hit());
        }

        @Test
        @DisplayName("best match price is handed to the history store")
        void priceRecorded() {
            PriceCheckService service = service(alpha);

            service.checkItems(List.of("milk 2l"), "2000").block(Duration.ofSeconds(5));

            verify(historyStore, timeout(1000)).recordPrice(eq(MILK), any());
        }

        @Test
        @DisplayName("history store failure does not fail the check")
        void persistenceFailureIgnored() {
            when(historyStore.recordPrice(any(), any())).thenReturn(Mono.error(new IllegalStateException("db down")));
            PriceCheckService service = service(alpha);

            CheckItemsResponse response = service.checkItems(List.of("milk 2l"), "2000").block(Duration.ofSeconds(5));

            assertTrue(response.results().get(0).hasMatch());
        }

        @Test
        @DisplayName("no candidates → no-match result, nothing persisted")
        void noCandidates() {
            FakeSource empty = new FakeSource("empty", () -> Mono.just(SourceResponse.success("empty", List.of())));
            PriceCheckService service = service(empty);

            CheckItemsResponse response = service.checkItems(List.of("milk 2l"), "2000").block(Duration.ofSeconds(5));

            assertFalse(response.results().get(0).hasMatch());
            verify(historyStore, never()).recordPrice(any(), any());
        }
    }

    @Nested
    @DisplayName("potentialSavings()")
    class SavingsTests {

        private RankedCandidate ranked(String name, Double price) {
            return new RankedCandidate(ProductCandidate.of(name, price, "alpha"), MatchScore.NONE);
        }

        @Test
        @DisplayName("lists only cheaper runners-up, rounded")
        void cheaperOnly() {
            ProductCandidate winner = ProductCandidate.of("Milk 2L", 4.00, "alpha");

            List<PotentialSaving> savings = PriceCheckService.potentialSavings(winner, List.of(
                ranked("Home brand milk 2L", 3.10),
                ranked("Organic milk 2L", 5.50),
                ranked("Unpriced milk", null)));

            assertEquals(1, savings.size());
            PotentialSaving saving = savings.get(0);
            assertEquals("Home brand milk 2L", saving.alternative());
            assertEquals(0.90, saving.savings(), 1e-9);
            assertEquals(22.5, saving.percentage(), 1e-9);
        }

        @Test
        @DisplayName("winner without a price has no savings")
        void unpricedWinner() {
            ProductCandidate winner = ProductCandidate.of("Milk 2L", null, "alpha");

            assertTrue(PriceCheckService.potentialSavings(winner, List.of(ranked("Other", 1.0))).isEmpty());
        }
    }

    private static final class FakeSource implements SourceAdapter {

        private final String name;
        private final Supplier<Mono<SourceResponse>> behaviour;
        private final AtomicInteger calls = new AtomicInteger();

        private FakeSource(String name, Supplier<Mono<SourceResponse>> behaviour) {
            this.name = name;
            this.behaviour = behaviour;
        }

        @Override
        public String sourceName() {
            return name;
        }

        @Override
        public Mono<SourceResponse> search(String query, String location) {
            calls.incrementAndGet();
            return behaviour.get();
        }
    }
}
