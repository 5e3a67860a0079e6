package com.pricecheck.checker.controller;

import com.pricecheck.checker.cache.TtlLruCache;
import com.pricecheck.checker.resilience.CircuitBreakerRegistry;
import com.pricecheck.checker.resilience.DegradationOrchestrator;
import com.pricecheck.checker.resilience.DegradationSettings;
import com.pricecheck.checker.service.PriceCheckService;
import com.pricecheck.checker.support.MutableClock;
import com.pricecheck.common.model.ProductCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

import static org.mockito.Mockito.*;

class StatusControllerTest {

    private MutableClock clock;
    private DegradationOrchestrator orchestrator;
    private TtlLruCache<List<ProductCandidate>> searchCache;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(3, Duration.ofSeconds(60), clock);
        orchestrator = new DegradationOrchestrator(breakers,
            new TtlLruCache<>("last-known-good", 10, Duration.ofHours(1), clock), DegradationSettings.DEFAULTS, clock);
        searchCache = new TtlLruCache<>("search", 10, Duration.ofMinutes(30), clock);
        PriceCheckService service = mock(PriceCheckService.class);
        when(service.sourceNames()).thenReturn(List.of("woolworths"));
        client = WebTestClient.bindToController(new StatusController(orchestrator, searchCache, service, clock))
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("health lists the registered sources")
    void health() {
        client.get().uri("/api/v1/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("ok")
            .jsonPath("$.sources[0]").isEqualTo("woolworths")
            .jsonPath("$.timestamp").isEqualTo("2024-03-01T10:00:00Z");
    }

    @Test
    @DisplayName("degradation status reflects recent calls")
    void degradation() {
        orchestrator.executeWithDegradation("woolworths", "milk",
            () -> Mono.<String>error(new IllegalStateException("down")), null, null).block();

        client.get().uri("/api/v1/status/degradation")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.totalServices").isEqualTo(1)
            .jsonPath("$.services.woolworths").isEqualTo("UNAVAILABLE")
            .jsonPath("$.circuitBreakers.woolworths.failureCount").isEqualTo(1);
    }

    @Test
    @DisplayName("cache status reports size and hit counts")
    void cacheStatus() {
        searchCache.put("woolworths", "milk", "2000", List.of());
        searchCache.lookup("woolworths", "milk", "2000");
        searchCache.lookup("woolworths", "bread", "2000");

        client.get().uri("/api/v1/status/cache")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.size").isEqualTo(1)
            .jsonPath("$.hits").isEqualTo(1)
            .jsonPath("$.misses").isEqualTo(1);
    }
}
