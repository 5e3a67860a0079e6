package com.pricecheck.checker.ratelimit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricecheck.checker.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitWebFilterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RateLimitWebFilter filter;
    private final AtomicInteger chainCalls = new AtomicInteger();
    private final WebFilterChain chain = exchange -> {
        chainCalls.incrementAndGet();
        return Mono.empty();
    };

    @BeforeEach
    void setUp() {
        Map<RateLimitClass, RateLimit> limits = new EnumMap<>(RateLimitClass.class);
        limits.put(RateLimitClass.GLOBAL, RateLimit.of(100, Duration.ofSeconds(60)));
        limits.put(RateLimitClass.CHECK, RateLimit.of(1, Duration.ofSeconds(60)));
        limits.put(RateLimitClass.HEAVY, RateLimit.of(5, Duration.ofSeconds(60)));
        limits.put(RateLimitClass.ADMIN, RateLimit.of(5, Duration.ofSeconds(60)));
        RateLimiter limiter = new RateLimiter(limits, MutableClock.startingAt("2024-03-01T10:00:00Z"));
        filter = new RateLimitWebFilter(limiter, new ClientIdentityResolver(true), objectMapper);
    }

    private MockServerWebExchange post(String path) {
        return MockServerWebExchange.from(MockServerHttpRequest.post(path).header("X-Real-IP", "203.0.113.7"));
    }

    @Test
    @DisplayName("admitted request reaches the chain with rate limit headers")
    void admitted() {
        MockServerWebExchange exchange = post("/api/v1/check");

        filter.filter(exchange, chain).block();

        assertEquals(1, chainCalls.get());
        assertEquals("1", exchange.getResponse().getHeaders().getFirst(RateLimitDecision.HEADER_LIMIT));
        assertEquals("60", exchange.getResponse().getHeaders().getFirst(RateLimitDecision.HEADER_WINDOW));
        assertEquals("0", exchange.getResponse().getHeaders().getFirst(RateLimitDecision.HEADER_REMAINING));
        assertNull(exchange.getResponse().getHeaders().getFirst(RateLimitDecision.HEADER_RETRY_AFTER));
    }

    @Test
    @DisplayName("rejected request answers 429 with a JSON body and never reaches the chain")
    void rejected() throws Exception {
        filter.filter(post("/api/v1/check"), chain).block();
        MockServerWebExchange exchange = post("/api/v1/check");

        filter.filter(exchange, chain).block();

        assertEquals(1, chainCalls.get());
        assertEquals(HttpStatus.TOO_MANY_REQUESTS, exchange.getResponse().getStatusCode());
        assertEquals("60", exchange.getResponse().getHeaders().getFirst(RateLimitDecision.HEADER_RETRY_AFTER));

        JsonNode body = objectMapper.readTree(exchange.getResponse().getBodyAsString().block());
        assertEquals("Rate limit exceeded", body.get("error").asText());
        assertEquals("rate_limit_exceeded", body.get("type").asText());
        assertEquals(60, body.get("retryAfter").asInt());
    }

    @Test
    @DisplayName("other classes keep their own budget after CHECK is exhausted")
    void classesIndependent() {
        filter.filter(post("/api/v1/check"), chain).block();
        filter.filter(post("/api/v1/check"), chain).block();

        MockServerWebExchange health = MockServerWebExchange.from(
            MockServerHttpRequest.get("/api/v1/health").header("X-Real-IP", "203.0.113.7"));
        filter.filter(health, chain).block();

        assertEquals(2, chainCalls.get());
        assertEquals("100", health.getResponse().getHeaders().getFirst(RateLimitDecision.HEADER_LIMIT));
    }

    @ParameterizedTest
    @CsvSource({
        "/api/v1/check,                 CHECK",
        "/api/v1/price-history/abc,     HEAVY",
        "/api/v1/alternatives/milk,     HEAVY",
        "/api/v1/admin/cache/clear,     ADMIN",
        "/api/v1/health,                GLOBAL",
        "/api/v1/checkout,              GLOBAL"
    })
    @DisplayName("paths map to limit classes")
    void classify(String path, RateLimitClass expected) {
        assertEquals(expected, RateLimitWebFilter.classify(path));
    }
}
