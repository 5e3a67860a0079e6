package com.pricecheck.checker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pricecheck.checker.cache.TtlLruCache;
import com.pricecheck.checker.client.RetrySettings;
import com.pricecheck.checker.ratelimit.RateLimit;
import com.pricecheck.checker.ratelimit.RateLimitClass;
import com.pricecheck.checker.ratelimit.RateLimiter;
import com.pricecheck.checker.resilience.CircuitBreakerRegistry;
import com.pricecheck.checker.resilience.DegradationOrchestrator;
import com.pricecheck.checker.resilience.DegradationSettings;
import com.pricecheck.common.matching.MatchingThresholds;
import com.pricecheck.common.matching.ProductMatcher;
import com.pricecheck.common.model.ProductCandidate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Composition root for the long-lived shared services. Each is a singleton bean; nothing
 * in the service keeps static mutable state.
 */
@Configuration
public class PriceCheckConfig {

    // ── cache ────────────────────────────────────────────────────────────────
    @Value("${price-check.cache.ttl:PT10M}")
    private Duration cacheTtl;

    @Value("${price-check.cache.max-size:1000}")
    private int cacheMaxSize;

    // ── retry ────────────────────────────────────────────────────────────────
    @Value("${price-check.retry.max-retries:3}")
    private int maxRetries;

    @Value("${price-check.retry.backoff-factor:PT1S}")
    private Duration backoffFactor;

    @Value("${price-check.retry.request-timeout:PT4S}")
    private Duration requestTimeout;

    // ── circuit breaker / degradation ────────────────────────────────────────
    @Value("${price-check.circuit-breaker.failure-threshold:5}")
    private int failureThreshold;

    @Value("${price-check.circuit-breaker.timeout:PT60S}")
    private Duration breakerTimeout;

    @Value("${price-check.degradation.source-timeout:PT15S}")
    private Duration sourceTimeout;

    @Value("${price-check.degradation.freshness:PT1H}")
    private Duration freshness;

    @Value("${price-check.degradation.min-success-rate:0.3}")
    private double minSuccessRate;

    @Value("${price-check.degradation.last-known-good-max-size:1000}")
    private int lastKnownGoodMaxSize;

    // ── rate limits (requests, window, burst) ─────────────────────────────────
    @Value("${price-check.rate-limit.global.requests:100}") private int globalRequests;
    @Value("${price-check.rate-limit.global.window:PT60S}") private Duration globalWindow;
    @Value("${price-check.rate-limit.global.burst:10}")     private int globalBurst;

    @Value("${price-check.rate-limit.check.requests:20}")   private int checkRequests;
    @Value("${price-check.rate-limit.check.window:PT60S}")  private Duration checkWindow;
    @Value("${price-check.rate-limit.check.burst:5}")       private int checkBurst;

    @Value("${price-check.rate-limit.heavy.requests:5}")    private int heavyRequests;
    @Value("${price-check.rate-limit.heavy.window:PT60S}")  private Duration heavyWindow;
    @Value("${price-check.rate-limit.heavy.burst:2}")       private int heavyBurst;

    @Value("${price-check.rate-limit.admin.requests:200}")  private int adminRequests;
    @Value("${price-check.rate-limit.admin.window:PT60S}")  private Duration adminWindow;
    @Value("${price-check.rate-limit.admin.burst:20}")      private int adminBurst;

    // ── matching ─────────────────────────────────────────────────────────────
    @Value("${price-check.matching.min-similarity:0.3}")       private double minSimilarity;
    @Value("${price-check.matching.high-confidence:0.8}")      private double highConfidence;
    @Value("${price-check.matching.medium-confidence:0.6}")    private double mediumConfidence;
    @Value("${price-check.matching.exact-match-bonus:0.2}")    private double exactMatchBonus;
    @Value("${price-check.matching.brand-match-bonus:0.15}")   private double brandMatchBonus;
    @Value("${price-check.matching.size-match-bonus:0.1}")     private double sizeMatchBonus;
    @Value("${price-check.matching.keyword-match-bonus:0.05}") private double keywordMatchBonus;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public TtlLruCache<List<ProductCandidate>> searchCache(Clock clock) {
        return new TtlLruCache<>("search", cacheMaxSize, cacheTtl, clock);
    }

    @Bean
    public RetrySettings retrySettings() {
        return new RetrySettings(maxRetries, backoffFactor, requestTimeout);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(Clock clock) {
        return new CircuitBreakerRegistry(failureThreshold, breakerTimeout, clock);
    }

    @Bean
    public DegradationOrchestrator degradationOrchestrator(CircuitBreakerRegistry circuitBreakerRegistry, Clock clock) {
        DegradationSettings settings = new DegradationSettings(sourceTimeout, freshness, minSuccessRate);
        TtlLruCache<Object> lastKnownGood = new TtlLruCache<>("last-known-good", lastKnownGoodMaxSize, freshness, clock);
        return new DegradationOrchestrator(circuitBreakerRegistry, lastKnownGood, settings, clock);
    }

    @Bean
    public RateLimiter rateLimiter(Clock clock) {
        Map<RateLimitClass, RateLimit> limits = new EnumMap<>(RateLimitClass.class);
        limits.put(RateLimitClass.GLOBAL, new RateLimit(globalRequests, globalWindow, globalBurst));
        limits.put(RateLimitClass.CHECK,  new RateLimit(checkRequests,  checkWindow,  checkBurst));
        limits.put(RateLimitClass.HEAVY,  new RateLimit(heavyRequests,  heavyWindow,  heavyBurst));
        limits.put(RateLimitClass.ADMIN,  new RateLimit(adminRequests,  adminWindow,  adminBurst));
        return new RateLimiter(limits, clock);
    }

    @Bean
    public ProductMatcher productMatcher() {
        return new ProductMatcher(new MatchingThresholds(minSimilarity, highConfidence, mediumConfidence,
            exactMatchBonus, brandMatchBonus, sizeMatchBonus, keywordMatchBonus));
    }
}
