package com.pricecheck.checker.ratelimit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Admits or rejects every inbound request before it reaches a controller.
 *
 * <p>Path to limit class: {@code /api/v1/check} is CHECK, price history and stored
 * alternatives are HEAVY, {@code /api/v1/admin/**} is ADMIN, everything else GLOBAL.
 * Rejections answer 429 with a JSON body and {@code Retry-After}; admitted responses carry
 * the {@code X-RateLimit-*} headers.
 */
@Component
public class RateLimitWebFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitWebFilter.class);

    private final RateLimiter rateLimiter;
    private final ClientIdentityResolver identityResolver;
    private final ObjectMapper objectMapper;

    public RateLimitWebFilter(RateLimiter rateLimiter, ClientIdentityResolver identityResolver,
                              ObjectMapper objectMapper) {
        this.rateLimiter      = rateLimiter;
        this.identityResolver = identityResolver;
        this.objectMapper     = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        RateLimitClass limitClass = classify(path);
        String clientId = identityResolver.resolve(exchange.getRequest());

        RateLimitDecision decision = rateLimiter.checkRateLimit(clientId, limitClass);
        ServerHttpResponse response = exchange.getResponse();
        decision.headers().forEach(response.getHeaders()::set);

        if (decision.allowed()) {
            return chain.filter(exchange);
        }

        log.info("REQUEST_REJECTED client={} class={} path={} retryAfterSeconds={}",
            clientId, limitClass, path, decision.retryAfterSeconds());
        response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer body = response.bufferFactory().wrap(rejectionBody(decision));
        return response.writeWith(Mono.just(body));
    }

    static RateLimitClass classify(String path) {
        if (path.equals("/api/v1/check") || path.startsWith("/api/v1/check/")) {
            return RateLimitClass.CHECK;
        }
        if (path.startsWith("/api/v1/price-history/") || path.startsWith("/api/v1/alternatives/")) {
            return RateLimitClass.HEAVY;
        }
        if (path.startsWith("/api/v1/admin/")) {
            return RateLimitClass.ADMIN;
        }
        return RateLimitClass.GLOBAL;
    }

    private byte[] rejectionBody(RateLimitDecision decision) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Rate limit exceeded");
        body.put("message", "Too many requests. Try again in " + decision.retryAfterSeconds() + " seconds.");
        body.put("type", "rate_limit_exceeded");
        body.put("retryAfter", decision.retryAfterSeconds());
        try {
            return objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize rate limit body", e);
            return "{\"error\":\"Rate limit exceeded\",\"type\":\"rate_limit_exceeded\"}"
                .getBytes(StandardCharsets.UTF_8);
        }
    }
}
