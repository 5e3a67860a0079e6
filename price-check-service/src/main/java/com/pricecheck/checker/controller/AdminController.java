package com.pricecheck.checker.controller;

import com.pricecheck.checker.cache.TtlLruCache;
import com.pricecheck.checker.ratelimit.ClientStats;
import com.pricecheck.checker.ratelimit.RateLimiter;
import com.pricecheck.common.model.ProductCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator endpoints. Every call must carry {@value #ADMIN_TOKEN_HEADER} equal to
 * {@code price-check.admin.token}; with no token configured the endpoints are closed.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";
    static final long MAX_BLOCK_SECONDS = 86_400;

    private final RateLimiter rateLimiter;
    private final TtlLruCache<List<ProductCandidate>> searchCache;
    private final String adminToken;

    public AdminController(RateLimiter rateLimiter,
                           TtlLruCache<List<ProductCandidate>> searchCache,
                           @Value("${price-check.admin.token:}") String adminToken) {
        this.rateLimiter = rateLimiter;
        this.searchCache = searchCache;
        this.adminToken  = adminToken;
    }

    @PostMapping("/clients/{clientId}/block")
    public Mono<ResponseEntity<Map<String, Object>>> block(@RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String token,
                                                           @PathVariable String clientId,
                                                           @RequestParam(defaultValue = "300") long seconds) {
        return authorized(token).then(Mono.fromCallable(() -> {
            if (seconds < 1 || seconds > MAX_BLOCK_SECONDS) {
                throw new InvalidRequestException("seconds must be between 1 and " + MAX_BLOCK_SECONDS);
            }
            rateLimiter.blockClient(clientId, Duration.ofSeconds(seconds));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("clientId", clientId);
            body.put("blocked", true);
            body.put("seconds", seconds);
            return ResponseEntity.ok(body);
        }));
    }

    @DeleteMapping("/clients/{clientId}/block")
    public Mono<ResponseEntity<Map<String, Object>>> unblock(@RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String token,
                                                             @PathVariable String clientId) {
        return authorized(token).then(Mono.fromCallable(() -> {
            boolean wasBlocked = rateLimiter.unblockClient(clientId);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("clientId", clientId);
            body.put("wasBlocked", wasBlocked);
            return ResponseEntity.ok(body);
        }));
    }

    @GetMapping("/clients/{clientId}")
    public Mono<ResponseEntity<ClientStats>> client(@RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String token,
                                                    @PathVariable String clientId) {
        return authorized(token).then(Mono.fromCallable(() -> rateLimiter.clientStats(clientId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build())));
    }

    @PostMapping("/cache/clear")
    public Mono<ResponseEntity<Map<String, Object>>> clearCache(@RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String token) {
        return authorized(token).then(Mono.fromCallable(() -> {
            int cleared = searchCache.size();
            searchCache.clear();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("cleared", cleared);
            return ResponseEntity.ok(body);
        }));
    }

    private Mono<Void> authorized(String token) {
        if (adminToken == null || adminToken.isBlank()) {
            log.warn("ADMIN_DENIED reason=no_token_configured");
            return Mono.error(new AdminAccessDeniedException("Admin endpoints are disabled"));
        }
        if (token == null || !MessageDigest.isEqual(
                token.getBytes(StandardCharsets.UTF_8), adminToken.getBytes(StandardCharsets.UTF_8))) {
            log.warn("ADMIN_DENIED reason=bad_token");
            return Mono.error(new AdminAccessDeniedException("Invalid admin token"));
        }
        return Mono.empty();
    }
}
