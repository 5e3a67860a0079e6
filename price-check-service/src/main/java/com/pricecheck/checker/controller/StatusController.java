package com.pricecheck.checker.controller;

import com.pricecheck.checker.cache.CacheStats;
import com.pricecheck.checker.cache.TtlLruCache;
import com.pricecheck.checker.resilience.DegradationOrchestrator;
import com.pricecheck.checker.resilience.DegradationStatus;
import com.pricecheck.checker.service.PriceCheckService;
import com.pricecheck.common.model.ProductCandidate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
public class StatusController {

    private final DegradationOrchestrator orchestrator;
    private final TtlLruCache<List<ProductCandidate>> searchCache;
    private final PriceCheckService priceCheckService;
    private final Clock clock;

    public StatusController(DegradationOrchestrator orchestrator, TtlLruCache<List<ProductCandidate>> searchCache,
                            PriceCheckService priceCheckService, Clock clock) {
        this.orchestrator      = orchestrator;
        this.searchCache       = searchCache;
        this.priceCheckService = priceCheckService;
        this.clock             = clock;
    }

    @GetMapping("/status/degradation")
    public Mono<ResponseEntity<DegradationStatus>> degradation() {
        return Mono.fromSupplier(orchestrator::statusSummary).map(ResponseEntity::ok);
    }

    @GetMapping("/status/cache")
    public Mono<ResponseEntity<CacheStats>> cache() {
        return Mono.fromSupplier(searchCache::stats).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("sources", priceCheckService.sourceNames());
        body.put("timestamp", clock.instant().toString());
        return Mono.just(ResponseEntity.ok(body));
    }
}
