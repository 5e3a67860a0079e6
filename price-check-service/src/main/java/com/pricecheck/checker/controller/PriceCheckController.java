package com.pricecheck.checker.controller;

import com.pricecheck.checker.persistence.PriceHistoryStore;
import com.pricecheck.checker.persistence.PricePoint;
import com.pricecheck.checker.persistence.StoredAlternative;
import com.pricecheck.checker.service.PriceCheckService;
import com.pricecheck.common.model.CheckItemsResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class PriceCheckController {

    private static final Logger log = LoggerFactory.getLogger(PriceCheckController.class);

    static final int MAX_HISTORY_DAYS = 365;
    static final int MAX_ALTERNATIVES = 100;

    private final PriceCheckService priceCheckService;
    private final PriceHistoryStore historyStore;
    private final CheckRequestValidator validator;

    public PriceCheckController(PriceCheckService priceCheckService, PriceHistoryStore historyStore,
                                CheckRequestValidator validator) {
        this.priceCheckService = priceCheckService;
        this.historyStore      = historyStore;
        this.validator         = validator;
    }

    @PostMapping("/check")
    public Mono<ResponseEntity<CheckItemsResponse>> check(@RequestBody CheckItemsRequest request) {
        return Mono.fromCallable(() -> validator.validate(request))
            .flatMap(valid -> {
                log.info("Check request received. items={} postcode={}", valid.items().size(), valid.postcode());
                return priceCheckService.checkItems(valid.items(), valid.postcode());
            })
            .map(ResponseEntity::ok)
            .doOnError(e -> {
                if (!(e instanceof InvalidRequestException)) {
                    log.error("Check endpoint error", e);
                }
            });
    }

    @GetMapping("/price-history/{productKey}")
    public Mono<ResponseEntity<List<PricePoint>>> priceHistory(@PathVariable String productKey,
                                                               @RequestParam(defaultValue = "30") int days) {
        if (days < 1 || days > MAX_HISTORY_DAYS) {
            return Mono.error(new InvalidRequestException("days must be between 1 and " + MAX_HISTORY_DAYS));
        }
        log.info("Price history query received. productKey={} days={}", productKey, days);
        return historyStore.readPriceHistory(productKey, days)
            .collectList()
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Price history endpoint error. productKey={}", productKey, e));
    }

    @GetMapping("/alternatives/{query}")
    public Mono<ResponseEntity<List<StoredAlternative>>> alternatives(@PathVariable String query,
                                                                     @RequestParam(defaultValue = "20") int limit) {
        if (limit < 1 || limit > MAX_ALTERNATIVES) {
            return Mono.error(new InvalidRequestException("limit must be between 1 and " + MAX_ALTERNATIVES));
        }
        log.info("Alternatives query received. query={} limit={}", query, limit);
        return historyStore.readAlternatives(query, limit)
            .collectList()
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Alternatives endpoint error. query={}", query, e));
    }
}
