package com.pricecheck.checker.adapter;

import com.pricecheck.checker.client.OutboundRequest;
import com.pricecheck.checker.client.RequestOutcome;
import com.pricecheck.checker.client.RetryingRequestExecutor;
import com.pricecheck.common.model.ProductCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Searches the Woolworths product search API.
 *
 * <p>One request per search (first page, 36 results, relevance order) through the
 * {@link RetryingRequestExecutor}. When the HTTP path fails and a
 * {@link BrowserSearchFallback} is registered, that fallback is tried before reporting
 * failure. Caching and circuit breaking happen in the calling service.
 */
public class WoolworthsAdapter implements SourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(WoolworthsAdapter.class);

    public static final String SOURCE_NAME = "woolworths";
    static final String SEARCH_PATH = "/apis/ui/Search/products";
    static final int PAGE_SIZE = 36;

    private static final Map<String, String> BROWSER_HEADERS = Map.of(
        "User-Agent", "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Accept", "application/json, text/plain, */*",
        "Accept-Language", "en-AU,en;q=0.9",
        "Referer", "https://www.woolworths.com.au/shop/search/products",
        "Origin", "https://www.woolworths.com.au"
    );

    private final RetryingRequestExecutor executor;
    private final String baseUrl;
    private final BrowserSearchFallback browserFallback;
    private final WoolworthsProductParser parser = new WoolworthsProductParser(SOURCE_NAME);

    /**
     * @param browserFallback may be {@code null}
     */
    public WoolworthsAdapter(RetryingRequestExecutor executor, String baseUrl, BrowserSearchFallback browserFallback) {
        this.executor        = executor;
        this.baseUrl         = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.browserFallback = browserFallback;
    }

    @Override
    public String sourceName() {
        return SOURCE_NAME;
    }

    @Override
    public Mono<SourceResponse> search(String query, String location) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("searchTerm", query);
        params.put("postcode", location);
        params.put("pageNumber", 1);
        params.put("pageSize", PAGE_SIZE);
        params.put("sortType", "Relevance");

        OutboundRequest request = new OutboundRequest(SOURCE_NAME, baseUrl + SEARCH_PATH, params,
            BROWSER_HEADERS, query, location);

        return executor.execute(request)
            .flatMap(outcome -> outcome.succeeded()
                ? Mono.just(toResponse(query, location, outcome))
                : tryBrowserFallback(query, location, outcome.error()));
    }

    private SourceResponse toResponse(String query, String location, RequestOutcome outcome) {
        List<ProductCandidate> candidates = parser.parse(outcome.payload());
        log.info("SOURCE_SEARCH_COMPLETE source={} query={} location={} results={} attempts={}",
            SOURCE_NAME, query, location, candidates.size(), outcome.attempts());
        return SourceResponse.success(SOURCE_NAME, candidates);
    }

    private Mono<SourceResponse> tryBrowserFallback(String query, String location, String error) {
        if (browserFallback == null) {
            return Mono.just(SourceResponse.failure(SOURCE_NAME, error));
        }
        log.info("BROWSER_FALLBACK_ATTEMPT source={} query={} location={} httpError={}",
            SOURCE_NAME, query, location, error);
        return Mono.defer(() -> browserFallback.search(query, location))
            .defaultIfEmpty(List.of())
            .map(candidates -> {
                log.info("BROWSER_FALLBACK_COMPLETE source={} query={} results={}", SOURCE_NAME, query, candidates.size());
                return SourceResponse.fromFallback(SOURCE_NAME, candidates);
            })
            .onErrorResume(e -> {
                log.error("BROWSER_FALLBACK_FAILED source={} query={} error={}", SOURCE_NAME, query, e.getMessage());
                return Mono.just(SourceResponse.failure(SOURCE_NAME, error + "; browser fallback failed: " + e.getMessage()));
            });
    }
}
