package com.pricecheck.checker.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Issues one logical outbound GET with bounded retries and exponential backoff.
 *
 * <p><strong>Classification:</strong>
 * <ul>
 *   <li>200 → body parsed as JSON; a parse failure is terminal and not retried.</li>
 *   <li>429, 500, 502, 503, 504 → retryable until {@code maxRetries} attempts are used.</li>
 *   <li>any other status → terminal immediately.</li>
 *   <li>timeouts and network errors → retryable on the same schedule.</li>
 * </ul>
 *
 * <p>The wait after failed attempt {@code n} (0-based) is {@code 2^n * backoffFactor}, taken
 * with {@code Mono.delay} so no thread blocks. The returned {@code Mono} never errors: every
 * failure, including unexpected exceptions, resolves to a failed {@link RequestOutcome} so
 * the circuit breaker and degradation layers above treat all source failures alike.
 *
 * <p>Each attempt is logged and handed to registered {@link RetryAttempt} listeners.
 */
public class RetryingRequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryingRequestExecutor.class);

    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);
    private static final int HTTP_OK = 200;
    private static final int LOGGED_BODY_CHARS = 200;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RetrySettings settings;
    private final List<Consumer<RetryAttempt>> listeners = new CopyOnWriteArrayList<>();

    public RetryingRequestExecutor(WebClient webClient, ObjectMapper objectMapper, RetrySettings settings) {
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
        this.settings     = settings;
    }

    public RetrySettings settings() {
        return settings;
    }

    public void addAttemptListener(Consumer<RetryAttempt> listener) {
        listeners.add(listener);
    }

    public Mono<RequestOutcome> execute(OutboundRequest request) {
        return attempt(request, 0)
            .onErrorResume(e -> {
                log.error("HTTP_UNEXPECTED source={} query={} location={} url={}",
                    request.source(), request.query(), request.location(), request.url(), e);
                return Mono.just(RequestOutcome.failure(AttemptStatus.TERMINAL_FAILURE, null, 0,
                    "unexpected: " + e.getMessage()));
            });
    }

    private Mono<RequestOutcome> attempt(OutboundRequest request, int index) {
        return Mono.defer(() -> {
            long startedNanos = System.nanoTime();
            return send(request)
                .timeout(settings.requestTimeout())
                .map(this::classifyResponse)
                .onErrorResume(e -> Mono.just(classifyError(e)))
                .flatMap(result -> {
                    Duration latency = Duration.ofNanos(System.nanoTime() - startedNanos);
                    boolean retry = result.status().retryable() && index + 1 < settings.maxRetries();
                    Duration delay = retry ? settings.backoffAfter(index) : Duration.ZERO;

                    report(request, new RetryAttempt(request.source(), index + 1, latency,
                        result.status(), result.httpStatus(), delay), result.error());

                    if (retry) {
                        return Mono.delay(delay).then(attempt(request, index + 1));
                    }
                    return Mono.just(toOutcome(result, index + 1));
                });
        });
    }

    private Mono<RawResponse> send(OutboundRequest request) {
        return webClient.get()
            .uri(buildUri(request))
            .headers(h -> request.headers().forEach(h::set))
            .exchangeToMono(response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new RawResponse(response.statusCode().value(), body)));
    }

    private static URI buildUri(OutboundRequest request) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(request.url());
        if (request.queryParams() != null) {
            request.queryParams().forEach(builder::queryParam);
        }
        return builder.build().encode().toUri();
    }

    // ── classification ───────────────────────────────────────────────────────

    private AttemptResult classifyResponse(RawResponse response) {
        int status = response.status();
        if (status == HTTP_OK) {
            try {
                JsonNode payload = objectMapper.readTree(response.body());
                if (payload == null || payload.isMissingNode()) {
                    return new AttemptResult(AttemptStatus.TERMINAL_FAILURE, status, null, "parse failure: empty body");
                }
                return new AttemptResult(AttemptStatus.SUCCESS, status, payload, null);
            } catch (JsonProcessingException e) {
                return new AttemptResult(AttemptStatus.TERMINAL_FAILURE, status, null,
                    "parse failure: " + e.getOriginalMessage());
            }
        }
        if (RETRYABLE_STATUSES.contains(status)) {
            return new AttemptResult(AttemptStatus.RETRYABLE_FAILURE, status, null, "retryable status " + status);
        }
        return new AttemptResult(AttemptStatus.TERMINAL_FAILURE, status, null,
            "status " + status + " body=" + abbreviate(response.body()));
    }

    private static AttemptResult classifyError(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof io.netty.handler.timeout.TimeoutException) {
                return new AttemptResult(AttemptStatus.TIMEOUT, null, null, "timeout: " + error.getMessage());
            }
        }
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof WebClientRequestException || t instanceof IOException) {
                return new AttemptResult(AttemptStatus.NETWORK_ERROR, null, null, "network: " + error.getMessage());
            }
        }
        return new AttemptResult(AttemptStatus.TERMINAL_FAILURE, null, null, "unexpected: " + error.getMessage());
    }

    private RequestOutcome toOutcome(AttemptResult result, int attempts) {
        if (result.status() == AttemptStatus.SUCCESS) {
            return RequestOutcome.success(result.payload(), result.httpStatus(), attempts);
        }
        String error = result.status().retryable()
            ? "retries exhausted after " + attempts + " attempts: " + result.error()
            : result.error();
        return RequestOutcome.failure(result.status(), result.httpStatus(), attempts, error);
    }

    // ── observability ────────────────────────────────────────────────────────

    private void report(OutboundRequest request, RetryAttempt attempt, String error) {
        long latencyMs = attempt.latency().toMillis();
        switch (attempt.status()) {
            case SUCCESS -> log.info(
                "HTTP_ATTEMPT source={} query={} location={} status={} attempt={} latencyMs={}",
                request.source(), request.query(), request.location(),
                attempt.httpStatus(), attempt.attempt(), latencyMs);
            case RETRYABLE_FAILURE, TIMEOUT, NETWORK_ERROR -> {
                if (attempt.retryDelay().isZero()) {
                    log.error("HTTP_ATTEMPT source={} query={} location={} outcome={} status={} attempt={} latencyMs={} maxRetriesReached=true error={}",
                        request.source(), request.query(), request.location(), attempt.status(),
                        attempt.httpStatus(), attempt.attempt(), latencyMs, error);
                } else {
                    log.warn("HTTP_ATTEMPT source={} query={} location={} outcome={} status={} attempt={} latencyMs={} retryDelayMs={} error={}",
                        request.source(), request.query(), request.location(), attempt.status(),
                        attempt.httpStatus(), attempt.attempt(), latencyMs, attempt.retryDelay().toMillis(), error);
                }
            }
            case TERMINAL_FAILURE -> log.error(
                "HTTP_ATTEMPT source={} query={} location={} outcome={} status={} attempt={} latencyMs={} retryable=false error={}",
                request.source(), request.query(), request.location(), attempt.status(),
                attempt.httpStatus(), attempt.attempt(), latencyMs, error);
        }
        for (Consumer<RetryAttempt> listener : listeners) {
            listener.accept(attempt);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= LOGGED_BODY_CHARS ? body : body.substring(0, LOGGED_BODY_CHARS);
    }

    private record RawResponse(int status, String body) {}

    private record AttemptResult(AttemptStatus status, Integer httpStatus, JsonNode payload, String error) {}
}
