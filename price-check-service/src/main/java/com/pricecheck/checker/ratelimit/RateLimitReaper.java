package com.pricecheck.checker.ratelimit;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Periodically forgets rate-limit clients that have gone quiet.
 *
 * <p>Each sweep is a fresh {@code Mono.delay} pipeline that schedules the next one when it
 * finishes, so a failing sweep never stops the loop.
 */
@Component
public class RateLimitReaper {

    private static final Logger log = LoggerFactory.getLogger(RateLimitReaper.class);

    private final RateLimiter rateLimiter;
    private final Duration retention;
    private final Duration interval;

    private volatile Disposable pending;
    private volatile boolean stopped;

    public RateLimitReaper(RateLimiter rateLimiter,
                           @Value("${price-check.rate-limit.client-retention:PT1H}") Duration retention,
                           @Value("${price-check.rate-limit.cleanup-interval:PT5M}") Duration interval) {
        this.rateLimiter = rateLimiter;
        this.retention   = retention;
        this.interval    = interval;
    }

    @PostConstruct
    public void start() {
        log.info("Rate limit reaper started. retentionSeconds={} intervalSeconds={}",
            retention.toSeconds(), interval.toSeconds());
        scheduleNextSweep();
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        Disposable current = pending;
        if (current != null) {
            current.dispose();
        }
    }

    public int sweep() {
        return rateLimiter.cleanupExpiredClients(retention);
    }

    private void scheduleNextSweep() {
        if (stopped) {
            return;
        }
        pending = Mono.delay(interval)
            .map(tick -> sweep())
            .subscribe(
                removed -> {
                    log.debug("RATE_LIMIT_SWEEP removed={} clients={}", removed, rateLimiter.clientCount());
                    scheduleNextSweep();
                },
                err -> {
                    log.error("Rate limit sweep failed, rescheduling", err);
                    scheduleNextSweep();
                }
            );
    }
}
