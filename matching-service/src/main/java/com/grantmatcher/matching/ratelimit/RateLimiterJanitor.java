package com.grantmatcher.matching.ratelimit;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Periodically drops clients that have been idle longer than the longest rate window, so
 * the per-client map does not grow with every address ever seen.
 */
public class RateLimiterJanitor {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterJanitor.class);

    private final SlidingWindowRateLimiter rateLimiter;
    private final Duration interval;
    private Disposable task;

    public RateLimiterJanitor(SlidingWindowRateLimiter rateLimiter, Duration interval) {
        this.rateLimiter = rateLimiter;
        this.interval    = interval;
    }

    @PostConstruct
    public void start() {
        log.info("[RateLimiter] janitor started. interval={}", interval);
        task = Flux.interval(interval, interval)
            .concatMap(tick -> Mono.fromCallable(rateLimiter::evictIdleClients)
                .onErrorResume(e -> {
                    log.warn("[RateLimiter] CLEANUP_FAILED reason={}", e.getMessage());
                    return Mono.just(0);
                }))
            .subscribe(removed -> log.debug("[RateLimiter] CLEANUP removed={} tracked={}",
                                            removed, rateLimiter.trackedClients()));
    }

    @PreDestroy
    public void stop() {
        if (task != null) {
            task.dispose();
        }
    }
}
