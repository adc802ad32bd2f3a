package com.grantmatcher.matching.controller;

import com.grantmatcher.common.exception.MatchingException;
import com.grantmatcher.matching.cache.HybridCacheStore;
import com.grantmatcher.matching.config.MatchingProperties;
import com.grantmatcher.matching.dto.CacheStatsResponse;
import com.grantmatcher.matching.dto.ClearCacheResponse;
import com.grantmatcher.matching.dto.HealthResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operational endpoints: cache statistics, cache clearing and a liveness probe. The probe is
 * exempt from rate limiting.
 */
@RestController
@RequestMapping("/api/diagnostics")
public class DiagnosticsController {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsController.class);

    private final HybridCacheStore cacheStore;
    private final MatchingProperties properties;
    private final Clock clock;

    @Value("${spring.application.version:1.0.0}")
    private String version = "1.0.0";

    public DiagnosticsController(HybridCacheStore cacheStore, MatchingProperties properties, Clock clock) {
        this.cacheStore = cacheStore;
        this.properties = properties;
        this.clock      = clock;
    }

    @GetMapping("/cache-stats")
    public ResponseEntity<CacheStatsResponse> cacheStats() {
        return ResponseEntity.ok(CacheStatsResponse.of(cacheStore.statistics(), clock.instant()));
    }

    /** {@code *} (the default) clears everything; any other value is a key glob. */
    @PostMapping("/clear-cache")
    public Mono<ResponseEntity<ClearCacheResponse>> clearCache(
            @RequestParam(value = "pattern", defaultValue = "*") String pattern) {
        if (pattern.isBlank()) {
            return Mono.error(MatchingException.validation("pattern must not be blank"));
        }
        if ("*".equals(pattern)) {
            long before = cacheStore.statistics().currentEntries();
            return cacheStore.clear()
                .then(Mono.fromSupplier(() -> ResponseEntity.ok(new ClearCacheResponse(pattern, before))));
        }
        log.info("[Diagnostics] CLEAR_CACHE pattern={}", pattern);
        return cacheStore.removeByPattern(pattern)
            .map(removed -> ResponseEntity.ok(new ClearCacheResponse(pattern, removed)));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        Map<String, Boolean> features = new LinkedHashMap<>();
        features.put("remoteCache", cacheStore.remoteTierEnabled());
        features.put("rateLimiting", properties.getRateLimit().isEnabled());
        return ResponseEntity.ok(new HealthResponse("Healthy", version, features));
    }
}
