package com.grantmatcher.matching.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.grantmatcher.matching.cache.HybridCacheStore;
import com.grantmatcher.matching.cache.RedisRemoteCacheTier;
import com.grantmatcher.matching.cache.RemoteCacheTier;
import com.grantmatcher.matching.ratelimit.RateLimitWebFilter;
import com.grantmatcher.matching.ratelimit.RateLimiterJanitor;
import com.grantmatcher.matching.ratelimit.RateWindow;
import com.grantmatcher.matching.ratelimit.SlidingWindowRateLimiter;
import com.grantmatcher.matching.web.TraceIdWebFilter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.List;

@Configuration
public class MatchingConfig {

    static final String API_KEY_HEADER = "Ocp-Apim-Subscription-Key";

    @Value("${services.entity-matching.base-url}")
    private String entityMatchingUrl;

    @Value("${services.entity-matching.api-key:}")
    private String entityMatchingApiKey;

    @Value("${services.profile-store.base-url}")
    private String profileStoreUrl;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    // ── collaborators ───────────────────────────────────────────────────────

    @Bean
    public WebClient entityMatchingWebClient(WebClient.Builder builder) {
        return builder.baseUrl(entityMatchingUrl)
            .defaultHeader(API_KEY_HEADER, entityMatchingApiKey)
            .build();
    }

    @Bean
    public WebClient profileStoreWebClient(WebClient.Builder builder) {
        return builder.baseUrl(profileStoreUrl).build();
    }

    // ── cache ───────────────────────────────────────────────────────────────

    @Bean
    @ConditionalOnProperty(name = "matching.cache.remote-enabled", havingValue = "true")
    public RemoteCacheTier redisRemoteCacheTier(ReactiveStringRedisTemplate redisTemplate,
                                                MatchingProperties properties) {
        return new RedisRemoteCacheTier(redisTemplate, properties.getCache().getRemoteNamespace());
    }

    @Bean
    public HybridCacheStore hybridCacheStore(ObjectMapper objectMapper,
                                             Clock clock,
                                             MatchingProperties properties,
                                             ObjectProvider<RemoteCacheTier> remoteTier) {
        return new HybridCacheStore(objectMapper, clock, properties.getCache(), remoteTier.getIfAvailable());
    }

    // ── web boundary ────────────────────────────────────────────────────────

    @Bean
    public TraceIdWebFilter traceIdWebFilter() {
        return new TraceIdWebFilter();
    }

    @Bean
    public SlidingWindowRateLimiter slidingWindowRateLimiter(MatchingProperties properties, Clock clock) {
        List<RateWindow> windows = properties.getRateLimit().getWindows().stream()
            .map(w -> new RateWindow(w.getLength(), w.getMaxRequests()))
            .toList();
        return new SlidingWindowRateLimiter(windows, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "matching.rate-limit.enabled", havingValue = "true", matchIfMissing = true)
    public RateLimitWebFilter rateLimitWebFilter(SlidingWindowRateLimiter rateLimiter, ObjectMapper objectMapper) {
        return new RateLimitWebFilter(rateLimiter, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "matching.rate-limit.enabled", havingValue = "true", matchIfMissing = true)
    public RateLimiterJanitor rateLimiterJanitor(SlidingWindowRateLimiter rateLimiter, MatchingProperties properties) {
        return new RateLimiterJanitor(rateLimiter, properties.getRateLimit().getCleanupInterval());
    }
}
