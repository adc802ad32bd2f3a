package com.grantmatcher.matching.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * {@link RemoteCacheTier} on Redis. Keys are namespaced with a fixed prefix so that
 * {@link #clear()} and pattern removal never touch keys owned by other applications.
 *
 * <p>Pattern removal uses {@code SCAN ... MATCH}, whose glob dialect is a superset of
 * {@link KeyPattern}; no {@code KEYS} call is ever issued.
 */
public class RedisRemoteCacheTier implements RemoteCacheTier {

    private static final Logger log = LoggerFactory.getLogger(RedisRemoteCacheTier.class);

    private static final long SCAN_BATCH = 500;

    private final ReactiveStringRedisTemplate redisTemplate;
    private final String namespace;

    public RedisRemoteCacheTier(ReactiveStringRedisTemplate redisTemplate, String namespace) {
        this.redisTemplate = redisTemplate;
        this.namespace     = namespace.endsWith(":") ? namespace : namespace + ":";
    }

    @Override
    public Mono<String> get(String key) {
        return redisTemplate.opsForValue().get(namespaced(key));
    }

    @Override
    public Mono<Void> set(String key, String payload, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            return Mono.empty();
        }
        return redisTemplate.opsForValue().set(namespaced(key), payload, ttl).then();
    }

    @Override
    public Mono<Void> remove(String key) {
        return redisTemplate.delete(namespaced(key)).then();
    }

    @Override
    public Mono<Long> removeByPattern(String glob) {
        ScanOptions options = ScanOptions.scanOptions()
            .match(namespaced(glob))
            .count(SCAN_BATCH)
            .build();
        return redisTemplate.scan(options)
            .buffer((int) SCAN_BATCH)
            .concatMap(batch -> redisTemplate.delete(batch.toArray(String[]::new)))
            .reduce(0L, Long::sum)
            .doOnNext(count -> log.debug("[RedisCacheTier] REMOVED pattern={} count={}", glob, count));
    }

    @Override
    public Mono<Void> clear() {
        return removeByPattern("*").then();
    }

    @Override
    public String describe() {
        return "redis(" + namespace + "*)";
    }

    private String namespaced(String key) {
        return namespace + key;
    }
}
