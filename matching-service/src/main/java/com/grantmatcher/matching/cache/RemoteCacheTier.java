package com.grantmatcher.matching.cache;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Shared cache tier used for consistency across service instances.
 *
 * <p>Implementations may fail freely: {@link HybridCacheStore} treats every error or timeout
 * as "remote tier unavailable" and carries on with the local tier alone.
 */
public interface RemoteCacheTier {

    /** Emits the stored payload, or completes empty when the key is absent. */
    Mono<String> get(String key);

    Mono<Void> set(String key, String payload, Duration ttl);

    Mono<Void> remove(String key);

    /** @return number of keys removed */
    Mono<Long> removeByPattern(String glob);

    Mono<Void> clear();

    /** Short label for logs and the health endpoint. */
    String describe();
}
