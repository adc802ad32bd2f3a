package com.grantmatcher.matching.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time snapshot of {@link HybridCacheStore} counters.
 * {@code hitRate} is a percentage in [0, 100].
 */
public record CacheStatistics(
    @JsonProperty("hits")           long hits,
    @JsonProperty("misses")         long misses,
    @JsonProperty("evictions")      long evictions,
    @JsonProperty("currentEntries") long currentEntries,
    @JsonProperty("hitRate")        double hitRate
) {
    public static CacheStatistics of(long hits, long misses, long evictions, long currentEntries) {
        long lookups = hits + misses;
        double hitRate = lookups > 0 ? (double) hits / lookups * 100.0 : 0.0;
        return new CacheStatistics(hits, misses, evictions, currentEntries, hitRate);
    }
}
