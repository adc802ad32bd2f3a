package com.grantmatcher.matching.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.grantmatcher.matching.cache.CacheStatistics;

import java.time.Instant;

public record CacheStatsResponse(
    @JsonProperty("hits")           long hits,
    @JsonProperty("misses")         long misses,
    @JsonProperty("evictions")      long evictions,
    @JsonProperty("currentEntries") long currentEntries,
    @JsonProperty("hitRate")        double hitRate,
    @JsonProperty("timestamp")      Instant timestamp
) {

    public static CacheStatsResponse of(CacheStatistics stats, Instant timestamp) {
        return new CacheStatsResponse(stats.hits(), stats.misses(), stats.evictions(),
            stats.currentEntries(), stats.hitRate(), timestamp);
    }
}
