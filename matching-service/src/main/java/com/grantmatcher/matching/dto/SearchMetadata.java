package com.grantmatcher.matching.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code fromCache} is {@code false} only for the request that ran the computation. A request
 * that joined a computation already in progress reports {@code true}, the same way the cache
 * counts it as a hit, while its {@code processingTimeMs} includes the time spent waiting.
 */
public record SearchMetadata(
    @JsonProperty("processingTimeMs")    long processingTimeMs,
    @JsonProperty("fromCache")           boolean fromCache,
    @JsonProperty("searchStrategy")      String searchStrategy,
    @JsonProperty("candidatesRetrieved") int candidatesRetrieved,
    @JsonProperty("eligibleCount")       int eligibleCount
) {}
