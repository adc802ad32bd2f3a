package com.grantmatcher.matching.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.grantmatcher.common.model.MatchResult;

import java.util.List;

/** Cached outcome of one resolved search: the requested page plus its counts. */
public record RankedMatches(
    @JsonProperty("matches")             List<MatchResult> matches,
    @JsonProperty("totalCount")          int totalCount,
    @JsonProperty("candidatesRetrieved") int candidatesRetrieved,
    @JsonProperty("eligibleCount")       int eligibleCount,
    @JsonProperty("searchStrategy")      String searchStrategy
) {
    public RankedMatches {
        matches = matches == null ? List.of() : List.copyOf(matches);
    }
}
