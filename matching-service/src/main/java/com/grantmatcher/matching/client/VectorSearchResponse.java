package com.grantmatcher.matching.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.grantmatcher.common.model.Opportunity;

import java.util.List;

/** Wire body returned by {@code POST /profiles/search}. */
public record VectorSearchResponse(
    @JsonProperty("results")      List<Hit> results,
    @JsonProperty("totalResults") int totalResults
) {

    public record Hit(
        @JsonProperty("profileId")  String profileId,
        @JsonProperty("similarity") Double similarity,
        @JsonProperty("profile")    Opportunity profile
    ) {}
}
