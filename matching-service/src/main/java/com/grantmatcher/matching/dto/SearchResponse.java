package com.grantmatcher.matching.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.grantmatcher.common.model.MatchResult;

import java.util.List;

/**
 * One page of ranked matches. {@code totalCount} counts every result that passed the request
 * filters, before pagination.
 */
public record SearchResponse(
    @JsonProperty("matches")    List<MatchResult> matches,
    @JsonProperty("totalCount") int totalCount,
    @JsonProperty("metadata")   SearchMetadata metadata
) {}
