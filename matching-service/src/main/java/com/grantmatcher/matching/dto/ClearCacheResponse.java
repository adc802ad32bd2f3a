package com.grantmatcher.matching.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ClearCacheResponse(
    @JsonProperty("pattern")      String pattern,
    @JsonProperty("removedLocal") long removedLocal
) {}
