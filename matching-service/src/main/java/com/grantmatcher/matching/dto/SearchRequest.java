package com.grantmatcher.matching.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Body of {@code POST /api/matches/search}. Everything except {@code profileId} is optional;
 * absent pagination and threshold fields take the configured defaults.
 */
public record SearchRequest(
    @JsonProperty("profileId")      String profileId,
    @JsonProperty("minAwardAmount") Double minAwardAmount,
    @JsonProperty("maxAwardAmount") Double maxAwardAmount,
    @JsonProperty("deadlineAfter")  Instant deadlineAfter,
    @JsonProperty("deadlineBefore") Instant deadlineBefore,
    @JsonProperty("requiresEssay")  Boolean requiresEssay,
    @JsonProperty("eligibleOnly")   Boolean eligibleOnly,
    @JsonProperty("limit")          Integer limit,
    @JsonProperty("offset")         Integer offset,
    @JsonProperty("minSimilarity")  Double minSimilarity
) {

    public static SearchRequest forProfile(String profileId) {
        return new SearchRequest(profileId, null, null, null, null, null, null, null, null, null);
    }
}
