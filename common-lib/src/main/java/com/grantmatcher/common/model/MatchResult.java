package com.grantmatcher.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * One scored opportunity for a profile. Eligibility fields are copied verbatim from the
 * {@link EligibilityResult} of the same pair; scoring never overrides them.
 */
public record MatchResult(
    @JsonProperty("opportunityId")        String opportunityId,
    @JsonProperty("opportunityName")      String opportunityName,
    @JsonProperty("awardAmount")          double awardAmount,
    @JsonProperty("deadline")             Instant deadline,
    @JsonProperty("semanticSimilarity")   double semanticSimilarity,
    @JsonProperty("compositeScore")       double compositeScore,
    @JsonProperty("breakdown")            ScoreBreakdown breakdown,
    @JsonProperty("meetsAllRequirements") boolean meetsAllRequirements,
    @JsonProperty("unmetRequirements")    List<String> unmetRequirements
) {
    public MatchResult {
        unmetRequirements = unmetRequirements == null ? List.of() : List.copyOf(unmetRequirements);
    }
}
