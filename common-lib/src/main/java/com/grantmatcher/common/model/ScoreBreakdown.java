package com.grantmatcher.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Weighted contribution of each scoring component. The composite score is
 * {@code semantic + award + complexity + deadlineProximity}.
 */
public record ScoreBreakdown(
    @JsonProperty("semantic")          double semantic,
    @JsonProperty("award")             double award,
    @JsonProperty("complexity")        double complexity,
    @JsonProperty("deadlineProximity") double deadlineProximity
) {
    public double total() {
        return semantic + award + complexity + deadlineProximity;
    }
}
